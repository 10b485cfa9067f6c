package org.stepreduce.step;

import java.util.List;

/**
 * 把精简后的实体写回 STEP 物理文件。
 * <p>
 * 输出格式固定：HEADER 记录原样写回（可选地连同记录前与记录内的注释），实体使用无空白的紧凑语法，
 * 字符串与数字保留原始写法，行分隔符为 {@code \n}。同样的输入总是得到逐字节相同的输出。
 */
public final class StepSerializer {

    private static final String NL = "\n";

    private StepSerializer() {
    }

    public static String serialize(StepHeader header, String dataStatement, List<StepEntity> entities, boolean preserveHeaderComments) {
        StringBuilder out = new StringBuilder(estimateSize(header, entities));
        out.append("ISO-10303-21;").append(NL);
        out.append("HEADER;").append(NL);
        for (StepRecord record : header.records()) {
            if (preserveHeaderComments) {
                for (String comment : record.comments()) {
                    out.append(comment).append(NL);
                }
            }
            out.append(preserveHeaderComments ? record.source() : record.text()).append(';').append(NL);
        }
        out.append("ENDSEC;").append(NL);
        out.append(dataStatement).append(';').append(NL);
        StepValueWriter.RefHandler refs = (sb, id) -> sb.append('#').append(id);
        for (StepEntity entity : entities) {
            out.append('#').append(entity.id()).append('=');
            StepValueWriter.appendBody(out, entity, refs, false);
            out.append(';').append(NL);
        }
        out.append("ENDSEC;").append(NL);
        out.append("END-ISO-10303-21;").append(NL);
        return out.toString();
    }

    /**
     * 单个实体的紧凑写法（不含结尾的 ';'），例如 {@code #3=FOO(#1,'a')}。
     */
    public static String formatEntity(StepEntity entity) {
        StringBuilder sb = new StringBuilder(64);
        sb.append('#').append(entity.id()).append('=');
        StepValueWriter.appendBody(sb, entity, (out, id) -> out.append('#').append(id), false);
        return sb.toString();
    }

    private static int estimateSize(StepHeader header, List<StepEntity> entities) {
        long estimate = 256L + header.records().size() * 80L + entities.size() * 48L;
        return (int) Math.min(estimate, 1 << 26);
    }
}
