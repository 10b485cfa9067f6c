package org.stepreduce.step;

import java.util.List;

/**
 * 把 {@link StepValue} 按 STEP 紧凑语法写入 {@link StringBuilder}（无空白）。
 * <p>
 * 引用如何写出由 {@link RefHandler} 决定：序列化时写压缩后的新 id，计算签名时写等价类代表，
 * 构建签名模板时则在引用处切分片段。
 */
final class StepValueWriter {

    @FunctionalInterface
    interface RefHandler {
        void write(StringBuilder out, int id);
    }

    private StepValueWriter() {
    }

    /**
     * 写出实体等号右侧部分：{@code TYPE(args)} 或 {@code (A(args)B(args))}。
     */
    static void appendBody(StringBuilder out, StepEntity entity, RefHandler refs, boolean normalizeNumbers) {
        if (entity.complex()) {
            out.append('(');
            for (StepValue.StepTyped part : entity.parts()) {
                appendTyped(out, part, refs, normalizeNumbers);
            }
            out.append(')');
        } else {
            appendTyped(out, entity.parts().get(0), refs, normalizeNumbers);
        }
    }

    static void appendTyped(StringBuilder out, StepValue.StepTyped typed, RefHandler refs, boolean normalizeNumbers) {
        out.append(typed.type()).append('(');
        appendAll(out, typed.args(), refs, normalizeNumbers);
        out.append(')');
    }

    private static void appendAll(StringBuilder out, List<StepValue> values, RefHandler refs, boolean normalizeNumbers) {
        for (int i = 0, n = values.size(); i < n; i++) {
            if (i > 0) {
                out.append(',');
            }
            appendValue(out, values.get(i), refs, normalizeNumbers);
        }
    }

    static void appendValue(StringBuilder out, StepValue value, RefHandler refs, boolean normalizeNumbers) {
        if (value instanceof StepValue.StepRef ref) {
            refs.write(out, ref.id());
        } else if (value instanceof StepValue.StepNumber number) {
            out.append(normalizeNumbers ? NumberNormalizer.normalize(number.raw()) : number.raw());
        } else if (value instanceof StepValue.StepString string) {
            out.append('\'').append(string.raw()).append('\'');
        } else if (value instanceof StepValue.StepEnum enumValue) {
            out.append('.').append(enumValue.name()).append('.');
        } else if (value instanceof StepValue.StepList list) {
            out.append('(');
            appendAll(out, list.items(), refs, normalizeNumbers);
            out.append(')');
        } else if (value instanceof StepValue.StepTyped typed) {
            appendTyped(out, typed, refs, normalizeNumbers);
        } else if (value instanceof StepValue.StepOmitted) {
            out.append('$');
        } else if (value instanceof StepValue.StepDerived) {
            out.append('*');
        } else {
            throw new IllegalArgumentException("未知的参数值类型：" + value);
        }
    }
}
