package org.stepreduce.step;

/**
 * STEP 压缩过程中由输入导致的错误。
 * <p>
 * 任一阶段遇到第一个错误即中止整个压缩流程，不会产生部分输出。
 * 消息中始终包含错误类别；若能定位，还包含字节偏移（输入按 ISO-8859-1 解码，字符偏移即字节偏移）。
 */
public class StepReduceException extends RuntimeException {

    private final ErrorKind kind;
    private final Integer offset;
    private final Integer entityId;

    public StepReduceException(ErrorKind kind, String message, Integer offset, Integer entityId) {
        super(format(kind, message, offset));
        this.kind = kind;
        this.offset = offset;
        this.entityId = entityId;
    }

    public static StepReduceException malformed(String message, int offset) {
        return new StepReduceException(ErrorKind.MALFORMED_RECORD, message, offset, null);
    }

    public static StepReduceException unexpected(String expected, String found, int offset) {
        return new StepReduceException(
                ErrorKind.UNEXPECTED_TOKEN,
                "期望 " + expected + "，实际为 " + found,
                offset,
                null
        );
    }

    public static StepReduceException dangling(int referencingId, int missingId, Integer offset) {
        return new StepReduceException(
                ErrorKind.DANGLING_REFERENCE,
                "实体 #" + referencingId + " 引用了不存在的实体 #" + missingId,
                offset,
                missingId
        );
    }

    public static StepReduceException unsupported(String message, Integer offset) {
        return new StepReduceException(ErrorKind.UNSUPPORTED_CONSTRUCT, message, offset, null);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * 出错位置的字节偏移；无法定位时为 null。
     */
    public Integer getOffset() {
        return offset;
    }

    /**
     * 与错误相关的实体 id（例如悬空引用的目标 id）；没有时为 null。
     */
    public Integer getEntityId() {
        return entityId;
    }

    private static String format(ErrorKind kind, String message, Integer offset) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind).append("] ").append(message);
        if (offset != null) {
            sb.append("（字节偏移 ").append(offset).append('）');
        }
        return sb.toString();
    }
}
