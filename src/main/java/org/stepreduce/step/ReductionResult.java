package org.stepreduce.step;

/**
 * 精简结果：输出字节 + 统计 + 供调用方查询的 HEADER 与 id 映射。
 */
public record ReductionResult(byte[] output, ReductionStats stats, StepHeader header, IdMapping mapping) {
}
