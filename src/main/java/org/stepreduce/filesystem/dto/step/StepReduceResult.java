package org.stepreduce.filesystem.dto.step;

import java.util.List;

/**
 * {@code step_reduce_preview} / {@code step_reduce_file} 的返回结果。
 *
 * @param rootId             输入文件所在 rootId
 * @param path               输入文件路径（相对 root，使用 '/' 分隔）
 * @param outputPath         写出的结果文件路径；预览时为 null
 * @param written            是否已写出结果文件
 * @param header             HEADER 摘要
 * @param inputBytes         输入字节数
 * @param outputBytes        输出字节数
 * @param byteReduction      字节缩减比例（0~1）
 * @param inputEntities      输入实体数
 * @param outputEntities     输出实体数
 * @param mergedEntities     合并掉的实体数
 * @param orphansRemoved     删除的孤立实体数
 * @param orphanRoots        孤立实体删除时找到的 GC 根实体数
 * @param equivalenceClasses 等价类数
 * @param iterations         等价迭代轮数
 * @param converged          等价迭代是否收敛
 * @param inputReferences    输入中的引用数
 * @param outputReferences   输出中的引用数
 * @param mergedByType       合并数最多的实体类型
 * @param outputSha256       输出内容的 sha256
 * @param elapsedMillis      精简耗时（毫秒）
 * @param warnings           告警（可能为 null）
 */
public record StepReduceResult(
        String rootId,
        String path,
        String outputPath,
        boolean written,
        StepHeaderInfo header,
        long inputBytes,
        long outputBytes,
        double byteReduction,
        int inputEntities,
        int outputEntities,
        int mergedEntities,
        int orphansRemoved,
        int orphanRoots,
        int equivalenceClasses,
        int iterations,
        boolean converged,
        long inputReferences,
        long outputReferences,
        List<StepEntityTypeCount> mergedByType,
        String outputSha256,
        long elapsedMillis,
        List<String> warnings
) {
}
