package org.stepreduce.step;

import java.util.List;

/**
 * 一次精简的统计信息。
 *
 * @param inputBytes         输入字节数
 * @param outputBytes        输出字节数
 * @param inputEntities      输入实体数
 * @param outputEntities     输出实体数
 * @param mergedEntities     因等价而被合并掉的实体数
 * @param orphansRemoved     被删除的孤立实体数（未启用时为 0）
 * @param orphanRoots        孤立实体删除时找到的 GC 根实体数（未启用时为 0；为 0 表示没有做任何删除）
 * @param equivalenceClasses 等价类数
 * @param iterations         等价迭代轮数
 * @param converged          等价迭代是否在上限之前收敛
 * @param inputReferences    输入 DATA 段中的引用总数（原文扫描，含重复）
 * @param outputReferences   输出中的引用总数
 * @param mergedByType       按实体类型统计的合并数（降序）
 * @param elapsedMillis      耗时（毫秒）
 */
public record ReductionStats(
        long inputBytes,
        long outputBytes,
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
        List<TypeCount> mergedByType,
        long elapsedMillis
) {

    public record TypeCount(String type, int count) {
    }

    public ReductionStats {
        mergedByType = (mergedByType == null) ? List.of() : List.copyOf(mergedByType);
    }

    /**
     * 输出相对输入缩小的比例（0~1）；输入为空时为 0。
     */
    public double byteReduction() {
        if (inputBytes <= 0) {
            return 0d;
        }
        return Math.max(0d, 1d - (double) outputBytes / inputBytes);
    }
}
