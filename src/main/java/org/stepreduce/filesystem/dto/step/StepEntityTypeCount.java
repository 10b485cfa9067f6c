package org.stepreduce.filesystem.dto.step;

/**
 * 按实体类型统计的合并数。
 *
 * @param type  实体类型名（复杂实体为 {@code (A,B,...)}）
 * @param count 该类型被合并掉的实体数
 */
public record StepEntityTypeCount(
        String type,
        int count
) {
}
