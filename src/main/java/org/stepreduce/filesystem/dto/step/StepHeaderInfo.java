package org.stepreduce.filesystem.dto.step;

import java.util.List;

/**
 * HEADER 段摘要（已解码 {@code \X2\...\X0\} 等转义）。
 *
 * @param fileName     FILE_NAME 的 name 字段
 * @param descriptions FILE_DESCRIPTION 的描述列表
 * @param schemas      FILE_SCHEMA 声明的 schema 列表
 */
public record StepHeaderInfo(
        String fileName,
        List<String> descriptions,
        List<String> schemas
) {
}
