package org.stepreduce.filesystem.dto;

import java.util.List;

/**
 * {@code step_list_roots} 的返回结果。
 */
public record AllowedRootsResult(List<AllowedRoot> roots) {
}
