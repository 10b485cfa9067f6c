package org.stepreduce.step;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一个完整解析后的 STEP 文件：HEADER + DATA。
 * <p>
 * DATA 段以 {@link LinkedHashMap} 保存，迭代顺序即实体在源文件中的出现顺序（压缩时的稳定排序依据）。
 *
 * @param header        HEADER 段
 * @param dataStatement DATA 段起始语句原文（{@code DATA} 或带参数的 {@code DATA(...)}），输出时原样写回
 * @param entities      原始 id -> 实体（源文件顺序，只读）
 * @param offsets       原始 id -> 实体语句的字节偏移（用于报错定位）
 */
public record StepFile(
        StepHeader header,
        String dataStatement,
        Map<Integer, StepEntity> entities,
        Map<Integer, Integer> offsets
) {

    public StepFile {
        entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
        offsets = Collections.unmodifiableMap(new LinkedHashMap<>(offsets));
    }

    public int entityCount() {
        return entities.size();
    }
}
