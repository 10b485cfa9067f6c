package org.stepreduce.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 压缩：按保留实体在源文件中的首次出现顺序重新编号为 1..k，并同步改写引用。
 */
public final class EntityCompactor {

    public record Compaction(List<StepEntity> entities, IdMapping mapping) {
    }

    private EntityCompactor() {
    }

    /**
     * @param survivors        代表原始 id -> 实体（源文件顺序，引用已指向代表）
     * @param representativeOf 原始 id -> 代表 id
     */
    public static Compaction compact(Map<Integer, StepEntity> survivors, Map<Integer, Integer> representativeOf) {
        Map<Integer, Integer> compactedByRep = new LinkedHashMap<>(Math.max(16, survivors.size() * 4 / 3 + 1));
        int next = 1;
        for (Integer id : survivors.keySet()) {
            compactedByRep.put(id, next++);
        }

        List<StepEntity> out = new ArrayList<>(survivors.size());
        for (StepEntity entity : survivors.values()) {
            StepEntity renumbered = ReferenceRewriter.mapReferences(entity, id -> {
                Integer compacted = compactedByRep.get(id);
                if (compacted == null) {
                    throw new ReductionDefectException("实体 #" + entity.id() + " 引用的 #" + id + " 没有被保留");
                }
                return compacted;
            });
            out.add(renumbered.withId(compactedByRep.get(entity.id())));
        }
        return new Compaction(Collections.unmodifiableList(out), new IdMapping(representativeOf, compactedByRep));
    }
}
