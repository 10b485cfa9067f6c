package org.stepreduce.step;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 原始 id -> 压缩后 id。
 * <p>
 * 由“原始 id -> 代表 id”与“代表 id -> 压缩 id”两步复合而成，每次精简只构建一次。
 * 被删除的孤立实体没有压缩 id。
 */
public final class IdMapping {

    private final Map<Integer, Integer> representativeOf;
    private final Map<Integer, Integer> compactedByRepresentative;

    IdMapping(Map<Integer, Integer> representativeOf, Map<Integer, Integer> compactedByRepresentative) {
        this.representativeOf = Collections.unmodifiableMap(representativeOf);
        this.compactedByRepresentative = Collections.unmodifiableMap(compactedByRepresentative);
    }

    public OptionalInt compactedId(int originalId) {
        Integer rep = representativeOf.get(originalId);
        if (rep == null) {
            return OptionalInt.empty();
        }
        Integer compacted = compactedByRepresentative.get(rep);
        return compacted == null ? OptionalInt.empty() : OptionalInt.of(compacted);
    }
}
