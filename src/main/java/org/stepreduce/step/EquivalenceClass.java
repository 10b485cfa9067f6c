package org.stepreduce.step;

import java.util.List;

/**
 * 一组语义相同的实体，代表 id 为成员中最小的原始 id。
 *
 * @param representative 代表 id（压缩后唯一保留的实体）
 * @param members        全部成员的原始 id（升序，包含代表）
 */
public record EquivalenceClass(int representative, List<Integer> members) {

    public EquivalenceClass {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
