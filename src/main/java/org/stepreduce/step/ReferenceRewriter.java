package org.stepreduce.step;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntUnaryOperator;

/**
 * 引用改写：只保留每个等价类的代表，并把所有引用指向代表。
 * <p>
 * 纯函数，不修改输入；输出实体数等于等价类数，任何引用都必须落在保留下来的代表上，
 * 否则说明等价划分本身有缺陷（{@link ReductionDefectException}）。
 */
public final class ReferenceRewriter {

    private ReferenceRewriter() {
    }

    /**
     * @return 代表原始 id -> 改写后的实体（按代表在源文件中的出现顺序）
     */
    public static Map<Integer, StepEntity> rewrite(StepFile file, EquivalenceEngine.Resolution resolution) {
        Map<Integer, Integer> representativeOf = resolution.representativeOf();
        if (representativeOf.size() != file.entityCount()) {
            throw new ReductionDefectException("等价划分覆盖 " + representativeOf.size()
                    + " 个实体，源文件有 " + file.entityCount() + " 个");
        }

        Map<Integer, StepEntity> survivors = new LinkedHashMap<>();
        for (StepEntity entity : file.entities().values()) {
            Integer rep = representativeOf.get(entity.id());
            if (rep == null) {
                throw new ReductionDefectException("实体 #" + entity.id() + " 不属于任何等价类");
            }
            if (rep != entity.id()) {
                continue;
            }
            survivors.put(entity.id(), mapReferences(entity, id -> {
                Integer target = representativeOf.get(id);
                if (target == null) {
                    throw new ReductionDefectException("实体 #" + entity.id() + " 引用了未分类的 #" + id);
                }
                return target;
            }));
        }

        if (survivors.size() != resolution.classes().size()) {
            throw new ReductionDefectException("保留实体数 " + survivors.size()
                    + " 与等价类数 " + resolution.classes().size() + " 不一致");
        }
        verifyClosed(survivors);
        return Collections.unmodifiableMap(survivors);
    }

    /**
     * 校验实体集合对引用封闭：每个引用都指向集合中的实体。
     */
    static void verifyClosed(Map<Integer, StepEntity> entities) {
        ReferenceExtractor extractor = new ReferenceExtractor();
        for (StepEntity entity : entities.values()) {
            for (int ref : extractor.references(entity)) {
                if (!entities.containsKey(ref)) {
                    throw new ReductionDefectException("改写后实体 #" + entity.id() + " 引用了不存在的 #" + ref);
                }
            }
        }
    }

    /**
     * 对实体中的每个引用应用 {@code mapping}，返回新实体（id 不变）。
     */
    static StepEntity mapReferences(StepEntity entity, IntUnaryOperator mapping) {
        List<StepValue.StepTyped> parts = new ArrayList<>(entity.parts().size());
        for (StepValue.StepTyped part : entity.parts()) {
            parts.add(mapTyped(part, mapping));
        }
        return entity.withParts(parts);
    }

    private static StepValue.StepTyped mapTyped(StepValue.StepTyped typed, IntUnaryOperator mapping) {
        return new StepValue.StepTyped(typed.type(), mapAll(typed.args(), mapping));
    }

    private static List<StepValue> mapAll(List<StepValue> values, IntUnaryOperator mapping) {
        List<StepValue> out = new ArrayList<>(values.size());
        for (StepValue value : values) {
            out.add(mapValue(value, mapping));
        }
        return out;
    }

    private static StepValue mapValue(StepValue value, IntUnaryOperator mapping) {
        if (value instanceof StepValue.StepRef ref) {
            int target = mapping.applyAsInt(ref.id());
            return target == ref.id() ? ref : new StepValue.StepRef(target);
        }
        if (value instanceof StepValue.StepList list) {
            return new StepValue.StepList(mapAll(list.items(), mapping));
        }
        if (value instanceof StepValue.StepTyped typed) {
            return mapTyped(typed, mapping);
        }
        return value;
    }
}
