package org.stepreduce.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 孤立实体删除：从 GC 根类型的实体出发沿引用遍历，删除不可达的实体。
 * <p>
 * 文件中一个根都找不到时不做任何删除（宁可保守，也不把整个模型删空）。
 * 复杂实体只要有一个分部类型是根类型，就视为根。
 */
public final class OrphanRemover {

    private static final Logger log = LoggerFactory.getLogger(OrphanRemover.class);

    public record Result(Map<Integer, StepEntity> entities, int removed, int roots) {
    }

    private OrphanRemover() {
    }

    public static Result removeOrphans(Map<Integer, StepEntity> entities, Set<String> gcRootTypes) {
        Deque<Integer> pending = new ArrayDeque<>();
        Set<Integer> reachable = new HashSet<>();
        for (StepEntity entity : entities.values()) {
            if (isRoot(entity, gcRootTypes) && reachable.add(entity.id())) {
                pending.add(entity.id());
            }
        }
        int roots = reachable.size();
        if (roots == 0) {
            log.info("未找到 GC 根实体，跳过孤立实体删除");
            return new Result(entities, 0, 0);
        }

        ReferenceExtractor extractor = new ReferenceExtractor();
        while (!pending.isEmpty()) {
            StepEntity entity = entities.get(pending.poll());
            if (entity == null) {
                continue;
            }
            for (int ref : extractor.references(entity)) {
                if (reachable.add(ref)) {
                    pending.add(ref);
                }
            }
        }

        Map<Integer, StepEntity> kept = new LinkedHashMap<>();
        for (StepEntity entity : entities.values()) {
            if (reachable.contains(entity.id())) {
                kept.put(entity.id(), entity);
            }
        }
        int removed = entities.size() - kept.size();
        log.debug("孤立实体删除：roots={}, kept={}, removed={}", roots, kept.size(), removed);
        return new Result(Collections.unmodifiableMap(kept), removed, roots);
    }

    private static boolean isRoot(StepEntity entity, Set<String> gcRootTypes) {
        for (StepValue.StepTyped part : entity.parts()) {
            if (gcRootTypes.contains(part.type())) {
                return true;
            }
        }
        return false;
    }
}
