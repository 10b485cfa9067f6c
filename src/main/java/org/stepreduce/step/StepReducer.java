package org.stepreduce.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * STEP 无损精简入口。
 * <p>
 * 流水线（各阶段顺序执行，每个阶段消费上一阶段的完整输出）：
 * <ol>
 *   <li>按 ISO-8859-1 解码（字符偏移 = 字节偏移，任何字节都能原样写回）</li>
 *   <li>词法切分 + 实体解析 + 悬空引用校验</li>
 *   <li>等价划分（迭代到不动点）</li>
 *   <li>引用改写：只保留代表</li>
 *   <li>（可选）删除孤立实体</li>
 *   <li>压缩重编号 1..k</li>
 *   <li>序列化</li>
 * </ol>
 * 任一阶段出错立即抛出，不产生部分输出。
 */
public final class StepReducer {

    private static final Logger log = LoggerFactory.getLogger(StepReducer.class);

    private final ReduceOptions defaultOptions;

    public StepReducer() {
        this(ReduceOptions.defaults());
    }

    public StepReducer(ReduceOptions defaultOptions) {
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
    }

    public ReduceOptions defaultOptions() {
        return defaultOptions;
    }

    public ReductionResult reduce(byte[] input) {
        return reduce(input, defaultOptions);
    }

    public ReductionResult reduce(byte[] input, ReduceOptions options) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(options, "options");
        long startNanos = System.nanoTime();

        String text = new String(input, StandardCharsets.ISO_8859_1);
        StepFile file = StepEntityParser.parseFile(text, options.strictHeader());
        long parsedNanos = System.nanoTime();

        EquivalenceEngine.Resolution resolution = EquivalenceEngine.fromOptions(options).resolve(file);
        long resolvedNanos = System.nanoTime();

        Map<Integer, StepEntity> survivors = ReferenceRewriter.rewrite(file, resolution);
        int orphansRemoved = 0;
        int orphanRoots = 0;
        if (options.removeOrphans()) {
            OrphanRemover.Result orphans = OrphanRemover.removeOrphans(survivors, options.gcRootTypes());
            survivors = orphans.entities();
            orphansRemoved = orphans.removed();
            orphanRoots = orphans.roots();
        }
        EntityCompactor.Compaction compaction = EntityCompactor.compact(survivors, resolution.representativeOf());

        String outputText = StepSerializer.serialize(file.header(), file.dataStatement(), compaction.entities(),
                options.preserveHeaderComments());
        byte[] output = outputText.getBytes(StandardCharsets.ISO_8859_1);
        long doneNanos = System.nanoTime();

        ReductionStats stats = new ReductionStats(
                input.length,
                output.length,
                file.entityCount(),
                compaction.entities().size(),
                resolution.mergedEntities(),
                orphansRemoved,
                orphanRoots,
                resolution.classes().size(),
                resolution.iterations(),
                resolution.converged(),
                referenceCensus(text, file.entityCount()),
                referenceCensus(outputText, compaction.entities().size()),
                mergedByType(file, resolution),
                (doneNanos - startNanos) / 1_000_000L
        );

        log.info("STEP 精简完成：entities {} -> {}（合并 {}，孤立 {}），bytes {} -> {}，迭代 {} 轮，耗时 {}ms",
                stats.inputEntities(), stats.outputEntities(), stats.mergedEntities(), stats.orphansRemoved(),
                stats.inputBytes(), stats.outputBytes(), stats.iterations(), stats.elapsedMillis());
        if (log.isDebugEnabled()) {
            log.debug("阶段耗时：parse={}ms, equivalence={}ms, rewrite+serialize={}ms",
                    (parsedNanos - startNanos) / 1_000_000L,
                    (resolvedNanos - parsedNanos) / 1_000_000L,
                    (doneNanos - resolvedNanos) / 1_000_000L);
        }
        return new ReductionResult(output, stats, file.header(), compaction.mapping());
    }

    /**
     * 原文中 {@code #数字} 的出现次数减去实体定义左侧的 id。
     */
    private static long referenceCensus(String text, int entityCount) {
        int occurrences = ReferenceExtractor.forEachReference(text, id -> {
        });
        return Math.max(0, occurrences - entityCount);
    }

    private static List<ReductionStats.TypeCount> mergedByType(StepFile file, EquivalenceEngine.Resolution resolution) {
        Map<String, Integer> counts = new HashMap<>();
        for (EquivalenceClass equivalenceClass : resolution.classes()) {
            if (equivalenceClass.size() > 1) {
                String type = file.entities().get(equivalenceClass.representative()).typeName();
                counts.merge(type, equivalenceClass.size() - 1, Integer::sum);
            }
        }
        List<ReductionStats.TypeCount> out = new ArrayList<>(counts.size());
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            out.add(new ReductionStats.TypeCount(e.getKey(), e.getValue()));
        }
        out.sort(Comparator.comparingInt(ReductionStats.TypeCount::count).reversed()
                .thenComparing(ReductionStats.TypeCount::type));
        return out;
    }
}
