package org.stepreduce.step;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * 等价引擎：找出语义相同的实体并划分等价类。
 * <p>
 * 两个实体等价，当且仅当类型相同，且把参数中的每个引用替换为被引用实体当前所在等价类的代表之后，参数列表完全相同。
 * 由于被引用实体的归属本身也在变化，这个定义需要迭代到不动点：
 * <ol>
 *   <li>初始化：引用保持原始 id 计算签名，签名相同的实体进入同一个暂定类。</li>
 *   <li>迭代：用上一轮划分的代表替换引用重新计算签名，再按签名重新分组（既可能拆分也可能合并）。
 *       每一轮都是“旧划分 -> 新划分”的纯函数，签名计算可以并行，分组在全部签名算完之后进行。</li>
 *   <li>终止：新旧划分相同即为不动点；迭代次数上限为实体总数，达到上限时仍为 TENTATIVE 的实体
 *       （最后一轮所在类仍在变化）直接视为 FINAL。</li>
 * </ol>
 * 代表选择：类中原始 id 最小的实体，与迭代顺序无关，结果可复现。
 * <p>
 * 签名模板：每个实体的签名在引用处切成若干固定片段，只需在初始化时构建一次（数字规范化也只做一次），
 * 每轮迭代只做片段拼接。
 */
public final class EquivalenceEngine {

    private static final Logger log = LoggerFactory.getLogger(EquivalenceEngine.class);

    /**
     * 实体在迭代过程中的状态：初始化前 UNRESOLVED，进入暂定类后 TENTATIVE，
     * 所在类在一轮迭代中不再变化后 FINAL。
     */
    private enum EntityState {
        UNRESOLVED,
        TENTATIVE,
        FINAL
    }

    /**
     * 等价划分结果。
     *
     * @param classes          全部等价类（按代表在源文件中的出现顺序），每个原始 id 恰好出现一次
     * @param representativeOf 原始 id -> 代表 id
     * @param iterations       初始化之后执行的迭代轮数
     * @param converged        是否在上限之前到达不动点
     * @param forcedFinal      达到迭代上限时仍未稳定、被直接视为最终结果的实体数
     */
    public record Resolution(
            List<EquivalenceClass> classes,
            Map<Integer, Integer> representativeOf,
            int iterations,
            boolean converged,
            int forcedFinal
    ) {
        public int mergedEntities() {
            return representativeOf.size() - classes.size();
        }
    }

    private final boolean normalizeNumbers;
    private final Set<String> identityTypes;
    private final boolean parallel;
    private final int parallelThreshold;

    public EquivalenceEngine(boolean normalizeNumbers, Set<String> identityTypes, boolean parallel, int parallelThreshold) {
        this.normalizeNumbers = normalizeNumbers;
        this.identityTypes = (identityTypes == null) ? Set.of() : Set.copyOf(identityTypes);
        this.parallel = parallel;
        this.parallelThreshold = Math.max(1, parallelThreshold);
    }

    public static EquivalenceEngine fromOptions(ReduceOptions options) {
        return new EquivalenceEngine(
                options.normalizeNumbers(),
                options.preserveIdentityTypes() ? options.identityTypes() : Set.of(),
                options.parallel(),
                options.parallelThreshold()
        );
    }

    public Resolution resolve(StepFile file) {
        return resolve(file, Math.max(1, file.entityCount()));
    }

    /**
     * @param cap 迭代轮数上限；达到上限时仍为 TENTATIVE 的实体直接视为 FINAL
     */
    Resolution resolve(StepFile file, int cap) {
        List<StepEntity> entities = new ArrayList<>(file.entities().values());
        int n = entities.size();
        int[] ids = new int[n];
        Map<Integer, Integer> indexById = new HashMap<>(Math.max(16, n * 4 / 3 + 1));
        for (int k = 0; k < n; k++) {
            ids[k] = entities.get(k).id();
            indexById.put(ids[k], k);
        }

        EntityState[] states = new EntityState[n];
        Arrays.fill(states, EntityState.UNRESOLVED);

        SignatureTemplate[] templates = new SignatureTemplate[n];
        for (int k = 0; k < n; k++) {
            templates[k] = buildTemplate(entities.get(k), indexById);
        }

        // 初始化：离散划分下“代表 = 自身”，签名里的引用即原始 id
        Partition current = step(Partition.discrete(n), templates, ids);
        Arrays.fill(states, EntityState.TENTATIVE);
        log.debug("初始化：entities={}, classes={}", n, current.classCount());

        int iterations = 0;
        boolean converged = false;
        while (iterations < cap) {
            Partition next = step(current, templates, ids);
            iterations++;
            settle(current, next, states);
            if (next.equals(current)) {
                converged = true;
                break;
            }
            log.debug("第 {} 轮：classes {} -> {}", iterations, current.classCount(), next.classCount());
            current = next;
        }

        int forcedFinal = 0;
        for (int k = 0; k < n; k++) {
            if (states[k] == EntityState.TENTATIVE) {
                forcedFinal++;
                states[k] = EntityState.FINAL;
            }
        }
        if (!converged) {
            log.warn("等价迭代达到上限 {} 轮仍未收敛，{} 个实体的暂定划分直接视为最终结果", cap, forcedFinal);
        }

        return buildResolution(current, ids, iterations, converged, forcedFinal);
    }

    /**
     * 按本轮划分差异更新状态：代表未变的实体为 FINAL，代表变化的实体（连同其新旧类的成员）回到 TENTATIVE。
     */
    private static void settle(Partition previous, Partition latest, EntityState[] states) {
        boolean[] changedClass = new boolean[states.length];
        for (int k = 0; k < states.length; k++) {
            if (previous.representative(k) != latest.representative(k)) {
                changedClass[previous.representative(k)] = true;
                changedClass[latest.representative(k)] = true;
            }
        }
        for (int k = 0; k < states.length; k++) {
            boolean changed = changedClass[previous.representative(k)] || changedClass[latest.representative(k)];
            states[k] = changed ? EntityState.TENTATIVE : EntityState.FINAL;
        }
    }

    /**
     * 一轮迭代：旧划分 -> 新划分（纯函数，不修改入参）。
     */
    Partition step(Partition previous, SignatureTemplate[] templates, int[] ids) {
        int n = templates.length;
        String[] signatures = new String[n];
        if (parallel && n >= parallelThreshold) {
            IntStream.range(0, n).parallel().forEach(k -> signatures[k] = templates[k].build(previous, ids));
        } else {
            for (int k = 0; k < n; k++) {
                signatures[k] = templates[k].build(previous, ids);
            }
        }

        Map<String, Integer> representativeBySignature = new HashMap<>(Math.max(16, n * 4 / 3 + 1));
        for (int k = 0; k < n; k++) {
            representativeBySignature.merge(signatures[k], k, (a, b) -> ids[a] <= ids[b] ? a : b);
        }
        int[] reps = new int[n];
        for (int k = 0; k < n; k++) {
            reps[k] = representativeBySignature.get(signatures[k]);
        }
        return new Partition(reps);
    }

    private SignatureTemplate buildTemplate(StepEntity entity, Map<Integer, Integer> indexById) {
        StringBuilder sb = new StringBuilder(64);
        if (identityTypes.contains(entity.typeName())) {
            // 带身份语义的实体：签名带上自身 id，永远不会与其他实体合并
            sb.append('@').append(entity.id()).append('|');
        }
        List<String> fragments = new ArrayList<>();
        int[][] refs = {new int[4]};
        int[] refCount = {0};
        StepValueWriter.appendBody(sb, entity, (out, id) -> {
            Integer index = indexById.get(id);
            if (index == null) {
                throw new ReductionDefectException("实体 #" + entity.id() + " 的引用 #" + id + " 未在解析阶段被拦截");
            }
            fragments.add(out.toString());
            out.setLength(0);
            if (refCount[0] == refs[0].length) {
                refs[0] = Arrays.copyOf(refs[0], refCount[0] * 2);
            }
            refs[0][refCount[0]++] = index;
        }, normalizeNumbers);
        fragments.add(sb.toString());
        return new SignatureTemplate(fragments.toArray(new String[0]), Arrays.copyOf(refs[0], refCount[0]));
    }

    private static Resolution buildResolution(Partition partition, int[] ids, int iterations, boolean converged, int forcedFinal) {
        int n = partition.size();
        Map<Integer, List<Integer>> membersByRep = new LinkedHashMap<>();
        Map<Integer, Integer> representativeOf = new LinkedHashMap<>(Math.max(16, n * 4 / 3 + 1));
        for (int k = 0; k < n; k++) {
            int rep = partition.representative(k);
            if (partition.representative(rep) != rep) {
                throw new ReductionDefectException("实体 #" + ids[k] + " 的代表 #" + ids[rep] + " 不是其所在类的代表");
            }
            if (representativeOf.put(ids[k], ids[rep]) != null) {
                throw new ReductionDefectException("实体 #" + ids[k] + " 被分配到了多个等价类");
            }
            membersByRep.computeIfAbsent(rep, r -> new ArrayList<>()).add(ids[k]);
        }

        List<EquivalenceClass> classes = new ArrayList<>(membersByRep.size());
        for (Map.Entry<Integer, List<Integer>> entry : membersByRep.entrySet()) {
            List<Integer> members = entry.getValue();
            Collections.sort(members);
            int representative = ids[entry.getKey()];
            if (members.get(0) != representative) {
                throw new ReductionDefectException("等价类代表 #" + representative + " 不是最小成员 #" + members.get(0));
            }
            classes.add(new EquivalenceClass(representative, members));
        }
        return new Resolution(
                Collections.unmodifiableList(classes),
                Collections.unmodifiableMap(representativeOf),
                iterations,
                converged,
                forcedFinal
        );
    }

    /**
     * 签名模板：{@code fragments[0] #ref0 fragments[1] #ref1 ... fragments[m]}。
     */
    static final class SignatureTemplate {
        private final String[] fragments;
        private final int[] refs;
        private final int length;

        SignatureTemplate(String[] fragments, int[] refs) {
            this.fragments = fragments;
            this.refs = refs;
            int total = 0;
            for (String fragment : fragments) {
                total += fragment.length();
            }
            this.length = total + refs.length * 8;
        }

        String build(Partition partition, int[] ids) {
            if (refs.length == 0) {
                return fragments[0];
            }
            StringBuilder sb = new StringBuilder(length);
            for (int r = 0; r < refs.length; r++) {
                sb.append(fragments[r]).append('#').append(ids[partition.representative(refs[r])]);
            }
            return sb.append(fragments[refs.length]).toString();
        }
    }
}
