package org.stepreduce.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.stepreduce.filesystem.HashingUtils;
import org.stepreduce.filesystem.SecurePathResolver;
import org.stepreduce.filesystem.StepReduceProperties;
import org.stepreduce.filesystem.dto.AllowedRootsResult;
import org.stepreduce.filesystem.dto.step.StepEntityTypeCount;
import org.stepreduce.filesystem.dto.step.StepHeaderInfo;
import org.stepreduce.filesystem.dto.step.StepReduceResult;
import org.stepreduce.step.ReduceOptions;
import org.stepreduce.step.ReductionResult;
import org.stepreduce.step.ReductionStats;
import org.stepreduce.step.StepHeader;
import org.stepreduce.step.StepReducer;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * STEP 精简 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code step_list_roots}）。</li>
 *   <li>预览精简效果（{@code step_reduce_preview}）：只在内存中精简，返回统计信息，不写任何文件。</li>
 *   <li>精简并写出（{@code step_reduce_file}）：结果先写临时文件再原子移动到目标路径，失败时输入文件与已有目标文件都不受影响。</li>
 * </ul>
 * 输入中的语法/结构错误以 {@link org.stepreduce.step.StepReduceException} 原样抛出，消息中带错误类别与字节偏移。
 */
@Component
public class StepReduceMcpTools {

    private static final Logger log = LoggerFactory.getLogger(StepReduceMcpTools.class);

    private static final int DEFAULT_MAX_MERGED_TYPES = 20;
    private static final int MAX_MERGED_TYPES = 500;

    private final StepReduceProperties properties;
    private final SecurePathResolver pathResolver;
    private final StepReducer reducer;

    public StepReduceMcpTools(StepReduceProperties properties, SecurePathResolver pathResolver, StepReducer reducer) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.reducer = reducer;
    }

    @Tool(
            name = "step_list_roots",
            description = "列出允许访问的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "step_reduce_preview",
            description = "在内存中无损精简 STEP(.stp/.step) 文件并返回统计信息（实体数、合并数、字节数、按类型的合并数），不写任何文件。"
    )
    public StepReduceResult previewReduce(
            @ToolParam(required = false, description = "rootId（可从 step_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "STEP 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "是否按数值比较数字（默认 app.reduce.normalize-numbers）") Boolean normalizeNumbers,
            @ToolParam(required = false, description = "是否保护带身份语义的实体类型不被合并（默认 app.reduce.preserve-identity-types）") Boolean preserveIdentityTypes,
            @ToolParam(required = false, description = "是否删除从 GC 根不可达的实体（默认 app.reduce.remove-orphans）") Boolean removeOrphans,
            @ToolParam(required = false, description = "返回合并数最多的前 N 个实体类型（默认 20，上限 500）") Integer maxMergedTypes
    ) {
        SecurePathResolver.ResolvedPath input = pathResolver.resolveStepInput(rootId, path);
        byte[] bytes = readInput(input);
        ReduceOptions options = resolveOptions(normalizeNumbers, preserveIdentityTypes, removeOrphans, null);

        ReductionResult result = reducer.reduce(bytes, options);
        List<String> warnings = new ArrayList<>();
        collectWarnings(result.stats(), options, warnings);
        return toResult(input, null, false, result, resolveMaxMergedTypes(maxMergedTypes), warnings);
    }

    @Tool(
            name = "step_reduce_file",
            description = "无损精简 STEP(.stp/.step) 文件并写出结果：合并语义相同的实体、改写引用、重新编号。默认写到同目录的 <文件名>.reduced.<扩展名>；目标已存在时需要 overwrite=true。"
    )
    public StepReduceResult reduceFile(
            @ToolParam(required = false, description = "rootId（可从 step_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "STEP 文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "输出文件路径（相对 rootId 或绝对路径；为空则写到输入文件旁的 *.reduced.*）") String outputPath,
            @ToolParam(required = false, description = "目标文件已存在时是否覆盖（默认 false）") Boolean overwrite,
            @ToolParam(required = false, description = "是否按数值比较数字（默认 app.reduce.normalize-numbers）") Boolean normalizeNumbers,
            @ToolParam(required = false, description = "是否保护带身份语义的实体类型不被合并（默认 app.reduce.preserve-identity-types）") Boolean preserveIdentityTypes,
            @ToolParam(required = false, description = "是否删除从 GC 根不可达的实体（默认 app.reduce.remove-orphans）") Boolean removeOrphans,
            @ToolParam(required = false, description = "是否保留 HEADER 段中的注释（默认 app.reduce.preserve-header-comments）") Boolean preserveHeaderComments
    ) {
        if (!properties.isAllowWrite()) {
            throw new IllegalStateException("服务端已禁用写入（app.reduce.allow-write=false）");
        }
        boolean overwriteTarget = Boolean.TRUE.equals(overwrite);
        SecurePathResolver.ResolvedPath input = pathResolver.resolveStepInput(rootId, path);
        SecurePathResolver.ResolvedPath output = pathResolver.resolveReduceOutput(input, outputPath, overwriteTarget);
        Path target = output.absolutePath();

        byte[] bytes = readInput(input);
        ReduceOptions options = resolveOptions(normalizeNumbers, preserveIdentityTypes, removeOrphans, preserveHeaderComments);
        ReductionResult result = reducer.reduce(bytes, options);

        try {
            writeAtomically(target, result.output(), overwriteTarget);
        } catch (IOException e) {
            throw new IllegalStateException("写出精简结果失败：" + output.displayPath(), e);
        }
        log.info("已写出精简结果：{} -> {}（{} -> {} 字节）",
                input.displayPath(), output.displayPath(), result.stats().inputBytes(), result.stats().outputBytes());

        List<String> warnings = new ArrayList<>();
        collectWarnings(result.stats(), options, warnings);
        return toResult(input, output.displayPath(), true, result, DEFAULT_MAX_MERGED_TYPES, warnings);
    }

    private byte[] readInput(SecurePathResolver.ResolvedPath input) {
        long maxBytes = properties.getMaxInputBytes().toBytes();
        try {
            long size = Files.size(input.absolutePath());
            if (size > maxBytes) {
                throw new IllegalArgumentException("文件过大（" + size + " 字节，上限 app.reduce.max-input-bytes="
                        + maxBytes + "）：" + input.displayPath());
            }
            return Files.readAllBytes(input.absolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + input.displayPath(), e);
        }
    }

    private ReduceOptions resolveOptions(Boolean normalizeNumbers, Boolean preserveIdentityTypes, Boolean removeOrphans,
                                         Boolean preserveHeaderComments) {
        ReduceOptions options = reducer.defaultOptions();
        if (normalizeNumbers != null) {
            options = options.withNormalizeNumbers(normalizeNumbers);
        }
        if (preserveIdentityTypes != null) {
            options = options.withPreserveIdentityTypes(preserveIdentityTypes);
        }
        if (removeOrphans != null) {
            options = options.withRemoveOrphans(removeOrphans);
        }
        if (preserveHeaderComments != null) {
            options = options.withPreserveHeaderComments(preserveHeaderComments);
        }
        return options;
    }

    private static int resolveMaxMergedTypes(Integer maxMergedTypes) {
        if (maxMergedTypes == null || maxMergedTypes <= 0) {
            return DEFAULT_MAX_MERGED_TYPES;
        }
        return Math.min(maxMergedTypes, MAX_MERGED_TYPES);
    }

    private static void collectWarnings(ReductionStats stats, ReduceOptions options, List<String> warnings) {
        if (!stats.converged()) {
            addWarningLimited(warnings, "等价迭代达到上限仍未收敛，剩余暂定等价类已直接视为最终结果。");
        }
        if (stats.outputEntities() == stats.inputEntities()) {
            addWarningLimited(warnings, "未发现可合并的重复实体，输出只做了重新编号与格式紧凑化。");
        }
        if (options.removeOrphans() && stats.orphanRoots() == 0) {
            addWarningLimited(warnings, "未找到 GC 根实体（app.reduce.gc-root-types），已跳过孤立实体删除。");
        }
    }

    private static StepReduceResult toResult(SecurePathResolver.ResolvedPath input, String outputPath, boolean written,
                                             ReductionResult result, int maxMergedTypes, List<String> warnings) {
        ReductionStats stats = result.stats();
        List<StepEntityTypeCount> mergedByType = new ArrayList<>();
        for (ReductionStats.TypeCount typeCount : stats.mergedByType()) {
            if (mergedByType.size() >= maxMergedTypes) {
                break;
            }
            mergedByType.add(new StepEntityTypeCount(typeCount.type(), typeCount.count()));
        }
        StepHeader header = result.header();
        return new StepReduceResult(
                input.rootId(),
                input.displayPath(),
                outputPath,
                written,
                new StepHeaderInfo(header.fileName(), header.descriptions(), header.schemas()),
                stats.inputBytes(),
                stats.outputBytes(),
                stats.byteReduction(),
                stats.inputEntities(),
                stats.outputEntities(),
                stats.mergedEntities(),
                stats.orphansRemoved(),
                stats.orphanRoots(),
                stats.equivalenceClasses(),
                stats.iterations(),
                stats.converged(),
                stats.inputReferences(),
                stats.outputReferences(),
                mergedByType,
                HashingUtils.sha256Hex(result.output()),
                stats.elapsedMillis(),
                warnings.isEmpty() ? null : warnings
        );
    }

    private static void addWarningLimited(List<String> warnings, String message) {
        final int maxWarnings = 20;
        if (warnings.size() < maxWarnings) {
            warnings.add(message);
        }
    }

    private static void writeAtomically(Path target, byte[] bytes, boolean overwrite) throws IOException {
        // 先写同目录临时文件（同一文件系统），再 move 到目标；不支持 ATOMIC_MOVE 时降级为普通 move
        Path tmp = Files.createTempFile(target.getParent(), "step-reduce-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                if (overwrite) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } else {
                    Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
                }
            } catch (AtomicMoveNotSupportedException e) {
                if (overwrite) {
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.move(tmp, target);
                }
            }
        } finally {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("清理临时文件失败：{}", tmp, e);
            }
        }
    }
}
