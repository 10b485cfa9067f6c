package org.stepreduce.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;
import org.stepreduce.step.ReduceOptions;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * STEP 精简服务配置（{@code app.reduce.*}）。
 * <p>
 * 分两部分：
 * <ul>
 *   <li>访问控制：{@link #roots} 白名单、{@link #allowSymlink}、{@link #allowWrite}、{@link #maxInputBytes}。</li>
 *   <li>精简默认选项：映射为 {@link ReduceOptions}，工具调用时可按参数逐项覆盖。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.reduce")
public class StepReduceProperties {

    /**
     * 允许访问的根目录白名单，依次分配 {@code rootId}：root0、root1...
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许访问符号链接（默认 false，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * 是否允许 {@code step_reduce_file} 写出结果文件。
     */
    private boolean allowWrite = true;

    /**
     * 单个输入文件的最大字节数；精简需要把整个文件读入内存。
     */
    @NotNull
    private DataSize maxInputBytes = DataSize.ofMegabytes(512);

    private boolean preserveHeaderComments = false;

    /**
     * 为 true 时拒绝 FILE_DESCRIPTION/FILE_NAME/FILE_SCHEMA 等常见类型之外的 HEADER 记录。
     */
    private boolean strictHeader = false;

    /**
     * 比较数字时按数值而非书写形式（{@code 1.0} 与 {@code 1.} 视为相同）。
     */
    private boolean normalizeNumbers = true;

    private boolean preserveIdentityTypes = true;

    @NotNull
    private List<String> identityTypes = ReduceOptions.DEFAULT_IDENTITY_TYPES;

    /**
     * 是否删除从 GC 根不可达的实体（默认关闭：会改变实体集合，超出“合并重复”的范围）。
     */
    private boolean removeOrphans = false;

    @NotNull
    private List<String> gcRootTypes = ReduceOptions.DEFAULT_GC_ROOT_TYPES;

    /**
     * 等价迭代中是否并行计算签名。
     */
    private boolean parallel = true;

    @Min(1)
    @Max(100_000_000)
    private int parallelThreshold = ReduceOptions.DEFAULT_PARALLEL_THRESHOLD;

    public ReduceOptions toReduceOptions() {
        return new ReduceOptions(
                preserveHeaderComments,
                strictHeader,
                normalizeNumbers,
                preserveIdentityTypes,
                new LinkedHashSet<>(identityTypes),
                removeOrphans,
                new LinkedHashSet<>(gcRootTypes),
                parallel,
                parallelThreshold
        );
    }

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public boolean isAllowWrite() {
        return allowWrite;
    }

    public void setAllowWrite(boolean allowWrite) {
        this.allowWrite = allowWrite;
    }

    public DataSize getMaxInputBytes() {
        return maxInputBytes;
    }

    public void setMaxInputBytes(DataSize maxInputBytes) {
        this.maxInputBytes = maxInputBytes;
    }

    public boolean isPreserveHeaderComments() {
        return preserveHeaderComments;
    }

    public void setPreserveHeaderComments(boolean preserveHeaderComments) {
        this.preserveHeaderComments = preserveHeaderComments;
    }

    public boolean isStrictHeader() {
        return strictHeader;
    }

    public void setStrictHeader(boolean strictHeader) {
        this.strictHeader = strictHeader;
    }

    public boolean isNormalizeNumbers() {
        return normalizeNumbers;
    }

    public void setNormalizeNumbers(boolean normalizeNumbers) {
        this.normalizeNumbers = normalizeNumbers;
    }

    public boolean isPreserveIdentityTypes() {
        return preserveIdentityTypes;
    }

    public void setPreserveIdentityTypes(boolean preserveIdentityTypes) {
        this.preserveIdentityTypes = preserveIdentityTypes;
    }

    public List<String> getIdentityTypes() {
        return identityTypes;
    }

    public void setIdentityTypes(List<String> identityTypes) {
        this.identityTypes = identityTypes;
    }

    public boolean isRemoveOrphans() {
        return removeOrphans;
    }

    public void setRemoveOrphans(boolean removeOrphans) {
        this.removeOrphans = removeOrphans;
    }

    public List<String> getGcRootTypes() {
        return gcRootTypes;
    }

    public void setGcRootTypes(List<String> gcRootTypes) {
        this.gcRootTypes = gcRootTypes;
    }

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }
}
