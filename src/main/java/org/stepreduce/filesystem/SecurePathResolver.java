package org.stepreduce.filesystem;

import org.stepreduce.filesystem.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * STEP 文件路径解析器：把工具参数解析为 {@code app.reduce.roots} 白名单内的 STEP 输入文件与精简结果的写出目标。
 * <p>
 * 输入文件（{@link #resolveStepInput}）：
 * <ul>
 *   <li>必须存在、是普通文件，扩展名为 {@code .stp}/{@code .step}/{@code .p21}。</li>
 *   <li>路径穿越（{@code ../}）与符号链接/junction 逃逸会被拒绝；{@code allow-symlink=false} 时直接拒绝符号链接。</li>
 * </ul>
 * 写出目标（{@link #resolveReduceOutput}）：
 * <ul>
 *   <li>未指定时为输入文件旁的 {@code <文件名>.reduced.<扩展名>}，与输入同一个 root。</li>
 *   <li>目标必须是 STEP 扩展名，父目录必须已存在；目标尚不存在时只校验已存在的父目录链路。</li>
 *   <li>目标已存在（包括目标就是输入文件本身）时必须显式 {@code overwrite=true}。</li>
 * </ul>
 */
public class SecurePathResolver {

    public static final List<String> STEP_EXTENSIONS = List.of(".stp", ".step", ".p21");

    private static final String REDUCED_SUFFIX = ".reduced";

    private final StepReduceProperties properties;
    private final List<Root> roots;

    public SecurePathResolver(StepReduceProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties);
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.path().toString()));
        }
        return result;
    }

    public ResolvedPath resolveStepInput(String rootId, String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path 不能为空");
        }
        Located located = locate(rootId, path);
        Path file = located.absolute();
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + located.display());
        }
        checkChain(located, true);
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("不是普通文件：" + located.display());
        }
        requireStepExtension(file, located.display());
        return located.toResolved();
    }

    /**
     * @param input      已解析的输入文件
     * @param outputPath 输出路径（相对输入所在 root 或绝对路径）；为空时使用 {@link #defaultOutputPath}
     * @param overwrite  目标已存在时是否允许覆盖
     */
    public ResolvedPath resolveReduceOutput(ResolvedPath input, String outputPath, boolean overwrite) {
        String requested = (outputPath == null || outputPath.isBlank()) ? defaultOutputPath(input.displayPath()) : outputPath;
        Located located = locate(input.rootId(), requested);
        checkChain(located, false);
        Path target = located.absolute();
        requireStepExtension(target, located.display());

        if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("输出路径是目录：" + located.display());
        }
        if (!overwrite && target.equals(input.absolutePath())) {
            throw new IllegalArgumentException("输出路径与输入文件相同（如需就地覆盖请传 overwrite=true）：" + located.display());
        }
        if (!overwrite && Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("输出文件已存在（如需覆盖请传 overwrite=true）：" + located.display());
        }
        Path parent = target.getParent();
        if (parent == null || !Files.isDirectory(parent)) {
            throw new IllegalArgumentException("输出目录不存在：" + located.display());
        }
        return located.toResolved();
    }

    /**
     * {@code models/part.stp -> models/part.reduced.stp}；没有扩展名时直接追加 {@code .reduced}。
     */
    static String defaultOutputPath(String inputDisplayPath) {
        int slash = inputDisplayPath.lastIndexOf('/');
        int dot = inputDisplayPath.lastIndexOf('.');
        if (dot <= slash) {
            return inputDisplayPath + REDUCED_SUFFIX;
        }
        return inputDisplayPath.substring(0, dot) + REDUCED_SUFFIX + inputDisplayPath.substring(dot);
    }

    static boolean hasStepExtension(Path file) {
        String lower = String.valueOf(file.getFileName()).toLowerCase(Locale.ROOT);
        return STEP_EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    private static void requireStepExtension(Path file, String display) {
        if (!hasStepExtension(file)) {
            throw new IllegalArgumentException("不是 STEP 文件（仅支持 .stp/.step/.p21）：" + display);
        }
    }

    private Located locate(String rootId, String requested) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.reduce.roots）");
        }
        Path raw = Path.of(requested);
        boolean noRootId = rootId == null || rootId.isBlank();
        Root root;
        Path absolute;
        if (raw.isAbsolute()) {
            absolute = raw.normalize();
            root = noRootId ? deepestRootContaining(absolute) : findRootById(rootId);
        } else {
            root = noRootId ? roots.get(0) : findRootById(rootId);
            absolute = root.path().resolve(raw).normalize();
        }
        if (!absolute.startsWith(root.path())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + requested);
        }
        return new Located(root, absolute);
    }

    /**
     * 从 root 逐级走到目标：任意一级是链接都可能把后续路径带出 root。
     */
    private void checkChain(Located located, boolean targetExists) {
        Path rootReal;
        try {
            rootReal = located.root().path().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + located.root().path(), e);
        }
        Path current = located.root().path();
        for (Path segment : located.root().path().relativize(located.absolute())) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (!properties.isAllowSymlink() && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + located.display());
            }
            ensureRealPathWithin(current, rootReal);
        }
        if (targetExists) {
            ensureRealPathWithin(located.absolute(), rootReal);
        }
    }

    private static void ensureRealPathWithin(Path path, Path rootReal) {
        Path real;
        try {
            real = path.toRealPath();
        } catch (IOException e) {
            throw new IllegalArgumentException("路径无法解析：" + path, e);
        }
        if (!real.startsWith(rootReal)) {
            throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + path);
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root deepestRootContaining(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.path()))
                .max(Comparator.comparingInt(r -> r.path().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(StepReduceProperties properties) {
        List<String> configured = properties.getRoots();
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.reduce.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private record Root(String id, Path path) {
    }

    private record Located(Root root, Path absolute) {

        String display() {
            return root.path().relativize(absolute).toString().replace('\\', '/');
        }

        ResolvedPath toResolved() {
            return new ResolvedPath(root.id(), absolute, display());
        }
    }

    /**
     * @param rootId       所在 root
     * @param absolutePath 规范化后的绝对路径
     * @param displayPath  相对 root 的路径（使用 '/' 分隔），用于消息与工具返回值
     */
    public record ResolvedPath(String rootId, Path absolutePath, String displayPath) {
    }
}
