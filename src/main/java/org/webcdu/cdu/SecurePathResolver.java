package org.webcdu.cdu;

import org.webcdu.cdu.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 安全路径解析器：把调用方传入的 CDU 文件路径解析为受控的绝对路径，并确保不会逃逸出 {@code app.cdu.roots} 白名单。
 * <p>
 * 规则：
 * <ul>
 *   <li>相对路径按 rootId 指定的根目录解析（rootId 为空默认 root0）；绝对路径匹配层级最深的根目录。</li>
 *   <li>{@code ../} 穿越在 normalize 后做 startsWith 校验拦截。</li>
 *   <li>逐级校验 realPath，防止中间某级目录是 symlink/junction 造成逃逸；默认不允许 symlink。</li>
 * </ul>
 * 本服务只读取文件，因此目标必须存在且是普通文件。
 */
public class SecurePathResolver {

    private final CduServerProperties properties;
    private final List<Root> roots;

    public SecurePathResolver(CduServerProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties.getRoots());
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    /**
     * 解析一个待读取的 CDU 文件路径。
     *
     * @throws IllegalArgumentException 路径越界、不存在、不是普通文件或经由链接逃逸
     */
    public ResolvedPath resolveFile(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.cdu.roots）");
        }
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("文件路径不能为空");
        }

        Path rawPath = Path.of(inputPath);
        Root root;
        Path absolute;
        if (rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            root = (rootId == null || rootId.isBlank()) ? findBestRoot(absolute) : findRootById(rootId);
        } else {
            root = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = root.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(root.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        if (!Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + inputPath);
        }
        checkLinks(root, absolute);
        // 链接已确认不会逃逸，此处跟随链接判断目标类型
        if (!Files.isRegularFile(absolute)) {
            throw new IllegalArgumentException("不是普通文件：" + inputPath);
        }

        String display = root.rootPath().relativize(absolute).toString().replace('\\', '/');
        return new ResolvedPath(root.id(), root.rootPath(), absolute, display);
    }

    private void checkLinks(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!properties.isAllowSymlink() && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            ensureInside(rootReal, current);
        }
    }

    private static void ensureInside(Path rootReal, Path path) {
        try {
            if (!path.toRealPath().startsWith(rootReal)) {
                throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + path);
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("路径无法解析：" + path, e);
        }
    }

    private Root findRootById(String rootId) {
        return roots.stream()
                .filter(r -> r.id().equals(rootId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知的 rootId：" + rootId));
    }

    private Root findBestRoot(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.cdu.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
