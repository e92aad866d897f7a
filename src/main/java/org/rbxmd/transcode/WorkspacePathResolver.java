package org.rbxmd.transcode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 工作目录路径解析：把工具参数中的路径解析为受控的绝对路径，并保证它不会逃逸出根目录白名单。
 * <p>
 * 规则：
 * <ul>
 *   <li>相对路径从 rootId 指定的根目录解析（rootId 为空时取 root0）</li>
 *   <li>绝对路径自动匹配层级最深的根目录</li>
 *   <li>逐级做 realPath 校验，阻止 {@code ../} 与符号链接逃逸</li>
 *   <li>写入目标可能尚不存在，只校验已存在的父目录链路</li>
 * </ul>
 */
public class WorkspacePathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public WorkspacePathResolver(List<String> configuredRoots, boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
        this.roots = normalizeRoots(configuredRoots);
    }

    public ResolvedPath resolve(String rootId, String inputPath, boolean requireExists) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的工作目录（app.md.roots）");
        }

        Path rawPath = (inputPath == null || inputPath.isBlank()) ? null : Path.of(inputPath);
        Root selectedRoot;
        Path absolute;
        if (rawPath != null && rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = (rawPath == null) ? selectedRoot.rootPath() : selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的工作目录范围内：" + inputPath);
        }
        validateWithinRoot(selectedRoot, absolute, requireExists);
        return new ResolvedPath(selectedRoot.id(), absolute, displayPath(selectedRoot, absolute));
    }

    public ResolvedPath resolveForWrite(String rootId, String inputPath) {
        return resolve(rootId, inputPath, false);
    }

    private void validateWithinRoot(Root root, Path absolute, boolean requireExists) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("工作目录不存在或无法解析：" + root.rootPath(), e);
        }

        if (requireExists && !Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + absolute);
        }

        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                break;
            }
            if (!allowSymlink && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            try {
                if (!current.toRealPath().startsWith(rootReal)) {
                    throw new IllegalArgumentException("路径通过链接逃逸出工作目录：" + current);
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
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

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的工作目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.md.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        String relative = root.rootPath().relativize(absolute).toString();
        return relative.isEmpty() ? "." : relative;
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path absolutePath, String displayPath) {
    }
}
