package org.rbxmd.transcode.filter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 路径/类名过滤（纯函数，无状态）。
 * <p>
 * 路径模式规则：
 * <ul>
 *   <li>先去掉根前缀（默认 {@code game.}）</li>
 *   <li>含 {@code *} 的模式：{@code *} 匹配任意字符序列，其余字符按字面匹配，整串锚定</li>
 *   <li>不含 {@code *} 的模式：路径等于模式，或位于模式之下（{@code pattern.} / {@code pattern["} 开头）</li>
 * </ul>
 */
public final class NodeFilter {

    private NodeFilter() {
    }

    public static boolean includeClass(String className, FilterConfig cfg) {
        if (cfg.useClassWhitelist() && !cfg.classWhitelist().isEmpty() && !cfg.classWhitelist().contains(className)) {
            return false;
        }
        if (cfg.useClassBlacklist() && cfg.classBlacklist().contains(className)) {
            return false;
        }
        return true;
    }

    public static boolean includePath(String path, FilterConfig cfg) {
        // 白名单开关打开但列表为空时不生效
        if (cfg.useWhitelist() && !cfg.pathWhitelist().isEmpty()
                && !matchesAny(path, cfg.pathWhitelist(), cfg.rootPrefix())) {
            return false;
        }
        if (cfg.useBlacklist() && matchesAny(path, cfg.pathBlacklist(), cfg.rootPrefix())) {
            return false;
        }
        return true;
    }

    public static boolean isPathUnder(String path, String pattern) {
        return isPathUnder(path, pattern, FilterConfig.DEFAULT_ROOT_PREFIX);
    }

    public static boolean isPathUnder(String path, String pattern, String rootPrefix) {
        if (path == null || pattern == null) {
            return false;
        }
        String p = stripRootPrefix(pattern, rootPrefix);
        if (p.indexOf('*') >= 0) {
            return wildcardToRegex(p).matcher(path).matches();
        }
        return path.equals(p) || path.startsWith(p + ".") || path.startsWith(p + "[\"");
    }

    static String stripRootPrefix(String pattern, String rootPrefix) {
        if (rootPrefix == null || rootPrefix.isEmpty()) {
            return pattern;
        }
        String prefix = rootPrefix + ".";
        return pattern.startsWith(prefix) ? pattern.substring(prefix.length()) : pattern;
    }

    static Pattern wildcardToRegex(String pattern) {
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = pattern.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(pattern.substring(start, star)));
            }
            regex.append(".*");
            start = star + 1;
        }
        if (start < pattern.length()) {
            regex.append(Pattern.quote(pattern.substring(start)));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static boolean matchesAny(String path, List<String> patterns, String rootPrefix) {
        for (String pattern : patterns) {
            if (isPathUnder(path, pattern, rootPrefix)) {
                return true;
            }
        }
        return false;
    }
}
