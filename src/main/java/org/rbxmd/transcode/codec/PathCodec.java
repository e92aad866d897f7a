package org.rbxmd.transcode.codec;

import java.util.ArrayList;
import java.util.List;

/**
 * 层级路径编解码（点号路径 + 方括号引号段）。
 * <p>
 * 语法：
 * <ul>
 *   <li>普通名称直接输出，父子之间用 {@code .} 连接：{@code Workspace.Baseplate}</li>
 *   <li>包含空格或语法字符（{@code . [ ] " \}）的名称写成 {@code ["name"]}，并且不再插入点号：
 *       {@code Workspace["Spawn Point"]}</li>
 *   <li>引号段内的 {@code "} 与 {@code \} 使用反斜杠转义</li>
 * </ul>
 * <p>
 * {@link #split(String)} 必须同时还原上述两种拼接方式；遇到没有闭合的 {@code ["} 时按普通字符处理，不抛异常。
 */
public final class PathCodec {

    private static final String QUOTE_OPEN = "[\"";
    private static final String QUOTE_CLOSE = "\"]";

    private PathCodec() {
    }

    public static boolean needsQuoting(String name) {
        if (name == null || name.isEmpty()) {
            return true;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || c == '.' || c == '[' || c == ']' || c == '"' || c == '\\') {
                return true;
            }
        }
        return false;
    }

    public static String encodeSegment(String name) {
        String value = name == null ? "" : name;
        if (!needsQuoting(value)) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length() + 4);
        out.append(QUOTE_OPEN);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '"' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        out.append(QUOTE_CLOSE);
        return out.toString();
    }

    /**
     * 拼接父路径与子段。
     *
     * @param parentPath  父路径（为空表示顶层）
     * @param segmentText {@link #encodeSegment(String)} 的结果
     * @param rawName     原始名称，用来判断是否为引号段
     */
    public static String join(String parentPath, String segmentText, String rawName) {
        if (parentPath == null || parentPath.isEmpty()) {
            return segmentText;
        }
        // 引号段自带边界，不需要点号
        if (needsQuoting(rawName)) {
            return parentPath + segmentText;
        }
        return parentPath + "." + segmentText;
    }

    public static String child(String parentPath, String rawName) {
        return join(parentPath, encodeSegment(rawName), rawName);
    }

    /**
     * 把路径切分为原始名称列表（引号段已去掉引号并反转义）。
     */
    public static List<String> split(String path) {
        List<String> out = new ArrayList<>();
        if (path == null || path.isEmpty()) {
            return out;
        }
        int i = 0;
        int len = path.length();
        while (i < len) {
            if (path.startsWith(QUOTE_OPEN, i)) {
                int close = findQuoteClose(path, i + QUOTE_OPEN.length());
                if (close >= 0) {
                    out.add(unescape(path.substring(i + QUOTE_OPEN.length(), close)));
                    i = close + QUOTE_CLOSE.length();
                    if (i < len && path.charAt(i) == '.') {
                        i++;
                    }
                    continue;
                }
            }

            // 普通段：到下一个点号或下一个“可闭合的”引号段为止
            StringBuilder token = new StringBuilder();
            while (i < len) {
                char c = path.charAt(i);
                if (c == '.') {
                    i++;
                    break;
                }
                if (token.length() > 0 && path.startsWith(QUOTE_OPEN, i)
                        && findQuoteClose(path, i + QUOTE_OPEN.length()) >= 0) {
                    break;
                }
                token.append(c);
                i++;
            }
            out.add(token.toString());
        }
        return out;
    }

    /**
     * 取路径最后一段的原始名称。
     */
    public static String leafName(String path) {
        List<String> segments = split(path);
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    /**
     * 按原始名称列表重新拼出路径（{@link #split(String)} 的逆操作）。
     */
    public static String fromSegments(List<String> names) {
        String path = "";
        for (String name : names) {
            path = child(path, name);
        }
        return path;
    }

    private static int findQuoteClose(String path, int from) {
        for (int i = from; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '\\') {
                i++;
                continue;
            }
            if (c == '"' && i + 1 < path.length() && path.charAt(i + 1) == ']') {
                return i;
            }
        }
        return -1;
    }

    private static String unescape(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                out.append(text.charAt(++i));
                continue;
            }
            out.append(c);
        }
        return out.toString();
    }
}
