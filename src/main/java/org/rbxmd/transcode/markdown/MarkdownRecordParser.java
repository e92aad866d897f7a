package org.rbxmd.transcode.markdown;

import org.rbxmd.transcode.model.NodeRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Markdown 文本 -> 记录。
 * <p>
 * 规则：
 * <ul>
 *   <li>空行结束当前记录</li>
 *   <li>记录内以 {@code - } 开头的行是属性行；缩进比首条属性行更深的行续接上一条属性（未知类型的子元素）</li>
 *   <li>其余行按 {@code path (id) [class]} 识别为记录头；缺少 {@code [class]} 时使用默认类名</li>
 * </ul>
 * 属性行的判断先于记录头，避免 {@code - Size: (1, 2, 3)} 这类行被误当作记录头。
 */
public final class MarkdownRecordParser {

    // 路径贪婪匹配到最后一组括号，路径中带括号的引号段不会被截断
    private static final Pattern HEADER = Pattern.compile("^(.+)\\s*\\(([^()]+)\\)(?:\\s*\\[([^\\]]+)\\])?\\s*$");

    private MarkdownRecordParser() {
    }

    public static List<NodeRecord> parse(String text, String defaultClass, List<String> warnings) {
        List<NodeRecord> out = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return out;
        }
        String fallbackClass = defaultClass == null || defaultClass.isBlank() ? "Part" : defaultClass;

        Pending current = null;
        int lineNo = 0;
        for (String raw : text.split("\\R", -1)) {
            lineNo++;
            String line = stripTrailing(raw);
            if (line.isBlank()) {
                if (current != null) {
                    out.add(current.toRecord());
                    current = null;
                }
                continue;
            }

            String trimmed = line.strip();
            if (current != null && trimmed.startsWith("- ")) {
                current.addPropertyLine(line);
                continue;
            }

            Matcher m = HEADER.matcher(line);
            if (m.matches()) {
                if (current != null) {
                    out.add(current.toRecord());
                }
                String className = m.group(3) == null ? fallbackClass : m.group(3).strip();
                current = new Pending(m.group(1).strip(), m.group(2).strip(), className);
                continue;
            }

            if (current != null && !current.blocks.isEmpty() && Character.isWhitespace(line.charAt(0))) {
                // 缩进的非列表行：续接到上一条属性
                current.appendToLastBlock(line);
                continue;
            }
            if (warnings != null) {
                warnings.add("第 " + lineNo + " 行无法识别，已跳过：" + line);
            }
        }
        if (current != null) {
            out.add(current.toRecord());
        }
        return out;
    }

    private static String stripTrailing(String s) {
        return s == null ? "" : s.stripTrailing();
    }

    private static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    private static final class Pending {
        final String path;
        final String id;
        final String className;
        final List<StringBuilder> blocks = new ArrayList<>();
        int baseIndent = -1;

        Pending(String path, String id, String className) {
            this.path = path;
            this.id = id;
            this.className = className;
        }

        void addPropertyLine(String line) {
            int indent = indentOf(line);
            if (baseIndent < 0) {
                baseIndent = indent;
            }
            if (indent > baseIndent && !blocks.isEmpty()) {
                appendToLastBlock(line);
                return;
            }
            blocks.add(new StringBuilder(line.strip()));
        }

        void appendToLastBlock(String line) {
            // 子行统一规范为相对首行缩进两格
            blocks.get(blocks.size() - 1).append('\n').append("  ").append(line.strip());
        }

        NodeRecord toRecord() {
            List<String> properties = new ArrayList<>(blocks.size());
            for (StringBuilder block : blocks) {
                properties.add(block.toString());
            }
            return new NodeRecord(path, id, className, properties);
        }
    }
}
