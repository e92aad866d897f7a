package org.rbxmd.transcode.markdown;

import org.rbxmd.transcode.codec.PathCodec;
import org.rbxmd.transcode.model.NodeRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 记录 -> Markdown 文本。
 * <p>
 * 每条记录一段：
 * <pre>
 * Workspace.Baseplate (U1) [Part]
 * - Anchored: true
 *
 * </pre>
 * 段落之间用空行分隔；{@code [Class]} 只在 {@code showClass=true} 时输出。
 */
public final class MarkdownRecordWriter {

    public static final String FILE_EXTENSION = ".md";
    public static final String ROOT_GROUP = "Root";

    private static final Comparator<NodeRecord> RECORD_ORDER = Comparator
            .comparing(NodeRecord::path, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(NodeRecord::id, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(NodeRecord::className, Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * 输出行数统计。
     *
     * @param inputLines       源文档行数
     * @param outputLines      输出行数
     * @param reducedLines     减少的行数（可能为负）
     * @param reductionPercent 减少比例（源为空时为 0）
     */
    public record LineStats(long inputLines, long outputLines, long reducedLines, double reductionPercent) {
    }

    private MarkdownRecordWriter() {
    }

    public static String render(List<NodeRecord> records, boolean showClass, boolean showProperties) {
        List<NodeRecord> sorted = new ArrayList<>(records);
        sorted.sort(RECORD_ORDER);

        StringBuilder out = new StringBuilder();
        for (NodeRecord record : sorted) {
            out.append(record.path()).append(" (").append(record.id()).append(')');
            if (showClass) {
                out.append(" [").append(record.className()).append(']');
            }
            if (showProperties) {
                if (!record.properties().isEmpty()) {
                    out.append('\n').append(String.join("\n", record.properties()));
                }
            } else {
                out.append('\n');
            }
            out.append("\n\n");
        }
        return out.toString();
    }

    /**
     * 按路径首段分组（保持首次出现顺序），每组对应一个 {@code <group>.md} 文件。
     */
    public static Map<String, List<NodeRecord>> group(List<NodeRecord> records) {
        Map<String, List<NodeRecord>> groups = new LinkedHashMap<>();
        for (NodeRecord record : records) {
            groups.computeIfAbsent(groupName(record.path()), k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    public static String groupName(String path) {
        List<String> segments = PathCodec.split(path);
        if (segments.isEmpty() || segments.get(0).isBlank()) {
            return ROOT_GROUP;
        }
        return segments.get(0);
    }

    /**
     * 把分组名转换为安全的文件名（替换文件系统保留字符）。
     */
    public static String fileNameFor(String group) {
        String name = group == null || group.isBlank() ? ROOT_GROUP : group;
        return name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_") + FILE_EXTENSION;
    }

    public static long countLines(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        long count = text.chars().filter(c -> c == '\n').count();
        // 末尾没有换行的最后一行也算一行
        if (text.charAt(text.length() - 1) != '\n') {
            count++;
        }
        return count;
    }

    public static LineStats lineStats(long inputLines, long outputLines) {
        long reduced = inputLines - outputLines;
        double percent = inputLines == 0 ? 0.0 : (reduced * 100.0) / inputLines;
        return new LineStats(inputLines, outputLines, reduced, percent);
    }
}
