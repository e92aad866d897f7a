package org.rbxmd.transcode.dto;

/**
 * 单个输出 Markdown 文件。
 *
 * @param group   路径首段分组名（单文件输出时为 null）
 * @param path    相对 root 的路径（统一使用 / 分隔）
 * @param records 写入的记录数
 * @param lines   写入的行数
 */
public record MarkdownFileEntry(
        String group,
        String path,
        int records,
        long lines
) {
}
