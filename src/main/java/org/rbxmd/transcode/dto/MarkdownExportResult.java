package org.rbxmd.transcode.dto;

import java.util.List;

/**
 * {@code rbx_convert_to_markdown} 的返回结果。
 *
 * @param rootId           根目录标识
 * @param inputPath        输入 rbxlx 路径（相对 root）
 * @param settingsPath     实际使用的过滤设置文件（未找到时为 null）
 * @param records          输出的记录总数
 * @param files            输出文件列表
 * @param inputLines       输入文档行数
 * @param outputLines      输出总行数
 * @param reducedLines     减少的行数
 * @param reductionPercent 减少比例（百分比，保留两位小数）
 * @param warnings         非致命告警（未知属性类型、设置文件问题等）
 */
public record MarkdownExportResult(
        String rootId,
        String inputPath,
        String settingsPath,
        int records,
        List<MarkdownFileEntry> files,
        long inputLines,
        long outputLines,
        long reducedLines,
        double reductionPercent,
        List<String> warnings
) {
}
