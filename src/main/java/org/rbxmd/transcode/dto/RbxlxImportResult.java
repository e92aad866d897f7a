package org.rbxmd.transcode.dto;

import java.util.List;

/**
 * {@code rbx_convert_to_rbxlx} 的返回结果。
 *
 * @param rootId           根目录标识
 * @param outputPath       输出 rbxlx 路径（相对 root）
 * @param sourceFiles      读取的 Markdown 文件（相对 root）
 * @param records          解析到的记录数
 * @param items            写出的 Item 总数（含占位节点）
 * @param placeholderCount 为缺失的中间路径生成的占位节点数
 * @param bytesWritten     写入字节数
 * @param warnings         非致命告警
 */
public record RbxlxImportResult(
        String rootId,
        String outputPath,
        List<String> sourceFiles,
        int records,
        int items,
        int placeholderCount,
        long bytesWritten,
        List<String> warnings
) {
}
