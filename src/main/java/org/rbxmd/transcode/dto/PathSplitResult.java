package org.rbxmd.transcode.dto;

import java.util.List;

/**
 * {@code rbx_split_path} 的返回结果。
 *
 * @param path          输入路径
 * @param segments      原始名称列表（引号段已还原）
 * @param leafName      最后一段名称
 * @param canonicalPath 按名称列表重新拼接的路径
 */
public record PathSplitResult(
        String path,
        List<String> segments,
        String leafName,
        String canonicalPath
) {
}
