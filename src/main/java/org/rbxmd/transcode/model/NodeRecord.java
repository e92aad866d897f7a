package org.rbxmd.transcode.model;

import java.util.List;

/**
 * 扁平化后的单个节点记录（Markdown 中的一个段落）。
 *
 * @param path       路径文本（例如 {@code Workspace["Spawn Point"]}）
 * @param id         节点标识
 * @param className  节点类型标签
 * @param properties 已编码的属性块；每个元素是一条属性（可能包含多行，以 {@code \n} 分隔）
 */
public record NodeRecord(String path, String id, String className, List<String> properties) {

    public NodeRecord {
        properties = properties == null ? List.of() : List.copyOf(properties);
    }
}
