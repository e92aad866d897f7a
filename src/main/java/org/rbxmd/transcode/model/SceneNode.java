package org.rbxmd.transcode.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 场景树节点（不可变）。
 * <p>
 * {@code Name}/{@code UniqueId} 是一等字段，不会出现在 {@link #properties()} 中。
 *
 * @param id         全局唯一标识；源文档缺失时为 null
 * @param className  节点类型标签（例如 Part/Folder/Script）
 * @param name       节点名称；源文档缺失时为 null
 * @param properties 其余属性（保持文档顺序）
 * @param children   子节点（保持文档顺序）
 */
public record SceneNode(
        String id,
        String className,
        String name,
        Map<String, PropertyValue> properties,
        List<SceneNode> children
) {

    public static final String NAME_PROPERTY = "Name";
    public static final String UNIQUE_ID_PROPERTY = "UniqueId";

    public SceneNode {
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static boolean isReservedProperty(String propertyName) {
        return NAME_PROPERTY.equals(propertyName) || UNIQUE_ID_PROPERTY.equals(propertyName);
    }
}
