package org.rbxmd.transcode.model;

import java.util.Objects;

/**
 * 一条带名称的属性。
 *
 * @param name  属性名（在所属节点内唯一）
 * @param value 属性值
 */
public record Property(String name, PropertyValue value) {

    public Property {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }
}
