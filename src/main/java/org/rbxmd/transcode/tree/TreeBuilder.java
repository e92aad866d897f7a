package org.rbxmd.transcode.tree;

import org.rbxmd.transcode.codec.PathCodec;
import org.rbxmd.transcode.codec.PropertyCodec;
import org.rbxmd.transcode.model.NodeRecord;
import org.rbxmd.transcode.model.Property;
import org.rbxmd.transcode.model.PropertyValue;
import org.rbxmd.transcode.model.SceneNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 扁平记录 -> 场景树。
 * <p>
 * 记录可以按任意顺序插入：
 * <ul>
 *   <li>路径中缺失的中间段先创建占位节点（{@code Folder}、新生成的标识、无属性）</li>
 *   <li>之后到达的同路径记录会“补全”该占位节点，而不是再建一个重复节点</li>
 *   <li>同一路径出现第二条真实记录时作为兄弟节点保留（后续子路径仍挂到第一条上），并记录告警</li>
 * </ul>
 * 单个实例只用于一次构建，非线程安全。
 */
public final class TreeBuilder {

    public static final String DEFAULT_PLACEHOLDER_CLASS = "Folder";
    public static final String DEFAULT_CLASS = "Part";

    /**
     * @param roots            顶层节点（按首次出现顺序）
     * @param placeholderCount 构建结束时仍未被补全的占位节点数量
     * @param warnings         非致命告警（为空时为 null）
     */
    public record BuildResult(List<SceneNode> roots, int placeholderCount, List<String> warnings) {
    }

    private final String placeholderClass;
    private final Supplier<String> idSupplier;

    private final List<Slot> roots = new ArrayList<>();
    // 规范化路径 -> 节点
    private final Map<String, Slot> slotsByPath = new HashMap<>();
    private final List<String> warnings = new ArrayList<>();

    public TreeBuilder() {
        this(DEFAULT_PLACEHOLDER_CLASS, TreeBuilder::randomId);
    }

    public TreeBuilder(String placeholderClass, Supplier<String> idSupplier) {
        this.placeholderClass = placeholderClass == null || placeholderClass.isBlank()
                ? DEFAULT_PLACEHOLDER_CLASS
                : placeholderClass;
        this.idSupplier = idSupplier == null ? TreeBuilder::randomId : idSupplier;
    }

    public static BuildResult build(List<NodeRecord> records) {
        TreeBuilder builder = new TreeBuilder();
        if (records != null) {
            records.forEach(builder::insert);
        }
        return builder.result();
    }

    public void insert(NodeRecord record) {
        if (record == null) {
            return;
        }
        List<String> segments = PathCodec.split(record.path() == null ? "" : record.path().strip());
        if (segments.isEmpty()) {
            warnings.add("记录路径为空，已跳过（id=" + record.id() + "）");
            return;
        }

        List<Slot> level = roots;
        String prefix = "";
        for (int i = 0; i < segments.size() - 1; i++) {
            String segment = segments.get(i);
            prefix = PathCodec.child(prefix, segment);
            Slot slot = slotsByPath.get(prefix);
            if (slot == null) {
                slot = Slot.placeholder(segment, placeholderClass, idSupplier.get());
                slotsByPath.put(prefix, slot);
                level.add(slot);
            }
            level = slot.children;
        }

        String leaf = segments.get(segments.size() - 1);
        String fullPath = PathCodec.child(prefix, leaf);
        Slot existing = slotsByPath.get(fullPath);
        if (existing == null) {
            Slot slot = Slot.placeholder(leaf, placeholderClass, null);
            slot.complete(record, this::decodeProperties);
            slotsByPath.put(fullPath, slot);
            level.add(slot);
            return;
        }
        if (existing.placeholder) {
            existing.complete(record, this::decodeProperties);
            return;
        }
        warnings.add("路径重复：" + fullPath + "（id=" + existing.id + " 与 id=" + record.id() + "），后者作为兄弟节点保留");
        Slot sibling = Slot.placeholder(leaf, placeholderClass, null);
        sibling.complete(record, this::decodeProperties);
        level.add(sibling);
    }

    public BuildResult result() {
        int[] placeholders = new int[1];
        List<SceneNode> out = new ArrayList<>(roots.size());
        for (Slot slot : roots) {
            out.add(toNode(slot, placeholders));
        }
        return new BuildResult(out, placeholders[0], warnings.isEmpty() ? null : List.copyOf(warnings));
    }

    private SceneNode toNode(Slot slot, int[] placeholders) {
        if (slot.placeholder) {
            placeholders[0]++;
        }
        List<SceneNode> children = new ArrayList<>(slot.children.size());
        for (Slot child : slot.children) {
            children.add(toNode(child, placeholders));
        }
        return new SceneNode(slot.id, slot.className, slot.name, slot.properties, children);
    }

    private Map<String, PropertyValue> decodeProperties(NodeRecord record) {
        Map<String, PropertyValue> properties = new LinkedHashMap<>();
        for (String block : record.properties()) {
            if (block == null || block.isBlank()) {
                continue;
            }
            Property property = PropertyCodec.decodeBlock(Arrays.asList(block.split("\n")));
            if (property == null) {
                warnings.add("无法解析属性行，已跳过：" + block.lines().findFirst().orElse(""));
                continue;
            }
            // Name/UniqueId 由路径与记录标识决定
            if (SceneNode.isReservedProperty(property.name())) {
                continue;
            }
            properties.put(property.name(), property.value());
        }
        return properties;
    }

    private static String randomId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static final class Slot {
        final String name;
        final List<Slot> children = new ArrayList<>();
        String id;
        String className;
        Map<String, PropertyValue> properties = Map.of();
        boolean placeholder = true;

        private Slot(String name, String className, String id) {
            this.name = name;
            this.className = className;
            this.id = id;
        }

        static Slot placeholder(String name, String className, String id) {
            return new Slot(name, className, id);
        }

        void complete(NodeRecord record, Function<NodeRecord, Map<String, PropertyValue>> decoder) {
            this.id = record.id();
            this.className = record.className() == null || record.className().isBlank()
                    ? DEFAULT_CLASS
                    : record.className();
            this.properties = decoder.apply(record);
            this.placeholder = false;
        }
    }
}
