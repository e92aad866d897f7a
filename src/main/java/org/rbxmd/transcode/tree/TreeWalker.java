package org.rbxmd.transcode.tree;

import org.rbxmd.transcode.codec.PathCodec;
import org.rbxmd.transcode.codec.PropertyCodec;
import org.rbxmd.transcode.filter.FilterConfig;
import org.rbxmd.transcode.filter.NodeFilter;
import org.rbxmd.transcode.model.NodeRecord;
import org.rbxmd.transcode.model.Property;
import org.rbxmd.transcode.model.PropertyValue;
import org.rbxmd.transcode.model.SceneNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * 场景树 -> 扁平记录（先序遍历）。
 * <p>
 * 每个节点的处理顺序：
 * <ol>
 *   <li>类名被过滤：自身不输出，子节点沿用<b>同一个</b>父路径继续遍历</li>
 *   <li>名称缺省为 {@code Unnamed}，标识缺省为 {@code NoId}</li>
 *   <li>标识（包括 {@code NoId}）已处理过：整条分支停止（同一节点只输出一次）</li>
 *   <li>开启 {@code excludeNoIdItems} 且没有标识：自身不输出，子节点仍在该节点路径下遍历</li>
 *   <li>路径被过滤：自身不输出，子节点照常遍历（子路径可能在白名单内）</li>
 * </ol>
 * {@code processedIds} 只属于一次 {@link #walk} 调用，不跨调用共享。
 */
public final class TreeWalker {

    public static final String DEFAULT_NAME = "Unnamed";
    public static final String NO_ID = "NoId";

    // 这两个属性为空时没有信息量，不输出
    private static final Set<String> SKIP_WHEN_EMPTY = Set.of("AttributesSerialize", "Tags");

    /**
     * @param records  先序排列的记录
     * @param warnings 非致命告警（为空时为 null）
     */
    public record WalkResult(List<NodeRecord> records, List<String> warnings) {
    }

    private TreeWalker() {
    }

    public static WalkResult walk(List<SceneNode> roots, FilterConfig cfg) {
        FilterConfig effective = cfg == null ? FilterConfig.defaults() : cfg;
        List<NodeRecord> records = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> processedIds = new HashSet<>();
        if (roots != null) {
            for (SceneNode root : roots) {
                walkNode(root, "", effective, processedIds, records, warnings);
            }
        }
        return new WalkResult(records, warnings.isEmpty() ? null : warnings);
    }

    private static void walkNode(
            SceneNode node,
            String parentPath,
            FilterConfig cfg,
            Set<String> processedIds,
            List<NodeRecord> out,
            List<String> warnings
    ) {
        if (node == null) {
            return;
        }
        if (!NodeFilter.includeClass(node.className(), cfg)) {
            for (SceneNode child : node.children()) {
                walkNode(child, parentPath, cfg, processedIds, out, warnings);
            }
            return;
        }

        String name = node.name() == null ? DEFAULT_NAME : node.name();
        String id = node.id() == null ? NO_ID : node.id();
        boolean hasId = node.id() != null;

        // NoId 也计入已处理集合：同一次遍历中只有第一个无标识节点会输出
        if (processedIds.contains(id)) {
            return;
        }

        String currentPath = PathCodec.join(parentPath, PathCodec.encodeSegment(name), name);

        boolean withheld = !hasId && cfg.excludeNoIdItems();
        processedIds.add(id);
        if (!withheld && NodeFilter.includePath(currentPath, cfg)) {
            out.add(new NodeRecord(currentPath, id, node.className(), encodeProperties(node, warnings)));
        }

        for (SceneNode child : node.children()) {
            walkNode(child, currentPath, cfg, processedIds, out, warnings);
        }
    }

    /**
     * 按属性名排序编码；{@code Name}/{@code UniqueId} 已体现在路径与标识中，不重复输出。
     */
    static List<String> encodeProperties(SceneNode node, List<String> warnings) {
        Map<String, PropertyValue> sorted = new TreeMap<>(node.properties());
        List<String> blocks = new ArrayList<>(sorted.size());
        for (Map.Entry<String, PropertyValue> e : sorted.entrySet()) {
            String propertyName = e.getKey();
            if (SceneNode.isReservedProperty(propertyName)) {
                continue;
            }
            if (SKIP_WHEN_EMPTY.contains(propertyName) && isEmptyScalar(e.getValue())) {
                continue;
            }
            List<String> lines = PropertyCodec.encode(new Property(propertyName, e.getValue()), 0, warnings);
            blocks.add(String.join("\n", lines));
        }
        return blocks;
    }

    private static boolean isEmptyScalar(PropertyValue value) {
        return value instanceof PropertyValue.Scalar scalar
                && (scalar.text() == null || scalar.text().isBlank());
    }
}
