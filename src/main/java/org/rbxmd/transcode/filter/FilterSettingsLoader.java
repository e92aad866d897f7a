package org.rbxmd.transcode.filter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 过滤设置文件（JSON）加载。
 * <p>
 * 支持的键：
 * <pre>
 * {
 *   "path_whitelist": [], "path_blacklist": [],
 *   "class_whitelist": [], "class_blacklist": [],
 *   "use_path_whitelist": false, "use_path_blacklist": false,
 *   "use_class_whitelist": false, "use_class_blacklist": false,
 *   "exclude_no_id_items": false,
 *   "Ignore": { "ClassName": [...], "Path": [...] }
 * }
 * </pre>
 * {@code Ignore} 是简写：填充对应黑名单并打开开关；同时出现时直接键优先。
 * <p>
 * 文件缺失或无法解析不会中断转换：返回默认配置并附带告警。
 */
public final class FilterSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(FilterSettingsLoader.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * @param config   解析得到的配置（失败时为默认配置）
     * @param warnings 非致命问题（为空时为 null）
     */
    public record Loaded(FilterConfig config, List<String> warnings) {
    }

    private FilterSettingsLoader() {
    }

    public static Loaded load(Path file, String rootPrefix) {
        FilterConfig defaults = FilterConfig.defaults().withRootPrefix(rootPrefix);
        if (file == null || !Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            String message = "未找到过滤设置文件，使用默认设置：" + file;
            log.warn(message);
            return new Loaded(defaults, List.of(message));
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            String message = "读取过滤设置文件失败，使用默认设置：" + file + "（" + e.getMessage() + "）";
            log.warn(message, e);
            return new Loaded(defaults, List.of(message));
        }
        return parse(json, rootPrefix);
    }

    public static Loaded parse(String json, String rootPrefix) {
        FilterConfig defaults = FilterConfig.defaults().withRootPrefix(rootPrefix);
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            String message = "过滤设置不是合法 JSON，使用默认设置：" + e.getOriginalMessage();
            log.warn(message);
            return new Loaded(defaults, List.of(message));
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new Loaded(defaults, null);
        }
        if (!root.isObject()) {
            String message = "过滤设置顶层必须是 JSON 对象，使用默认设置";
            log.warn(message);
            return new Loaded(defaults, List.of(message));
        }

        List<String> warnings = new ArrayList<>();

        List<String> pathBlacklist = List.of();
        List<String> classBlacklist = List.of();
        boolean useBlacklist = false;
        boolean useClassBlacklist = false;

        JsonNode ignore = root.get("Ignore");
        if (ignore != null && ignore.isObject()) {
            if (ignore.has("ClassName")) {
                classBlacklist = readStringList(ignore.get("ClassName"), "Ignore.ClassName", warnings);
                useClassBlacklist = true;
            }
            if (ignore.has("Path")) {
                pathBlacklist = readStringList(ignore.get("Path"), "Ignore.Path", warnings);
                useBlacklist = true;
            }
        } else if (ignore != null && !ignore.isNull()) {
            warnings.add("Ignore 必须是 JSON 对象，已忽略");
        }

        // 直接键覆盖 Ignore 简写
        if (root.has("path_blacklist")) {
            pathBlacklist = readStringList(root.get("path_blacklist"), "path_blacklist", warnings);
        }
        if (root.has("class_blacklist")) {
            classBlacklist = readStringList(root.get("class_blacklist"), "class_blacklist", warnings);
        }
        if (root.has("use_path_blacklist")) {
            useBlacklist = readBoolean(root.get("use_path_blacklist"), "use_path_blacklist", useBlacklist, warnings);
        }
        if (root.has("use_class_blacklist")) {
            useClassBlacklist = readBoolean(root.get("use_class_blacklist"), "use_class_blacklist", useClassBlacklist, warnings);
        }

        FilterConfig config = new FilterConfig(
                readStringList(root.get("path_whitelist"), "path_whitelist", warnings),
                pathBlacklist,
                readStringList(root.get("class_whitelist"), "class_whitelist", warnings),
                classBlacklist,
                readBoolean(root.get("use_path_whitelist"), "use_path_whitelist", false, warnings),
                useBlacklist,
                readBoolean(root.get("use_class_whitelist"), "use_class_whitelist", false, warnings),
                useClassBlacklist,
                readBoolean(root.get("exclude_no_id_items"), "exclude_no_id_items", false, warnings),
                rootPrefix
        );
        if (!warnings.isEmpty()) {
            warnings.forEach(log::warn);
        }
        return new Loaded(config, warnings.isEmpty() ? null : warnings);
    }

    private static List<String> readStringList(JsonNode node, String key, List<String> warnings) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            warnings.add("设置项 " + key + " 必须是字符串数组，已忽略");
            return List.of();
        }
        List<String> out = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (item.isTextual()) {
                out.add(item.asText());
            } else {
                warnings.add("设置项 " + key + " 含非字符串元素，已跳过：" + item);
            }
        }
        return out;
    }

    private static boolean readBoolean(JsonNode node, String key, boolean fallback, List<String> warnings) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            warnings.add("设置项 " + key + " 必须是 true/false，已使用 " + fallback);
            return fallback;
        }
        return node.booleanValue();
    }
}
