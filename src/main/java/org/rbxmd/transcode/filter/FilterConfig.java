package org.rbxmd.transcode.filter;

import java.util.List;

/**
 * 过滤配置（不可变）。
 * <p>
 * 白名单/黑名单只有在对应的 {@code use*} 开关打开且列表非空时才生效。
 *
 * @param pathWhitelist    路径白名单（支持 {@code *} 通配）
 * @param pathBlacklist    路径黑名单
 * @param classWhitelist   类名白名单（精确匹配）
 * @param classBlacklist   类名黑名单
 * @param useWhitelist     启用路径白名单
 * @param useBlacklist     启用路径黑名单
 * @param useClassWhitelist 启用类名白名单
 * @param useClassBlacklist 启用类名黑名单
 * @param excludeNoIdItems 不输出没有 UniqueId 的节点（其子节点仍会遍历）
 * @param rootPrefix       路径模式可选的根前缀（如 {@code game}），匹配前会被去掉
 */
public record FilterConfig(
        List<String> pathWhitelist,
        List<String> pathBlacklist,
        List<String> classWhitelist,
        List<String> classBlacklist,
        boolean useWhitelist,
        boolean useBlacklist,
        boolean useClassWhitelist,
        boolean useClassBlacklist,
        boolean excludeNoIdItems,
        String rootPrefix
) {

    public static final String DEFAULT_ROOT_PREFIX = "game";

    public FilterConfig {
        pathWhitelist = copy(pathWhitelist);
        pathBlacklist = copy(pathBlacklist);
        classWhitelist = copy(classWhitelist);
        classBlacklist = copy(classBlacklist);
        rootPrefix = rootPrefix == null ? DEFAULT_ROOT_PREFIX : rootPrefix;
    }

    /**
     * 默认配置：所有列表为空、所有开关关闭（不过滤任何节点）。
     */
    public static FilterConfig defaults() {
        return new FilterConfig(List.of(), List.of(), List.of(), List.of(),
                false, false, false, false, false, DEFAULT_ROOT_PREFIX);
    }

    public FilterConfig withRootPrefix(String prefix) {
        return new FilterConfig(pathWhitelist, pathBlacklist, classWhitelist, classBlacklist,
                useWhitelist, useBlacklist, useClassWhitelist, useClassBlacklist, excludeNoIdItems, prefix);
    }

    private static List<String> copy(List<String> list) {
        if (list == null) {
            return List.of();
        }
        return list.stream().filter(s -> s != null).toList();
    }
}
