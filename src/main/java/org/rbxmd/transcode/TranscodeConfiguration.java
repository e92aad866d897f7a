package org.rbxmd.transcode;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 转换服务的 Bean 装配。
 * <p>
 * 编解码器都是无状态的静态工具类，这里只需要装配带配置的路径解析器。
 */
@Configuration(proxyBeanMethods = false)
public class TranscodeConfiguration {

    @Bean
    public WorkspacePathResolver workspacePathResolver(TranscodeProperties properties) {
        return new WorkspacePathResolver(properties.getRoots(), properties.isAllowSymlink());
    }
}
