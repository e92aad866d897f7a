package org.rbxmd.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置。
 * <p>
 * Spring AI MCP Server 从容器中收集 {@link ToolCallback}，通过 stdio 暴露给 MCP 客户端。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> rbxlxToolCallbacks(RbxlxMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
