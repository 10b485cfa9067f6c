package org.stepreduce.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册：Spring AI MCP Server 从容器中收集 {@link ToolCallback} 并通过 MCP 协议暴露。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> stepReduceToolCallbacks(StepReduceMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
