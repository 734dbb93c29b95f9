package com.lucidreview.orchestration.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.lucidreview.orchestration.api.ToolExecutionClient;
import com.lucidreview.orchestration.model.ToolContent;
import com.lucidreview.orchestration.model.ToolDescriptor;
import com.lucidreview.orchestration.model.ToolResult;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link ToolExecutionClient} over an initialized MCP client session.
 */
@Slf4j
public class McpToolExecutionClient implements ToolExecutionClient {

    private static final TypeReference<Map<String, Object>> SCHEMA = new TypeReference<>() {
    };

    private final McpSyncClient client;
    private final JsonProcessingService jsonProcessingService;

    public McpToolExecutionClient(McpSyncClient client, JsonProcessingService jsonProcessingService) {
        this.client = client;
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    public List<ToolDescriptor> listTools() {
        List<ToolDescriptor> tools = new ArrayList<>();
        String cursor = null;
        do {
            McpSchema.ListToolsResult page = cursor == null ? client.listTools() : client.listTools(cursor);
            for (McpSchema.Tool tool : page.tools()) {
                Map<String, Object> schema = tool.inputSchema() == null
                        ? Map.of()
                        : jsonProcessingService.convert(tool.inputSchema(), SCHEMA);
                tools.add(new ToolDescriptor(tool.name(), tool.description(), schema));
            }
            cursor = page.nextCursor();
        } while (cursor != null);
        log.debug("MCP server exposes {} tools.", tools.size());
        return tools;
    }

    @Override
    public ToolResult callTool(String name, Map<String, Object> arguments) {
        McpSchema.CallToolResult result;
        try {
            result = client.callTool(McpSchema.CallToolRequest.builder()
                    .name(name)
                    .arguments(arguments)
                    .build());
        } catch (RuntimeException ex) {
            throw new ToolExecutionException(name, "Tool " + name + " failed: " + ex.getMessage(), ex);
        }
        List<ToolContent> content = result.content() == null
                ? List.of()
                : result.content().stream().map(McpToolExecutionClient::toContent).toList();
        return new ToolResult(content, Boolean.TRUE.equals(result.isError()));
    }

    static ToolContent toContent(McpSchema.Content content) {
        if (content instanceof McpSchema.TextContent text) {
            return ToolContent.text(text.text());
        }
        return new ToolContent(content.type(), null);
    }

    @Override
    public void close() {
        try {
            client.closeGracefully();
        } catch (Exception ex) {
            log.warn("Failed to close MCP client: {}", ex.getMessage());
        }
    }
}
