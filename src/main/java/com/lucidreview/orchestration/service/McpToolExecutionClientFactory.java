package com.lucidreview.orchestration.service;

import com.lucidreview.config.ReviewAgentProperties;
import com.lucidreview.orchestration.api.ToolExecutionClient;
import com.lucidreview.orchestration.api.ToolExecutionClientFactory;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.lucidreview.orchestration.OrchestrationConstants.AGENT_ACTOR_ID;

/**
 * Launches the MCP tool server as a child process over stdio, one process per job.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpToolExecutionClientFactory implements ToolExecutionClientFactory {

    private static final String CLIENT_VERSION = "0.1.0";

    private final ReviewAgentProperties properties;
    private final JsonProcessingService jsonProcessingService;

    @Override
    public ToolExecutionClient open() {
        ReviewAgentProperties.ToolServerConfig config = properties.getTools();
        ServerParameters parameters = ServerParameters.builder(config.getCommand())
                .args(config.getArgs())
                .env(config.getEnv())
                .build();
        McpSyncClient client = McpClient.sync(new StdioClientTransport(parameters, McpJsonMapper.createDefault()))
                .requestTimeout(config.getRequestTimeout())
                .clientInfo(new McpSchema.Implementation(AGENT_ACTOR_ID, CLIENT_VERSION))
                .build();
        try {
            client.initialize();
        } catch (RuntimeException ex) {
            client.close();
            throw new IllegalStateException("Failed to start MCP tool server '" + config.getCommand() + "': "
                    + ex.getMessage(), ex);
        }
        log.debug("MCP tool server started: {} {}", config.getCommand(), config.getArgs());
        return new McpToolExecutionClient(client, jsonProcessingService);
    }
}
