package com.lucidreview.orchestration.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lucidreview.orchestration.model.ToolContent;
import com.lucidreview.orchestration.model.ToolDescriptor;
import com.lucidreview.orchestration.model.ToolResult;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class McpToolExecutionClientTest {

    private final McpSyncClient mcpClient = mock(McpSyncClient.class);
    private final McpToolExecutionClient client =
            new McpToolExecutionClient(mcpClient, new JsonProcessingService(new ObjectMapper()));

    private static McpSchema.Tool tool(String name, String description) {
        return McpSchema.Tool.builder()
                .name(name)
                .description(description)
                .inputSchema(new McpSchema.JsonSchema("object",
                        Map.of("caseNumber", Map.of("type", "string")), List.of("caseNumber"), null, null, null))
                .build();
    }

    @Test
    void testListsToolsAcrossPages() {
        when(mcpClient.listTools()).thenReturn(new McpSchema.ListToolsResult(List.of(tool("um_get_case", "Fetch")), "page-2"));
        when(mcpClient.listTools("page-2")).thenReturn(new McpSchema.ListToolsResult(List.of(tool("policy_lookup", null)), null));

        List<ToolDescriptor> tools = client.listTools();

        assertEquals(List.of("um_get_case", "policy_lookup"), tools.stream().map(ToolDescriptor::name).toList());
        assertNull(tools.get(1).description());
        assertEquals("object", tools.get(0).inputSchema().get("type"));
        assertEquals(List.of("caseNumber"), tools.get(0).inputSchema().get("required"));
    }

    @Test
    void testCallToolMapsContentAndErrorFlag() {
        when(mcpClient.callTool(any(McpSchema.CallToolRequest.class))).thenReturn(McpSchema.CallToolResult.builder()
                .content(List.of(new McpSchema.TextContent("{\"status\":\"open\"}")))
                .isError(true)
                .build());

        ToolResult result = client.callTool("um_get_case", Map.of("caseNumber", "A"));

        assertTrue(result.error());
        assertEquals(List.of(ToolContent.text("{\"status\":\"open\"}")), result.content());
        ArgumentCaptor<McpSchema.CallToolRequest> request = ArgumentCaptor.forClass(McpSchema.CallToolRequest.class);
        verify(mcpClient).callTool(request.capture());
        assertEquals("um_get_case", request.getValue().name());
        assertEquals(Map.of("caseNumber", "A"), request.getValue().arguments());
    }

    @Test
    void testTransportFailureCarriesToolName() {
        when(mcpClient.callTool(any(McpSchema.CallToolRequest.class))).thenThrow(new RuntimeException("broken pipe"));

        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> client.callTool("pdf_extract_text", Map.of()));
        assertEquals("pdf_extract_text", ex.getToolName());
        assertTrue(ex.getMessage().contains("broken pipe"));
    }

    @Test
    void testCloseIgnoresFailures() {
        when(mcpClient.closeGracefully()).thenThrow(new RuntimeException("already closed"));

        assertDoesNotThrow(client::close);
    }
}
