package com.lucidreview.orchestration.api;

import com.lucidreview.orchestration.model.ToolDescriptor;
import com.lucidreview.orchestration.model.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * Live connection to the tool-execution service, opened for the duration of one job.
 */
public interface ToolExecutionClient extends AutoCloseable {

    List<ToolDescriptor> listTools();

    ToolResult callTool(String name, Map<String, Object> arguments);

    /**
     * Releases the connection. Implementations log and ignore close failures.
     */
    @Override
    void close();
}
