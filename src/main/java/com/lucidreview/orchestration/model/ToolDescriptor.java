package com.lucidreview.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Tool as advertised by the tool-execution service.
 */
public record ToolDescriptor(
        String name,
        @Nullable String description,
        Map<String, Object> inputSchema
) {
}
