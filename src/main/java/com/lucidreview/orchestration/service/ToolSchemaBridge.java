package com.lucidreview.orchestration.service;

import com.lucidreview.orchestration.model.ModelToolSpec;
import com.lucidreview.orchestration.model.ToolDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Translates tool descriptors from the tool-execution service into model tool specifications.
 * Schemas are passed through untouched; their validity is the tool service's concern.
 */
public final class ToolSchemaBridge {

    private ToolSchemaBridge() {
    }

    public static List<ModelToolSpec> toModelTools(List<ToolDescriptor> tools) {
        if (tools == null || tools.isEmpty()) {
            return List.of();
        }
        return tools.stream()
                .map(ToolSchemaBridge::toModelTool)
                .toList();
    }

    static ModelToolSpec toModelTool(ToolDescriptor tool) {
        String description = tool.description() != null ? tool.description() : "";
        Map<String, Object> schema = tool.inputSchema() != null ? tool.inputSchema() : Map.of();
        return new ModelToolSpec(tool.name(), description, schema);
    }
}
