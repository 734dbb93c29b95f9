package com.lucidreview.orchestration.model;

import java.util.Map;

public record ToolUseBlock(
        String toolUseId,
        String name,
        Map<String, Object> input
) implements ContentBlock {

    public ToolUseBlock {
        input = input == null ? Map.of() : input;
    }
}
