package com.lucidreview.orchestration.model;

import java.util.List;

public record ToolResultBlock(
        String toolUseId,
        String toolName,
        List<ToolContent> content,
        boolean error
) implements ContentBlock {

    public ToolResultBlock {
        content = content == null ? List.of() : List.copyOf(content);
    }
}
