package com.lucidreview.orchestration.model;

import java.util.List;

public record ModelResponse(
        List<ContentBlock> content,
        StopReason stopReason,
        TokenUsage usage
) {

    public ModelResponse {
        content = content == null ? List.of() : List.copyOf(content);
        stopReason = stopReason == null ? StopReason.UNKNOWN : stopReason;
        usage = usage == null ? TokenUsage.ZERO : usage;
    }

    public List<ToolUseBlock> toolUses() {
        return content.stream()
                .filter(ToolUseBlock.class::isInstance)
                .map(ToolUseBlock.class::cast)
                .toList();
    }
}
