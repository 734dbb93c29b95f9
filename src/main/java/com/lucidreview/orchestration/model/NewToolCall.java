package com.lucidreview.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record NewToolCall(
        UUID runId,
        int turnNumber,
        int callIndex,
        String toolUseId,
        String toolName,
        Map<String, Object> input,
        @Nullable List<ToolContent> output,
        long latencyMs,
        @Nullable String error
) {
}
