package com.lucidreview.orchestration.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ToolCallView(
        UUID id,
        UUID runId,
        int turnNumber,
        String toolUseId,
        String toolName,
        JsonNode input,
        JsonNode output,
        Long latencyMs,
        String error,
        OffsetDateTime createdAt
) {
}
