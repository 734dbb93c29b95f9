package com.lucidreview.orchestration.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.lucidreview.entity.RunStatus;

import java.time.OffsetDateTime;
import java.util.UUID;

public record RunView(
        UUID id,
        String caseNumber,
        RunStatus status,
        String modelId,
        String promptVersion,
        int totalTurns,
        JsonNode determination,
        String error,
        long inputTokensTotal,
        long outputTokensTotal,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt
) {
}
