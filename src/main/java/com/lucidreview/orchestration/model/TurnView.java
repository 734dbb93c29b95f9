package com.lucidreview.orchestration.model;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record TurnView(
        UUID id,
        UUID runId,
        int turnNumber,
        String role,
        List<ContentBlock> content,
        String stopReason,
        long inputTokens,
        long outputTokens,
        Long latencyMs,
        OffsetDateTime createdAt
) {
}
