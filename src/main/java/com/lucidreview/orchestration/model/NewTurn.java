package com.lucidreview.orchestration.model;

import java.util.List;
import java.util.UUID;

public record NewTurn(
        UUID runId,
        int turnNumber,
        List<ContentBlock> content,
        StopReason stopReason,
        TokenUsage usage,
        long latencyMs
) {
}
