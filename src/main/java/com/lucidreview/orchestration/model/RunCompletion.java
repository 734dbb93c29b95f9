package com.lucidreview.orchestration.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.lang.Nullable;

public record RunCompletion(
        int totalTurns,
        TokenUsage usage,
        @Nullable JsonNode determination
) {
}
