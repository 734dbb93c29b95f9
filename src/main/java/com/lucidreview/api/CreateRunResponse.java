package com.lucidreview.api;

import com.lucidreview.entity.RunStatus;

import java.util.UUID;

public record CreateRunResponse(
        UUID runId,
        RunStatus status
) {
}
