package com.lucidreview.orchestration.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.lucidreview.entity.RunStatus;
import org.springframework.lang.Nullable;

import java.util.UUID;

/**
 * Outcome of one run loop invocation. The loop never throws; failures are reported here.
 */
public record RunResult(
        UUID runId,
        RunStatus status,
        @Nullable JsonNode determination,
        @Nullable String error
) {

    public static RunResult completed(UUID runId, @Nullable JsonNode determination) {
        return new RunResult(runId, RunStatus.COMPLETED, determination, null);
    }

    public static RunResult failed(UUID runId, String error) {
        return new RunResult(runId, RunStatus.FAILED, null, error);
    }

    public static RunResult cancelled(UUID runId) {
        return new RunResult(runId, RunStatus.CANCELLED, null, null);
    }
}
