package com.lucidreview.queue;

import org.springframework.lang.Nullable;

import java.util.UUID;

/**
 * Queue payload for one review run. The run id doubles as the job key.
 *
 * @param attemptsMade failed attempts so far.
 * @param lastError error text of the most recent failed attempt.
 */
public record AgentJob(
        UUID runId,
        String caseNumber,
        int attemptsMade,
        @Nullable String lastError
) {

    public static AgentJob of(UUID runId, String caseNumber) {
        return new AgentJob(runId, caseNumber, 0, null);
    }

    public AgentJob withFailure(String error) {
        return new AgentJob(runId, caseNumber, attemptsMade + 1, error);
    }
}
