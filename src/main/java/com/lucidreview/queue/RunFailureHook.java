package com.lucidreview.queue;

import com.lucidreview.orchestration.api.AuditTrail;
import com.lucidreview.orchestration.api.RunStore;
import com.lucidreview.orchestration.model.AuditEventType;
import com.lucidreview.orchestration.model.AuditRecord;
import com.lucidreview.orchestration.service.BestEffort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

import static com.lucidreview.orchestration.OrchestrationConstants.AGENT_ACTOR_ID;

/**
 * Marks the run failed when its job gives up, so no run is left pending after the queue
 * stops trying.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RunFailureHook implements JobFailureHook {

    private final RunStore runStore;
    private final AuditTrail auditTrail;

    @Override
    public void onFinalFailure(AgentJob job, String error) {
        log.error("Agent job {} for case {} failed after {} attempts: {}", job.runId(), job.caseNumber(),
                job.attemptsMade(), error);
        boolean marked = BestEffort.get("failure record for run " + job.runId(),
                () -> runStore.failRun(job.runId(), error), false);
        if (marked) {
            auditTrail.record(new AuditRecord(job.caseNumber(), AuditEventType.AGENT_RUN_FAILED,
                    AuditRecord.ActorType.SYSTEM, AGENT_ACTOR_ID,
                    Map.of("runId", job.runId().toString(), "error", error)));
        }
    }
}
