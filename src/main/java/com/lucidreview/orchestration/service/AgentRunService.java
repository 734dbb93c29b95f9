package com.lucidreview.orchestration.service;

import com.lucidreview.config.ReviewAgentProperties;
import com.lucidreview.orchestration.api.AuditTrail;
import com.lucidreview.orchestration.api.RunStore;
import com.lucidreview.orchestration.model.AuditEventType;
import com.lucidreview.orchestration.model.AuditEventView;
import com.lucidreview.orchestration.model.AuditRecord;
import com.lucidreview.orchestration.model.RunTrace;
import com.lucidreview.orchestration.model.RunView;
import com.lucidreview.queue.AgentQueueService;
import com.lucidreview.queue.QueueStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for callers: starts reviews, reads their results back and cancels them.
 * Runs are executed asynchronously by the queue workers.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentRunService {

    private final RunStore runStore;
    private final AgentQueueService queueService;
    private final AuditTrail auditTrail;
    private final ReviewAgentProperties properties;

    /**
     * Creates a pending run and queues it. If the job cannot be queued the run is marked failed;
     * the run id is returned either way so the caller can inspect the outcome.
     */
    public UUID createAndEnqueue(String caseNumber) {
        UUID runId = UUID.randomUUID();
        runStore.createPendingRun(runId, caseNumber, properties.getModelId());
        auditTrail.record(new AuditRecord(caseNumber, AuditEventType.AGENT_RUN_QUEUED,
                AuditRecord.ActorType.USER, null, Map.of("runId", runId.toString())));
        try {
            queueService.enqueue(runId, caseNumber);
        } catch (Exception ex) {
            String error = "Failed to enqueue: " + ex.getMessage();
            log.error("Could not queue run {} for case {}: {}", runId, caseNumber, ex.getMessage());
            BestEffort.run("failure record for run " + runId, () -> runStore.failRun(runId, error));
        }
        return runId;
    }

    public Optional<RunView> getRun(UUID runId) {
        return runStore.findRun(runId);
    }

    public List<RunView> getRunsForCase(String caseNumber) {
        return runStore.findRunsForCase(caseNumber);
    }

    public Optional<RunTrace> getTrace(UUID runId) {
        return runStore.loadTrace(runId);
    }

    /**
     * Cancels a pending or running run. A running loop stops at its next turn boundary; a job
     * that has not been picked up yet is also removed from the queue.
     *
     * @return {@code true} if the run was pending or running.
     */
    public boolean cancelRun(UUID runId) {
        if (!runStore.cancelRun(runId)) {
            return false;
        }
        log.info("Run {} cancelled.", runId);
        BestEffort.run("queue removal for run " + runId, () -> queueService.remove(runId));
        String caseNumber = runStore.findRun(runId).map(RunView::caseNumber).orElse(null);
        auditTrail.record(new AuditRecord(caseNumber, AuditEventType.AGENT_RUN_CANCELLED,
                AuditRecord.ActorType.USER, null, Map.of("runId", runId.toString())));
        return true;
    }

    public List<AuditEventView> getAuditTrail(String caseNumber) {
        return auditTrail.forCase(caseNumber);
    }

    public QueueStats queueStats() {
        return queueService.stats();
    }
}
