package com.lucidreview.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AgentQueueService {

    private final JobQueue queue;

    /**
     * Queues a review run. A second call for the same run id is a no-op.
     */
    public void enqueue(UUID runId, String caseNumber) {
        if (queue.add(AgentJob.of(runId, caseNumber))) {
            log.info("Queued agent job {} for case {}.", runId, caseNumber);
        } else {
            log.debug("Agent job {} is already queued.", runId);
        }
    }

    /**
     * Removes a job that no worker has picked up yet.
     */
    public boolean remove(UUID runId) {
        boolean removed = queue.remove(runId);
        if (removed) {
            log.info("Removed agent job {} from the queue.", runId);
        }
        return removed;
    }

    /**
     * Job counts per state; all zeros when the queue backend cannot be reached.
     */
    public QueueStats stats() {
        try {
            return queue.stats();
        } catch (Exception ex) {
            log.warn("Queue stats unavailable: {}", ex.getMessage());
            return QueueStats.EMPTY;
        }
    }
}
