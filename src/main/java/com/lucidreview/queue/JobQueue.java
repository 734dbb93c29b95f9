package com.lucidreview.queue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Contract for the durable review queue. Jobs are keyed by run id; finished jobs are retained
 * up to a configured count and then dropped, which frees their key.
 */
public interface JobQueue {

    /**
     * Adds a job in the WAITING state.
     *
     * @return {@code false} if a job with the same run id is already known to the queue.
     */
    boolean add(AgentJob job);

    /**
     * Promotes delayed jobs that are due, then moves the oldest waiting job to ACTIVE and takes
     * a lease on it.
     */
    Optional<AgentJob> claim();

    /**
     * Renews the lease of an active job. Workers call this periodically while the job runs.
     */
    void extendLease(UUID runId);

    /**
     * Takes the active jobs whose lease ran out, typically because the process that claimed them
     * died or was stopped mid-job. The returned jobs are still ACTIVE; the caller must pass each
     * one to {@link #retry} or {@link #fail}.
     */
    List<AgentJob> reclaimStalled();

    void complete(AgentJob job);

    /**
     * Parks an active job until {@code delay} has elapsed.
     */
    void retry(AgentJob job, Duration delay);

    void fail(AgentJob job);

    /**
     * Removes a job that no worker has claimed yet.
     *
     * @return {@code true} if a waiting or delayed job was removed.
     */
    boolean remove(UUID runId);

    Optional<JobState> state(UUID runId);

    QueueStats stats();
}
