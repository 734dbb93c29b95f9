package com.lucidreview.queue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-process implementation of {@link JobQueue}. Jobs do not survive a restart; use it for
 * local development and tests.
 */
public class InMemoryJobQueue implements JobQueue {

    private final Map<UUID, AgentJob> jobs = new HashMap<>();
    private final Map<UUID, JobState> states = new HashMap<>();
    private final Deque<UUID> waiting = new ArrayDeque<>();
    private final Map<UUID, Instant> delayed = new LinkedHashMap<>();
    private final Deque<UUID> completed = new ArrayDeque<>();
    private final Deque<UUID> failed = new ArrayDeque<>();
    private final Map<UUID, Instant> leases = new HashMap<>();
    private final int keepCompleted;
    private final int keepFailed;
    private final Duration lockDuration;
    private final Clock clock;

    public InMemoryJobQueue(int keepCompleted, int keepFailed, Duration lockDuration, Clock clock) {
        this.keepCompleted = keepCompleted;
        this.keepFailed = keepFailed;
        this.lockDuration = lockDuration;
        this.clock = clock;
    }

    @Override
    public synchronized boolean add(AgentJob job) {
        if (jobs.containsKey(job.runId())) {
            return false;
        }
        jobs.put(job.runId(), job);
        states.put(job.runId(), JobState.WAITING);
        waiting.addLast(job.runId());
        return true;
    }

    @Override
    public synchronized Optional<AgentJob> claim() {
        promoteDueJobs();
        UUID runId = waiting.pollFirst();
        if (runId == null) {
            return Optional.empty();
        }
        states.put(runId, JobState.ACTIVE);
        leases.put(runId, clock.instant().plus(lockDuration));
        return Optional.of(jobs.get(runId));
    }

    @Override
    public synchronized void extendLease(UUID runId) {
        if (states.get(runId) == JobState.ACTIVE) {
            leases.put(runId, clock.instant().plus(lockDuration));
        }
    }

    @Override
    public synchronized List<AgentJob> reclaimStalled() {
        Instant now = clock.instant();
        List<AgentJob> stalled = new ArrayList<>();
        Iterator<Map.Entry<UUID, Instant>> expired = leases.entrySet().iterator();
        while (expired.hasNext()) {
            Map.Entry<UUID, Instant> entry = expired.next();
            if (!entry.getValue().isAfter(now)) {
                expired.remove();
                if (states.get(entry.getKey()) == JobState.ACTIVE) {
                    stalled.add(jobs.get(entry.getKey()));
                }
            }
        }
        return stalled;
    }

    @Override
    public synchronized void complete(AgentJob job) {
        if (states.get(job.runId()) != JobState.ACTIVE) {
            return;
        }
        leases.remove(job.runId());
        jobs.put(job.runId(), job);
        states.put(job.runId(), JobState.COMPLETED);
        completed.addFirst(job.runId());
        trim(completed, keepCompleted);
    }

    @Override
    public synchronized void retry(AgentJob job, Duration delay) {
        if (states.get(job.runId()) != JobState.ACTIVE) {
            return;
        }
        leases.remove(job.runId());
        jobs.put(job.runId(), job);
        states.put(job.runId(), JobState.DELAYED);
        delayed.put(job.runId(), clock.instant().plus(delay));
    }

    @Override
    public synchronized void fail(AgentJob job) {
        if (states.get(job.runId()) != JobState.ACTIVE) {
            return;
        }
        leases.remove(job.runId());
        jobs.put(job.runId(), job);
        states.put(job.runId(), JobState.FAILED);
        failed.addFirst(job.runId());
        trim(failed, keepFailed);
    }

    @Override
    public synchronized boolean remove(UUID runId) {
        boolean removed = waiting.remove(runId) || delayed.remove(runId) != null;
        if (removed) {
            forget(runId);
        }
        return removed;
    }

    @Override
    public synchronized Optional<JobState> state(UUID runId) {
        return Optional.ofNullable(states.get(runId));
    }

    @Override
    public synchronized QueueStats stats() {
        long active = states.values().stream().filter(state -> state == JobState.ACTIVE).count();
        return new QueueStats(waiting.size(), active, completed.size(), failed.size(), delayed.size());
    }

    private void promoteDueJobs() {
        Instant now = clock.instant();
        Iterator<Map.Entry<UUID, Instant>> due = delayed.entrySet().iterator();
        while (due.hasNext()) {
            Map.Entry<UUID, Instant> entry = due.next();
            if (!entry.getValue().isAfter(now)) {
                due.remove();
                states.put(entry.getKey(), JobState.WAITING);
                waiting.addLast(entry.getKey());
            }
        }
    }

    private void trim(Deque<UUID> retained, int keep) {
        while (retained.size() > Math.max(0, keep)) {
            forget(retained.pollLast());
        }
    }

    private void forget(UUID runId) {
        jobs.remove(runId);
        states.remove(runId);
    }
}
