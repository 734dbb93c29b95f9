package com.lucidreview.queue;

import com.lucidreview.orchestration.service.JsonProcessingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Redis-backed {@link JobQueue}. Layout, all keys prefixed with the queue name:
 * <ul>
 *     <li>{@code <name>:job:<runId>} hash holding the payload and the job state</li>
 *     <li>{@code <name>:wait} and {@code <name>:active} lists of run ids</li>
 *     <li>{@code <name>:delayed} sorted set scored by the epoch millisecond the job is due</li>
 *     <li>{@code <name>:leases} sorted set of active run ids scored by the epoch millisecond their lease ends</li>
 *     <li>{@code <name>:completed} and {@code <name>:failed} lists, newest first, trimmed to the retention count</li>
 * </ul>
 * Claiming moves an id from the wait list to the active list atomically, so a job handed to one
 * worker can no longer be removed by a cancel. A claimed job whose lease is not renewed is
 * handed back by {@link #reclaimStalled()}.
 */
@Slf4j
public class RedisJobQueue implements JobQueue {

    static final String FIELD_PAYLOAD = "payload";
    static final String FIELD_STATE = "state";

    private final StringRedisTemplate redis;
    private final JsonProcessingService jsonProcessingService;
    private final String name;
    private final int keepCompleted;
    private final int keepFailed;
    private final Duration lockDuration;
    private final Clock clock;

    public RedisJobQueue(StringRedisTemplate redis, JsonProcessingService jsonProcessingService, String name,
                         int keepCompleted, int keepFailed, Duration lockDuration, Clock clock) {
        this.redis = redis;
        this.jsonProcessingService = jsonProcessingService;
        this.name = name;
        this.keepCompleted = keepCompleted;
        this.keepFailed = keepFailed;
        this.lockDuration = lockDuration;
        this.clock = clock;
    }

    @Override
    public boolean add(AgentJob job) {
        String key = jobKey(job.runId());
        Boolean created = hash().putIfAbsent(key, FIELD_PAYLOAD, jsonProcessingService.toJson(job));
        if (!Boolean.TRUE.equals(created)) {
            return false;
        }
        hash().put(key, FIELD_STATE, JobState.WAITING.name());
        redis.opsForList().leftPush(waitKey(), job.runId().toString());
        return true;
    }

    @Override
    public Optional<AgentJob> claim() {
        promoteDueJobs();
        String id = redis.opsForList().rightPopAndLeftPush(waitKey(), activeKey());
        if (id == null) {
            return Optional.empty();
        }
        String key = jobKey(UUID.fromString(id));
        Object payload = hash().get(key, FIELD_PAYLOAD);
        if (payload == null) {
            log.warn("Dropping job {} from queue {}: payload is missing.", id, name);
            redis.opsForList().remove(activeKey(), 1, id);
            return Optional.empty();
        }
        hash().put(key, FIELD_STATE, JobState.ACTIVE.name());
        redis.opsForZSet().add(leasesKey(), id, leaseDeadline());
        return Optional.of(jsonProcessingService.readValue(payload.toString(), AgentJob.class));
    }

    @Override
    public void extendLease(UUID runId) {
        if (state(runId).filter(state -> state == JobState.ACTIVE).isPresent()) {
            redis.opsForZSet().add(leasesKey(), runId.toString(), leaseDeadline());
        }
    }

    @Override
    public List<AgentJob> reclaimStalled() {
        Set<String> expired = redis.opsForZSet().rangeByScore(leasesKey(), 0, clock.millis());
        List<AgentJob> stalled = new ArrayList<>();
        if (expired == null) {
            return stalled;
        }
        for (String id : expired) {
            // Only the caller that actually removes the lease takes the job.
            if (!positive(redis.opsForZSet().remove(leasesKey(), id))) {
                continue;
            }
            String key = jobKey(UUID.fromString(id));
            Object state = hash().get(key, FIELD_STATE);
            Object payload = hash().get(key, FIELD_PAYLOAD);
            if (!JobState.ACTIVE.name().equals(state) || payload == null) {
                continue;
            }
            log.warn("Job {} on queue {} stalled: its lease expired.", id, name);
            stalled.add(jsonProcessingService.readValue(payload.toString(), AgentJob.class));
        }
        return stalled;
    }

    @Override
    public void complete(AgentJob job) {
        finish(job, JobState.COMPLETED, completedKey(), keepCompleted);
    }

    @Override
    public void retry(AgentJob job, Duration delay) {
        String id = job.runId().toString();
        store(job, JobState.DELAYED);
        redis.opsForList().remove(activeKey(), 1, id);
        redis.opsForZSet().remove(leasesKey(), id);
        redis.opsForZSet().add(delayedKey(), id, clock.millis() + delay.toMillis());
    }

    @Override
    public void fail(AgentJob job) {
        finish(job, JobState.FAILED, failedKey(), keepFailed);
    }

    @Override
    public boolean remove(UUID runId) {
        String id = runId.toString();
        Long fromWait = redis.opsForList().remove(waitKey(), 0, id);
        Long fromDelayed = redis.opsForZSet().remove(delayedKey(), id);
        boolean removed = positive(fromWait) || positive(fromDelayed);
        if (removed) {
            redis.delete(jobKey(runId));
        }
        return removed;
    }

    @Override
    public Optional<JobState> state(UUID runId) {
        Object state = hash().get(jobKey(runId), FIELD_STATE);
        return state == null ? Optional.empty() : Optional.of(JobState.valueOf(state.toString()));
    }

    @Override
    public QueueStats stats() {
        return new QueueStats(
                size(redis.opsForList().size(waitKey())),
                size(redis.opsForList().size(activeKey())),
                size(redis.opsForList().size(completedKey())),
                size(redis.opsForList().size(failedKey())),
                size(redis.opsForZSet().zCard(delayedKey())));
    }

    private void promoteDueJobs() {
        Set<String> due = redis.opsForZSet().rangeByScore(delayedKey(), 0, clock.millis());
        if (due == null) {
            return;
        }
        for (String id : due) {
            // Only the caller that actually removes the entry requeues it.
            if (positive(redis.opsForZSet().remove(delayedKey(), id))) {
                hash().put(jobKey(UUID.fromString(id)), FIELD_STATE, JobState.WAITING.name());
                redis.opsForList().leftPush(waitKey(), id);
            }
        }
    }

    private void finish(AgentJob job, JobState state, String listKey, int keep) {
        String id = job.runId().toString();
        store(job, state);
        redis.opsForList().remove(activeKey(), 1, id);
        redis.opsForZSet().remove(leasesKey(), id);
        redis.opsForList().leftPush(listKey, id);
        long overflow = size(redis.opsForList().size(listKey)) - Math.max(0, keep);
        for (long i = 0; i < overflow; i++) {
            String evicted = redis.opsForList().rightPop(listKey);
            if (evicted != null) {
                redis.delete(jobKey(UUID.fromString(evicted)));
            }
        }
    }

    private void store(AgentJob job, JobState state) {
        String key = jobKey(job.runId());
        hash().put(key, FIELD_PAYLOAD, jsonProcessingService.toJson(job));
        hash().put(key, FIELD_STATE, state.name());
    }

    private long leaseDeadline() {
        return clock.millis() + lockDuration.toMillis();
    }

    private HashOperations<String, Object, Object> hash() {
        return redis.opsForHash();
    }

    private static boolean positive(Long value) {
        return value != null && value > 0;
    }

    private static long size(Long value) {
        return value == null ? 0 : value;
    }

    String jobKey(UUID runId) {
        return name + ":job:" + runId;
    }

    String waitKey() {
        return name + ":wait";
    }

    String activeKey() {
        return name + ":active";
    }

    String delayedKey() {
        return name + ":delayed";
    }

    String leasesKey() {
        return name + ":leases";
    }

    String completedKey() {
        return name + ":completed";
    }

    String failedKey() {
        return name + ":failed";
    }
}
