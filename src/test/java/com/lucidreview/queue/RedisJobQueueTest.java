package com.lucidreview.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lucidreview.orchestration.service.JsonProcessingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisJobQueueTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    private final StringRedisTemplate redis = mock(StringRedisTemplate.class);
    @SuppressWarnings("unchecked")
    private final ListOperations<String, String> listOps = mock(ListOperations.class);
    @SuppressWarnings("unchecked")
    private final ZSetOperations<String, String> zSetOps = mock(ZSetOperations.class);
    @SuppressWarnings("unchecked")
    private final HashOperations<String, Object, Object> hashOps = mock(HashOperations.class);
    private final JsonProcessingService json = new JsonProcessingService(new ObjectMapper());
    private RedisJobQueue queue;

    @BeforeEach
    void setUp() {
        when(redis.opsForList()).thenReturn(listOps);
        when(redis.opsForZSet()).thenReturn(zSetOps);
        doReturn(hashOps).when(redis).opsForHash();
        queue = new RedisJobQueue(redis, json, "agent-review", 2, 2, Duration.ofSeconds(30),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testAddPushesNewJobOnly() {
        UUID runId = UUID.randomUUID();
        String key = "agent-review:job:" + runId;
        when(hashOps.putIfAbsent(eq(key), eq(RedisJobQueue.FIELD_PAYLOAD), anyString())).thenReturn(true, false);

        assertTrue(queue.add(AgentJob.of(runId, "ARF-1")));
        assertFalse(queue.add(AgentJob.of(runId, "ARF-1")));

        verify(listOps, times(1)).leftPush("agent-review:wait", runId.toString());
        verify(hashOps).put(key, RedisJobQueue.FIELD_STATE, "WAITING");
    }

    @Test
    void testClaimPromotesDueJobsAndMovesToActive() {
        UUID due = UUID.randomUUID();
        UUID next = UUID.randomUUID();
        when(zSetOps.rangeByScore("agent-review:delayed", 0, NOW.toEpochMilli())).thenReturn(Set.of(due.toString()));
        when(zSetOps.remove("agent-review:delayed", due.toString())).thenReturn(1L);
        when(listOps.rightPopAndLeftPush("agent-review:wait", "agent-review:active")).thenReturn(next.toString());
        when(hashOps.get("agent-review:job:" + next, RedisJobQueue.FIELD_PAYLOAD))
                .thenReturn(json.toJson(AgentJob.of(next, "ARF-2")));

        Optional<AgentJob> claimed = queue.claim();

        assertEquals(AgentJob.of(next, "ARF-2"), claimed.orElseThrow());
        verify(listOps).leftPush("agent-review:wait", due.toString());
        verify(hashOps).put("agent-review:job:" + next, RedisJobQueue.FIELD_STATE, "ACTIVE");
        verify(zSetOps).add("agent-review:leases", next.toString(), NOW.toEpochMilli() + 30_000);
    }

    @Test
    void testReclaimStalledTakesExpiredActiveJobs() {
        UUID stalled = UUID.randomUUID();
        UUID finished = UUID.randomUUID();
        when(zSetOps.rangeByScore("agent-review:leases", 0, NOW.toEpochMilli()))
                .thenReturn(new LinkedHashSet<>(List.of(stalled.toString(), finished.toString())));
        when(zSetOps.remove("agent-review:leases", stalled.toString())).thenReturn(1L);
        when(zSetOps.remove("agent-review:leases", finished.toString())).thenReturn(1L);
        when(hashOps.get("agent-review:job:" + stalled, RedisJobQueue.FIELD_STATE)).thenReturn("ACTIVE");
        when(hashOps.get("agent-review:job:" + stalled, RedisJobQueue.FIELD_PAYLOAD))
                .thenReturn(json.toJson(AgentJob.of(stalled, "ARF-1")));
        when(hashOps.get("agent-review:job:" + finished, RedisJobQueue.FIELD_STATE)).thenReturn("COMPLETED");
        when(hashOps.get("agent-review:job:" + finished, RedisJobQueue.FIELD_PAYLOAD))
                .thenReturn(json.toJson(AgentJob.of(finished, "ARF-2")));

        assertEquals(List.of(AgentJob.of(stalled, "ARF-1")), queue.reclaimStalled());
    }

    @Test
    void testReclaimSkipsLeaseTakenByAnotherWorker() {
        UUID runId = UUID.randomUUID();
        when(zSetOps.rangeByScore("agent-review:leases", 0, NOW.toEpochMilli())).thenReturn(Set.of(runId.toString()));
        when(zSetOps.remove("agent-review:leases", runId.toString())).thenReturn(0L);

        assertTrue(queue.reclaimStalled().isEmpty());
        verify(hashOps, never()).get(anyString(), any());
    }

    @Test
    void testExtendLeaseOnlyForActiveJobs() {
        UUID active = UUID.randomUUID();
        UUID delayed = UUID.randomUUID();
        when(hashOps.get("agent-review:job:" + active, RedisJobQueue.FIELD_STATE)).thenReturn("ACTIVE");
        when(hashOps.get("agent-review:job:" + delayed, RedisJobQueue.FIELD_STATE)).thenReturn("DELAYED");

        queue.extendLease(active);
        queue.extendLease(delayed);

        verify(zSetOps).add("agent-review:leases", active.toString(), NOW.toEpochMilli() + 30_000);
        verify(zSetOps, never()).add(eq("agent-review:leases"), eq(delayed.toString()), anyDouble());
    }

    @Test
    void testClaimReturnsEmptyWhenNothingWaits() {
        when(zSetOps.rangeByScore(anyString(), anyDouble(), anyDouble())).thenReturn(Set.of());

        assertTrue(queue.claim().isEmpty());
    }

    @Test
    void testRemoveDeletesUnclaimedJob() {
        UUID runId = UUID.randomUUID();
        when(listOps.remove("agent-review:wait", 0, runId.toString())).thenReturn(1L);
        when(zSetOps.remove("agent-review:delayed", runId.toString())).thenReturn(0L);

        assertTrue(queue.remove(runId));
        verify(redis).delete("agent-review:job:" + runId);
    }

    @Test
    void testRemoveIgnoresClaimedJob() {
        UUID runId = UUID.randomUUID();
        when(listOps.remove("agent-review:wait", 0, runId.toString())).thenReturn(0L);
        when(zSetOps.remove("agent-review:delayed", runId.toString())).thenReturn(0L);

        assertFalse(queue.remove(runId));
        verify(redis, never()).delete(anyString());
    }

    @Test
    void testRetryParksJobUntilBackoffElapses() {
        UUID runId = UUID.randomUUID();

        queue.retry(AgentJob.of(runId, "ARF-1").withFailure("spawn failed"), Duration.ofSeconds(5));

XX, runId.toString(), NOW.toEpochMilli() + 5000);
        verify(hashOps).put("agent-review:job:" + runId, RedisJobQueue.FIELD_STATE, "DELAYED");
    }

    @Test
    void testCompleteTrimsRetainedJobs() {
        UUID runId = UUID.randomUUID();
        UUID evicted = UUID.randomUUID();
        when(listOps.size("agent-review:completed")).thenReturn(3L);
        when(listOps.rightPop("agent-review:completed")).thenReturn(evicted.toString());

        queue.complete(AgentJob.of(runId, "ARF-1"));

        verify(listOps).leftPush("agent-review:completed", runId.toString());
        verify(listOps, times(1)).rightPop("agent-review:completed");
        verify(redis).delete("agent-review:job:" + evicted);
    }

    @Test
    void testStatsReadsEveryCollection() {
        when(listOps.size("agent-review:wait")).thenReturn(4L);
        when(listOps.size("agent-review:active")).thenReturn(3L);
        when(listOps.size("agent-review:completed")).thenReturn(2L);
        when(listOps.size("agent-review:failed")).thenReturn(1L);
        when(zSetOps.zCard("agent-review:delayed")).thenReturn(5L);

        assertEquals(new QueueStats(4, 3, 2, 1, 5), queue.stats());
    }
}
