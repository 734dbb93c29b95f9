package com.lucidreview.queue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InMemoryJobQueueTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");
    private static final Duration LOCK = Duration.ofSeconds(30);

    private final Clock clock = mock(Clock.class);
    private InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        when(clock.instant()).thenReturn(NOW);
        queue = new InMemoryJobQueue(2, 2, LOCK, clock);
    }

    @Test
    void testSameRunIdIsQueuedOnce() {
        UUID runId = UUID.randomUUID();

        assertTrue(queue.add(AgentJob.of(runId, "ARF-1")));
        assertFalse(queue.add(AgentJob.of(runId, "ARF-1")));

        assertEquals(1, queue.stats().waiting());
    }

    @Test
    void testClaimsInArrivalOrder() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        queue.add(AgentJob.of(first, "ARF-1"));
        queue.add(AgentJob.of(second, "ARF-2"));

        assertEquals(first, queue.claim().orElseThrow().runId());
        assertEquals(second, queue.claim().orElseThrow().runId());
        assertTrue(queue.claim().isEmpty());
        assertEquals(new QueueStats(0, 2, 0, 0, 0), queue.stats());
    }

    @Test
    void testRemoveOnlyAffectsUnclaimedJobs() {
        UUID waiting = UUID.randomUUID();
        UUID active = UUID.randomUUID();
        queue.add(AgentJob.of(active, "ARF-1"));
        queue.add(AgentJob.of(waiting, "ARF-2"));
        queue.claim();

        assertTrue(queue.remove(waiting));
        assertFalse(queue.remove(active));
        assertFalse(queue.remove(UUID.randomUUID()));
        assertTrue(queue.state(waiting).isEmpty());
        assertEquals(JobState.ACTIVE, queue.state(active).orElseThrow());
    }

    @Test
    void testDelayedJobBecomesClaimableWhenDue() {
        UUID runId = UUID.randomUUID();
        queue.add(AgentJob.of(runId, "ARF-1"));
        AgentJob claimed = queue.claim().orElseThrow();

        queue.retry(claimed.withFailure("spawn failed"), Duration.ofSeconds(5));

        assertEquals(JobState.DELAYED, queue.state(runId).orElseThrow());
        assertTrue(queue.claim().isEmpty());
        when(clock.instant()).thenReturn(NOW.plusSeconds(5));
        AgentJob retried = queue.claim().orElseThrow();
        assertEquals(1, retried.attemptsMade());
        assertEquals("spawn failed", retried.lastError());
    }

    @Test
    void testDelayedJobCanBeRemoved() {
        UUID runId = UUID.randomUUID();
        queue.add(AgentJob.of(runId, "ARF-1"));
        queue.retry(queue.claim().orElseThrow(), Duration.ofMinutes(1));

        assertTrue(queue.remove(runId));
        assertEquals(QueueStats.EMPTY, queue.stats());
    }

    @Test
    void testFinishedJobsAreTrimmedToRetention() {
        for (int i = 0; i < 3; i++) {
            queue.add(AgentJob.of(UUID.randomUUID(), "ARF-" + i));
            queue.complete(queue.claim().orElseThrow());
        }
        UUID failed = UUID.randomUUID();
        queue.add(AgentJob.of(failed, "ARF-F"));
        queue.fail(queue.claim().orElseThrow());

        assertEquals(new QueueStats(0, 0, 2, 1, 0), queue.stats());
        assertEquals(JobState.FAILED, queue.state(failed).orElseThrow());
    }

    @Test
    void testTrimmedJobKeyCanBeReused() {
        InMemoryJobQueue noRetention = new InMemoryJobQueue(0, 0, LOCK, clock);
        UUID runId = UUID.randomUUID();
        noRetention.add(AgentJob.of(runId, "ARF-1"));
        noRetention.complete(noRetention.claim().orElseThrow());

        assertTrue(noRetention.add(AgentJob.of(runId, "ARF-1")));
    }

    @Test
    void testExpiredLeaseIsReclaimedOnce() {
        UUID runId = UUID.randomUUID();
        queue.add(AgentJob.of(runId, "ARF-1"));
        queue.claim();

        assertTrue(queue.reclaimStalled().isEmpty());
        when(clock.instant()).thenReturn(NOW.plus(LOCK));

        assertEquals(List.of(AgentJob.of(runId, "ARF-1")), queue.reclaimStalled());
        assertTrue(queue.reclaimStalled().isEmpty());
        assertEquals(JobState.ACTIVE, queue.state(runId).orElseThrow());

        queue.retry(AgentJob.of(runId, "ARF-1").withFailure("stalled"), Duration.ofSeconds(5));
        assertEquals(JobState.DELAYED, queue.state(runId).orElseThrow());
    }

    @Test
    void testExtendedLeaseIsNotReclaimed() {
        UUID runId = UUID.randomUUID();
        queue.add(AgentJob.of(runId, "ARF-1"));
        queue.claim();

        when(clock.instant()).thenReturn(NOW.plusSeconds(20));
        queue.extendLease(runId);
        when(clock.instant()).thenReturn(NOW.plusSeconds(40));

        assertTrue(queue.reclaimStalled().isEmpty());
    }

    @Test
    void testFinishedJobHasNoLease() {
        UUID runId = UUID.randomUUID();
        queue.add(AgentJob.of(runId, "ARF-1"));
        queue.complete(queue.claim().orElseThrow());

        queue.extendLease(runId);
        when(clock.instant()).thenReturn(NOW.plus(LOCK).plusSeconds(1));

        assertTrue(queue.reclaimStalled().isEmpty());
    }
}
