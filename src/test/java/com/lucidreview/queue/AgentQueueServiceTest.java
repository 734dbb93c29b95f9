package com.lucidreview.queue;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AgentQueueServiceTest {

    @Test
    void testEnqueueIsIdempotentPerRun() {
        InMemoryJobQueue queue = new InMemoryJobQueue(10, 10, Duration.ofSeconds(30), Clock.systemUTC());
        AgentQueueService service = new AgentQueueService(queue);
        UUID runId = UUID.randomUUID();

        service.enqueue(runId, "ARF-1");
        service.enqueue(runId, "ARF-1");

        assertEquals(1, service.stats().waiting());
        assertTrue(service.remove(runId));
        assertFalse(service.remove(runId));
    }

    @Test
    void testStatsAreZeroWhenBackendFails() {
        JobQueue queue = mock(JobQueue.class);
        when(queue.stats()).thenThrow(new IllegalStateException("connection refused"));

        assertEquals(QueueStats.EMPTY, new AgentQueueService(queue).stats());
    }
}
