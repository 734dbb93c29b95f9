package com.lucidreview.queue;

import com.lucidreview.entity.RunStatus;
import com.lucidreview.orchestration.InMemoryRunStore;
import com.lucidreview.orchestration.api.AuditTrail;
import com.lucidreview.orchestration.api.RunStore;
import com.lucidreview.orchestration.model.AuditEventType;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class RunFailureHookTest {

    private final AuditTrail auditTrail = mock(AuditTrail.class);

    @Test
    void testMarksPendingRunFailed() {
        InMemoryRunStore runStore = new InMemoryRunStore();
        UUID runId = UUID.randomUUID();
        runStore.createPendingRun(runId, "ARF-1", "model");

        new RunFailureHook(runStore, auditTrail).onFinalFailure(new AgentJob(runId, "ARF-1", 2, "spawn failed"),
                "spawn failed");

        assertEquals(RunStatus.FAILED, runStore.run(runId).status());
        assertEquals("spawn failed", runStore.run(runId).error());
        verify(auditTrail).record(argThat(event -> event.eventType() == AuditEventType.AGENT_RUN_FAILED));
    }

    @Test
    void testLeavesTerminalRunUntouched() {
        InMemoryRunStore runStore = new InMemoryRunStore();
        UUID runId = UUID.randomUUID();
        runStore.createPendingRun(runId, "ARF-1", "model");
        runStore.cancelRun(runId);

        new RunFailureHook(runStore, auditTrail).onFinalFailure(AgentJob.of(runId, "ARF-1"), "late failure");

        assertEquals(RunStatus.CANCELLED, runStore.run(runId).status());
        verifyNoInteractions(auditTrail);
    }

    @Test
    void testStoreFailureIsSwallowed() {
        RunStore runStore = mock(RunStore.class);
        when(runStore.failRun(any(), anyString())).thenThrow(new IllegalStateException("database down"));

        assertDoesNotThrow(() -> new RunFailureHook(runStore, auditTrail)
                .onFinalFailure(AgentJob.of(UUID.randomUUID(), "ARF-1"), "boom"));
    }
}
