package com.lucidreview.repository;

import com.lucidreview.entity.AgentRun;
import com.lucidreview.entity.RunStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class AgentRunRepositoryTest extends BaseRepositoryTest {

    @Autowired
    private AgentRunRepository agentRunRepository;

    private AgentRun pending(String caseNumber) {
        return agentRunRepository.save(AgentRun.builder()
                .id(UUID.randomUUID())
                .caseNumber(caseNumber)
                .status(RunStatus.PENDING)
                .modelId("test-model")
                .startedAt(OffsetDateTime.now())
                .build());
    }

    @Test
    void testSaveAndFindStatus() {
        AgentRun run = pending("ARF-1");

        assertEquals(RunStatus.PENDING, agentRunRepository.findStatusById(run.getId()).orElseThrow());
        assertTrue(agentRunRepository.findStatusById(UUID.randomUUID()).isEmpty());
    }

    @Test
    void testTransitionOnlyFromExpectedStatus() {
        AgentRun run = pending("ARF-2");
        OffsetDateTime now = OffsetDateTime.now();

        assertEquals(1, agentRunRepository.transition(run.getId(), RunStatus.PENDING, RunStatus.RUNNING,
                "test-model", "v2", now));
        assertEquals(0, agentRunRepository.transition(run.getId(), RunStatus.PENDING, RunStatus.RUNNING,
                "test-model", "v2", now));
        assertEquals("v2", agentRunRepository.findById(run.getId()).orElseThrow().getPromptVersion());
    }

    @Test
    void testTerminalRunIsNeverOverwritten() {
        AgentRun run = pending("ARF-3");
        OffsetDateTime now = OffsetDateTime.now();
        EnumSet<RunStatus> active = EnumSet.of(RunStatus.PENDING, RunStatus.RUNNING);

        assertEquals(1, agentRunRepository.finish(run.getId(), active, RunStatus.CANCELLED, null, now));
        assertEquals(0, agentRunRepository.finish(run.getId(), active, RunStatus.FAILED, "late", now));
        assertEquals(0, agentRunRepository.complete(run.getId(), RunStatus.RUNNING, RunStatus.COMPLETED,
                null, 3, 10, 5, now));

        AgentRun stored = agentRunRepository.findById(run.getId()).orElseThrow();
        assertEquals(RunStatus.CANCELLED, stored.getStatus());
        assertNull(stored.getError());
        assertNotNull(stored.getCompletedAt());
    }

    @Test
    void testFindByCaseNumber() {
        pending("ARF-4");
        pending("ARF-4");
        pending("ARF-5");

        assertEquals(2, agentRunRepository.findByCaseNumberOrderByStartedAtDesc("ARF-4").size());
    }
}
