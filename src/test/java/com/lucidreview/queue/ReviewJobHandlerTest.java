package com.lucidreview.queue;

import com.lucidreview.orchestration.AgentRunLoop;
import com.lucidreview.orchestration.AgentRunLoopFactory;
import com.lucidreview.orchestration.api.ToolExecutionClient;
import com.lucidreview.orchestration.api.ToolExecutionClientFactory;
import com.lucidreview.orchestration.model.RunResult;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReviewJobHandlerTest {

    private final ToolExecutionClientFactory toolClientFactory = mock(ToolExecutionClientFactory.class);
    private final AgentRunLoopFactory runLoopFactory = mock(AgentRunLoopFactory.class);
    private final ReviewJobHandler handler = new ReviewJobHandler(toolClientFactory, runLoopFactory);

    @Test
    void testRunsLoopForQueuedRunAndClosesToolClient() {
        UUID runId = UUID.randomUUID();
        ToolExecutionClient toolClient = mock(ToolExecutionClient.class);
        AgentRunLoop loop = mock(AgentRunLoop.class);
        when(toolClientFactory.open()).thenReturn(toolClient);
        when(runLoopFactory.create(toolClient)).thenReturn(loop);
        when(loop.run("ARF-1", runId)).thenReturn(RunResult.completed(runId, null));

        handler.handle(AgentJob.of(runId, "ARF-1"));

        verify(loop).run("ARF-1", runId);
        verify(toolClient).close();
    }

    @Test
    void testToolServerStartFailurePropagates() {
        when(toolClientFactory.open()).thenThrow(new IllegalStateException("Failed to start MCP tool server"));

        assertThrows(IllegalStateException.class, () -> handler.handle(AgentJob.of(UUID.randomUUID(), "ARF-1")));
        verifyNoInteractions(runLoopFactory);
    }
}
