package com.lucidreview.orchestration;

import com.lucidreview.config.ReviewAgentProperties;
import com.lucidreview.orchestration.api.AuditTrail;
import com.lucidreview.orchestration.api.ModelClient;
import com.lucidreview.orchestration.api.RunStore;
import com.lucidreview.orchestration.api.SystemPromptProvider;
import com.lucidreview.orchestration.api.ToolExecutionClient;
import com.lucidreview.orchestration.service.DeterminationExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds a run loop around the tool connection a worker opened for one job.
 */
@Component
@RequiredArgsConstructor
public class AgentRunLoopFactory {

    private final ModelClient modelClient;
    private final RunStore runStore;
    private final SystemPromptProvider promptProvider;
    private final AuditTrail auditTrail;
    private final DeterminationExtractor determinationExtractor;
    private final ReviewAgentProperties properties;

    public AgentRunLoop create(ToolExecutionClient toolClient) {
        return new AgentRunLoop(modelClient, toolClient, runStore, promptProvider, auditTrail,
                determinationExtractor, RunLoopSettings.from(properties));
    }
}
