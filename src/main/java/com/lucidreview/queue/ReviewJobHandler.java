package com.lucidreview.queue;

import com.lucidreview.orchestration.AgentRunLoopFactory;
import com.lucidreview.orchestration.api.ToolExecutionClient;
import com.lucidreview.orchestration.api.ToolExecutionClientFactory;
import com.lucidreview.orchestration.model.RunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs the review for a job against a tool server started just for it. Failing to start the
 * tool server propagates so the job is retried; failures inside the run are already recorded
 * on the run and complete the job.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReviewJobHandler implements AgentJobHandler {

    private final ToolExecutionClientFactory toolClientFactory;
    private final AgentRunLoopFactory runLoopFactory;

    @Override
    public void handle(AgentJob job) {
        log.info("Processing agent job {} for case {} (attempt {}).", job.runId(), job.caseNumber(),
                job.attemptsMade() + 1);
        try (ToolExecutionClient toolClient = toolClientFactory.open()) {
            RunResult result = runLoopFactory.create(toolClient).run(job.caseNumber(), job.runId());
            log.info("Agent job {} finished with status {}.", job.runId(), result.status());
        }
    }
}
