package com.lucidreview.queue;

/**
 * Processes one claimed job. Throwing marks the attempt as failed and lets the worker apply
 * the retry policy.
 */
public interface AgentJobHandler {

    void handle(AgentJob job);
}
