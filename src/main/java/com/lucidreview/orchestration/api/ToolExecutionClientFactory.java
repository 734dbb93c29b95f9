package com.lucidreview.orchestration.api;

/**
 * Opens a fresh {@link ToolExecutionClient} for each job.
 */
public interface ToolExecutionClientFactory {

    ToolExecutionClient open();
}
