package com.lucidreview.queue;

/**
 * Invoked once a job has exhausted its attempts.
 */
public interface JobFailureHook {

    void onFinalFailure(AgentJob job, String error);
}
