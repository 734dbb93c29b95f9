package com.lucidreview.queue;

/**
 * Queue-side lifecycle of a job. A job moves from WAITING to ACTIVE when a worker claims it,
 * and from ACTIVE to COMPLETED, FAILED or back to DELAYED for a retry.
 */
public enum JobState {
    WAITING,
    DELAYED,
    ACTIVE,
    COMPLETED,
    FAILED
}
