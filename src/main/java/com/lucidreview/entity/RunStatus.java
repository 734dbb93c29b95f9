package com.lucidreview.entity;

/**
 * Lifecycle of an agent run. {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED};
 * cancellation is the only transition triggered from outside the run loop.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
