package com.lucidreview.queue;

import java.time.Duration;

/**
 * Bounded exponential backoff: attempt {@code n} that fails is retried after
 * {@code backoff * 2^(n-1)} until {@code attempts} tries have been made.
 */
public record JobRetryPolicy(
        int attempts,
        Duration backoff
) {

    private static final int MAX_SHIFT = 20;

    public JobRetryPolicy {
        attempts = Math.max(1, attempts);
        backoff = backoff == null ? Duration.ZERO : backoff;
    }

    public boolean shouldRetry(int attemptsMade) {
        return attemptsMade < attempts;
    }

    public Duration delayFor(int attemptsMade) {
        int shift = Math.min(Math.max(0, attemptsMade - 1), MAX_SHIFT);
        return backoff.multipliedBy(1L << shift);
    }
}
