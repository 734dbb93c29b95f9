package com.lucidreview.orchestration.service;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Fire-and-forget execution for writes whose failure must never reach the caller: audit
 * events, failure records written while already handling a failure, and queue clean-up.
 * Failures are logged at WARN and dropped.
 */
@Slf4j
public final class BestEffort {

    private BestEffort() {
    }

    public static void run(String description, Runnable action) {
        try {
            action.run();
        } catch (Exception ex) {
            log.warn("Best-effort {} failed: {}", description, ex.getMessage());
        }
    }

    public static <T> T get(String description, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (Exception ex) {
            log.warn("Best-effort {} failed: {}", description, ex.getMessage());
            return fallback;
        }
    }
}
