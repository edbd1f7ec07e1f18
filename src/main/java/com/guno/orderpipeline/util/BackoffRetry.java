package com.guno.orderpipeline.util;

import com.guno.orderpipeline.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Retry loop for store calls. Only {@link StoreUnavailableException} is retried,
 * every other exception goes straight to the caller.
 */
@Slf4j
public class BackoffRetry {

    private final int maxAttempts;
    private final long initialBackoffMs;

    public BackoffRetry(int maxAttempts, long initialBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
    }

    public <T> T call(String operation, Supplier<T> action) {
        StoreUnavailableException lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (StoreUnavailableException e) {
                lastException = e;
                log.warn("{} attempt {}/{} failed: {}", operation, attempt, maxAttempts, e.getMessage());

                if (attempt < maxAttempts) {
                    try {
                        Thread.sleep(initialBackoffMs << (attempt - 1)); // Exponential backoff
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }

        log.error("{} failed after {} attempts", operation, maxAttempts, lastException);
        throw lastException;
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }
}
