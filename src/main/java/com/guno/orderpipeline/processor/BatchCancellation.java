package com.guno.orderpipeline.processor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancel flag, checked between records
 */
public class BatchCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static BatchCancellation none() {
        return new BatchCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
