package com.guno.orderpipeline.exception;

/**
 * Transient store failure; the batch write is retried with backoff
 */
public class StoreUnavailableException extends PipelineException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
