package com.guno.orderpipeline.exception;

/**
 * Base of every failure raised by the order pipeline
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
