package com.guno.orderpipeline.exception;

import lombok.Getter;

/**
 * Batch stopped on a store level error. committedRecords tells where a resumed run picks up.
 */
@Getter
public class BatchAbortedException extends PipelineException {

    private final long committedRecords;

    public BatchAbortedException(String message, long committedRecords, Throwable cause) {
        super(message + " (committed records: " + committedRecords + ")", cause);
        this.committedRecords = committedRecords;
    }
}
