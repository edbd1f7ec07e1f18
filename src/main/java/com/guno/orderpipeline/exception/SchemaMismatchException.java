package com.guno.orderpipeline.exception;

/**
 * Rows or statements do not match the table schema. Fatal, needs an operator.
 */
public class SchemaMismatchException extends PipelineException {

    public SchemaMismatchException(String message) {
        super(message);
    }
}
