package com.guno.orderpipeline.exception;

import lombok.Getter;

/**
 * A raw field could not be coerced to its canonical type. Rejects the record, never the batch.
 */
@Getter
public class TypeCoercionException extends PipelineException {

    private final String fieldPath;
    private final String rawValue;

    public TypeCoercionException(String fieldPath, String rawValue, String reason) {
        super(String.format("Cannot coerce %s = '%s': %s", fieldPath, rawValue, reason));
        this.fieldPath = fieldPath;
        this.rawValue = rawValue;
    }
}
