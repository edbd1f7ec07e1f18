package com.guno.orderpipeline.dto.internal;

/**
 * Why a record was kept out of the canonical store
 */
public enum RejectionReason {
    MISSING_IDENTITY,
    EMPTY_LINE_ITEMS,
    TYPE_COERCION,
    MALFORMED_RECORD
}
