package com.guno.orderpipeline.dto.internal;

import com.guno.orderpipeline.entity.Order;
import lombok.Value;

/**
 * Outcome of one upsert: either a fresh insert or a wholesale replacement
 */
@Value
public class MergeResult {

    public enum MergeAction {
        INSERTED,
        REPLACED
    }

    String orderId;
    MergeAction action;

    /**
     * Record that was replaced, null on insert
     */
    Order previous;

    public static MergeResult inserted(String orderId) {
        return new MergeResult(orderId, MergeAction.INSERTED, null);
    }

    public static MergeResult replaced(String orderId, Order previous) {
        return new MergeResult(orderId, MergeAction.REPLACED, previous);
    }

    public boolean isInserted() {
        return action == MergeAction.INSERTED;
    }
}
