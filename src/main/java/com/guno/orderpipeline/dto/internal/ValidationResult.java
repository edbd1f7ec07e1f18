package com.guno.orderpipeline.dto.internal;

import com.guno.orderpipeline.entity.Order;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either the validated order or the reason it was rejected
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult {

    Order order;
    RejectionReason reason;
    String message;

    public static ValidationResult valid(Order order) {
        return new ValidationResult(order, null, null);
    }

    public static ValidationResult rejected(Order order, RejectionReason reason, String message) {
        return new ValidationResult(order, reason, message);
    }

    public boolean isValid() {
        return reason == null;
    }
}
