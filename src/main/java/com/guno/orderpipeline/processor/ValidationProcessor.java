package com.guno.orderpipeline.processor;

import com.guno.orderpipeline.dto.internal.RejectionReason;
import com.guno.orderpipeline.dto.internal.ValidationResult;
import com.guno.orderpipeline.entity.Order;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ValidationProcessor - completeness gate in front of the canonical store.
 *
 * Only identity and line-item completeness reject; defaulted fields such as
 * "unknown" geography or a missing timestamp are kept.
 */
@Component
@Slf4j
public class ValidationProcessor {

    public ValidationResult validate(Order order) {
        if (order == null) {
            return ValidationResult.rejected(null, RejectionReason.MISSING_IDENTITY, "Order is null");
        }

        String orderId = order.getOrderId();
        if (isBlank(orderId)) {
            return ValidationResult.rejected(order, RejectionReason.MISSING_IDENTITY, "Order ID missing");
        }

        if (order.getCustomer() == null || isBlank(order.getCustomer().getCustomerId())) {
            return ValidationResult.rejected(order, RejectionReason.MISSING_IDENTITY,
                    "Customer ID missing for order " + orderId);
        }

        if (order.getOrderItems() == null || order.getOrderItems().isEmpty()) {
            return ValidationResult.rejected(order, RejectionReason.EMPTY_LINE_ITEMS,
                    "No items in order " + orderId);
        }

        if (order.getOrderTimestamp() == null) {
            log.debug("Order {} has no timestamp, excluded from time-based aggregation", orderId);
        }

        return ValidationResult.valid(order);
    }

    public List<ValidationResult> validateAll(List<Order> orders) {
        List<ValidationResult> results = orders.stream().map(this::validate).toList();
        log.info("Validation completed: {}", getValidationSummary(results));
        return results;
    }

    /**
     * Count of rejected results per reason
     */
    public Map<RejectionReason, Long> countRejections(List<ValidationResult> results) {
        return results.stream()
                .filter(r -> !r.isValid())
                .collect(Collectors.groupingBy(ValidationResult::getReason, Collectors.counting()));
    }

    public String getValidationSummary(List<ValidationResult> results) {
        long rejected = results.stream().filter(r -> !r.isValid()).count();
        if (rejected == 0) {
            return String.format("%d valid, no rejections", results.size());
        }

        String byReason = countRejections(results).entrySet().stream()
                .map(e -> e.getKey().name() + "=" + e.getValue())
                .sorted()
                .collect(Collectors.joining(", ", "[", "]"));
        return String.format("%d valid, %d rejected %s", results.size() - rejected, rejected, byReason);
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
