package com.guno.orderpipeline.processor;

import com.guno.orderpipeline.dto.internal.RejectionReason;
import com.guno.orderpipeline.dto.internal.ValidationResult;
import com.guno.orderpipeline.entity.Customer;
import com.guno.orderpipeline.entity.LineItem;
import com.guno.orderpipeline.entity.Order;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ValidationProcessorTest {

    private final ValidationProcessor validationProcessor = new ValidationProcessor();

    @Test
    void shouldAcceptCompleteOrderEvenWithDefaults() {
        Order order = order("O1", "C1").toBuilder().orderTimestamp(null).build();

        ValidationResult result = validationProcessor.validate(order);

        assertThat(result.isValid()).isTrue();
        assertThat(result.getOrder()).isSameAs(order);
        assertThat(result.getReason()).isNull();
    }

    @Test
    void shouldRejectMissingIdentity() {
        assertThat(validationProcessor.validate(order("", "C1")).getReason())
                .isEqualTo(RejectionReason.MISSING_IDENTITY);
        assertThat(validationProcessor.validate(order("O1", "  ")).getReason())
                .isEqualTo(RejectionReason.MISSING_IDENTITY);
        assertThat(validationProcessor.validate(null).getReason())
                .isEqualTo(RejectionReason.MISSING_IDENTITY);
    }

    @Test
    void shouldRejectOrderWithoutItems() {
        Order empty = order("O1", "C1").toBuilder().clearOrderItems().build();

        ValidationResult result = validationProcessor.validate(empty);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getReason()).isEqualTo(RejectionReason.EMPTY_LINE_ITEMS);
        assertThat(result.getMessage()).contains("O1");
    }

    @Test
    void shouldCountRejectionsByReason() {
        List<ValidationResult> results = validationProcessor.validateAll(List.of(
                order("O1", "C1"),
                order("", "C1"),
                order("O3", ""),
                order("O4", "C4").toBuilder().clearOrderItems().build()));

        Map<RejectionReason, Long> counts = validationProcessor.countRejections(results);

        assertThat(counts).containsEntry(RejectionReason.MISSING_IDENTITY, 2L)
                .containsEntry(RejectionReason.EMPTY_LINE_ITEMS, 1L)
                .doesNotContainKey(RejectionReason.TYPE_COERCION);
    }

    private Order order(String orderId, String customerId) {
        return Order.builder()
                .orderId(orderId)
                .customer(Customer.builder().customerId(customerId).build())
                .orderItem(LineItem.builder().productId("P1").build())
                .build();
    }
}
