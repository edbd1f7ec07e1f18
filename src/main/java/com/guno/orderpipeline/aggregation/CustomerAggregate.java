package com.guno.orderpipeline.aggregation;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row per customer, rolled up from the flattened rows
 */
@Value
@Builder
public class CustomerAggregate {
    String customerId;
    String city;
    String state;
    long orderCount;
    long itemCount;
    BigDecimal totalSpend;
    Instant firstOrderAt;
    Instant lastOrderAt;
}
