package com.guno.orderpipeline.aggregation;

import lombok.Value;

/**
 * Customer-pair grouping: one customer buying from one seller
 */
@Value(staticConstructor = "of")
public class CustomerSellerKey {
    String customerId;
    String sellerId;
}
