package com.guno.orderpipeline.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Customer - owned exclusively by its order, never shared
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Customer {

    public static final String UNKNOWN = "unknown";

    @Builder.Default String customerId = "";
    @Builder.Default String city = UNKNOWN;
    @Builder.Default String state = UNKNOWN;
}
