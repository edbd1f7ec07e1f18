package com.guno.orderpipeline.aggregation;

import lombok.Value;

@Value
public class ChurnStatus {
    String customerId;

    /**
     * Null when none of the customer's orders had a timestamp
     */
    Long recencyDays;

    boolean churned;
}
