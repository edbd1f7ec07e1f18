package com.guno.orderpipeline.aggregation;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Recency / frequency / monetary quintile scores, 5 is best
 */
@Value
public class RfmScore {
    String customerId;
    Long recencyDays;
    long frequency;
    BigDecimal monetary;
    int recencyScore;
    int frequencyScore;
    int monetaryScore;

    public String getRfmCode() {
        return "" + recencyScore + frequencyScore + monetaryScore;
    }
}
