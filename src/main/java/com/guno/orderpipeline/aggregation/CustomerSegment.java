package com.guno.orderpipeline.aggregation;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class CustomerSegment {

    public enum Tier {
        LOW("Low"), MID("Mid"), HIGH("High");

        private final String label;

        Tier(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    String customerId;
    BigDecimal totalSpend;
    Tier tier;
}
