package com.guno.orderpipeline.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Order - canonical nested record, keyed by orderId in the canonical store.
 * Replaced wholesale on re-delivery; never edited field by field.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Order {

    @Builder.Default String orderId = "";
    @Builder.Default Customer customer = Customer.builder().build();
    @Builder.Default String orderStatus = "unknown";

    /**
     * Null when the raw record had no usable timestamp; such orders are skipped by time-based groupings
     */
    Instant orderTimestamp;

    @Singular List<LineItem> orderItems;
    @Builder.Default CampaignInfo campaignDetails = CampaignInfo.none();
}
