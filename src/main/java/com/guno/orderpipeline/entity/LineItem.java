package com.guno.orderpipeline.entity;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * LineItem - one product entry inside an order's items array
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class LineItem {

    @Builder.Default String productId = "unknown";
    @Builder.Default BigDecimal price = BigDecimal.ZERO;
    Instant shippingLimitDate;
    @Builder.Default String sellerId = "unknown";
    @Builder.Default CampaignInfo campaignDetails = CampaignInfo.none();
}
