package com.guno.orderpipeline.entity;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * FlatRow - one row per (orderId, itemPosition), order and item level campaign fields side by side
 */
@Value
@Builder(toBuilder = true)
public class FlatRow {

    String orderId;
    int itemPosition;
    String customerId;
    String customerCity;
    String customerState;
    String orderStatus;
    Instant orderTimestamp;

    String productId;
    BigDecimal price;
    String sellerId;
    Instant shippingLimitDate;

    BigDecimal itemCampaignDiscount;
    String itemCampaignChannel;
    String itemCampaignCoupon;

    BigDecimal orderCampaignDiscount;
    String orderCampaignChannel;
    String orderCampaignCoupon;

    /**
     * Derived after projection, null until {@link CampaignFlag} has been applied
     */
    String campaignFlag;
}
