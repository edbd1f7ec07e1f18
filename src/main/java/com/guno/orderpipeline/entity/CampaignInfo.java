package com.guno.orderpipeline.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * CampaignInfo - discount/channel/coupon attached to an order or to a single line item.
 * Every field is populated after normalization; absence becomes the sentinel.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CampaignInfo {

    public static final String NO_CAMPAIGN = "no_campaign";

    @Builder.Default BigDecimal discount = BigDecimal.ZERO;
    @Builder.Default String channel = NO_CAMPAIGN;
    @Builder.Default String couponCode = NO_CAMPAIGN;

    /**
     * Fully defaulted struct used when the raw record carries no campaign at all
     */
    public static CampaignInfo none() {
        return CampaignInfo.builder().build();
    }

    @JsonIgnore
    public boolean isSentinel() {
        return NO_CAMPAIGN.equals(couponCode);
    }
}
