package com.guno.orderpipeline.entity;

import java.util.Locale;

/**
 * campaign_flag derivation over an already flattened row
 */
public enum CampaignFlag {

    CAMPAIGN_USED("Campaign Used"),
    NOT_USING_CAMPAIGNS("Not Using Campaigns");

    private final String label;

    CampaignFlag(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static CampaignFlag forCoupon(String couponCode) {
        if (couponCode == null || CampaignInfo.NO_CAMPAIGN.equals(couponCode.toLowerCase(Locale.ROOT))) {
            return NOT_USING_CAMPAIGNS;
        }
        return CAMPAIGN_USED;
    }

    /**
     * Derive from the order-level coupon, the one the campaign reports group on
     */
    public static CampaignFlag of(FlatRow row) {
        return forCoupon(row.getOrderCampaignCoupon());
    }

    public static FlatRow apply(FlatRow row) {
        return row.toBuilder().campaignFlag(of(row).getLabel()).build();
    }
}
