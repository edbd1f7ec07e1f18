package com.guno.orderpipeline.dto.internal;

import com.guno.orderpipeline.aggregation.CustomerSegment;
import com.guno.orderpipeline.aggregation.GroupMetrics;
import com.guno.orderpipeline.aggregation.RfmScore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of the aggregation contracts over the current canonical store
 */
@Value
@Builder
public class AnalyticsReport {

    GroupMetrics overall;
    List<Map.Entry<String, GroupMetrics>> topProducts;
    List<Map.Entry<String, GroupMetrics>> topSellers;
    Map<String, GroupMetrics> revenueByCoupon;
    Map<Instant, GroupMetrics> revenueByMonth;
    Map<CustomerSegment.Tier, Long> customersByTier;
    List<RfmScore> rfmScores;
    Instant referenceInstant;
    double churnRate;
    long customerCount;
}
