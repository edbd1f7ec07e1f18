package com.guno.orderpipeline.aggregation;

import com.guno.orderpipeline.entity.FlatRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * RevenueAggregator - stateless group-by reductions over flattened rows.
 *
 * Groups come back in first-seen order. Rows are reduced in parallel and the
 * partial groups merged, which is safe because {@link GroupMetrics} combines
 * associatively.
 */
@Component
@Slf4j
public class RevenueAggregator {

    public <K> Map<K, GroupMetrics> aggregate(List<FlatRow> rows, Function<FlatRow, K> keyFn) {
        return rows.parallelStream()
                .collect(Collectors.groupingBy(keyFn, LinkedHashMap::new, GroupMetrics.collector()));
    }

    public GroupMetrics overall(List<FlatRow> rows) {
        return rows.parallelStream().collect(GroupMetrics.collector());
    }

    public Map<String, GroupMetrics> byProduct(List<FlatRow> rows) {
        return aggregate(rows, FlatRow::getProductId);
    }

    public Map<String, GroupMetrics> bySeller(List<FlatRow> rows) {
        return aggregate(rows, FlatRow::getSellerId);
    }

    public Map<String, GroupMetrics> byCustomer(List<FlatRow> rows) {
        return aggregate(rows, FlatRow::getCustomerId);
    }

    public Map<GeoKey, GroupMetrics> byCityState(List<FlatRow> rows) {
        return aggregate(rows, row -> GeoKey.of(row.getCustomerCity(), row.getCustomerState()));
    }

    /**
     * Order-level coupon; the sentinel groups every order without a campaign
     */
    public Map<String, GroupMetrics> byCoupon(List<FlatRow> rows) {
        return aggregate(rows, FlatRow::getOrderCampaignCoupon);
    }

    public Map<String, GroupMetrics> byItemCoupon(List<FlatRow> rows) {
        return aggregate(rows, FlatRow::getItemCampaignCoupon);
    }

    /**
     * Rows without an order timestamp are left out
     */
    public Map<Instant, GroupMetrics> byTime(List<FlatRow> rows, TimeBucket bucket) {
        List<FlatRow> timed = rows.stream().filter(r -> r.getOrderTimestamp() != null).toList();
        if (timed.size() < rows.size()) {
            log.debug("{} rows without timestamp skipped for {} grouping", rows.size() - timed.size(), bucket);
        }
        return aggregate(timed, row -> bucket.truncate(row.getOrderTimestamp()));
    }

    public Map<CustomerSellerKey, GroupMetrics> byCustomerSeller(List<FlatRow> rows) {
        return aggregate(rows, row -> CustomerSellerKey.of(row.getCustomerId(), row.getSellerId()));
    }

    /**
     * Highest revenue first; equal totals keep first-seen order
     */
    public <K> List<Map.Entry<K, GroupMetrics>> topByRevenue(Map<K, GroupMetrics> groups, int limit) {
        return groups.entrySet().stream()
                .sorted((a, b) -> b.getValue().getTotalPrice().compareTo(a.getValue().getTotalPrice()))
                .limit(limit)
                .toList();
    }
}
