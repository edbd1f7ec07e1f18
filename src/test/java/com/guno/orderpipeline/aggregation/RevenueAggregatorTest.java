package com.guno.orderpipeline.aggregation;

import com.guno.orderpipeline.entity.FlatRow;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.guno.orderpipeline.support.TestOrders.row;
import static org.assertj.core.api.Assertions.*;

class RevenueAggregatorTest {

    private final RevenueAggregator aggregator = new RevenueAggregator();

    private final List<FlatRow> rows = List.of(
            row("O1", "C1", "S1", "10", "2018-03-01T10:15:00Z"),
            row("O1", "C1", "S2", "20", "2018-03-01T10:15:00Z"),
            row("O2", "C2", "S1", "30", "2018-03-20T23:59:59Z"),
            row("O3", "C1", "S1", "40", "2018-04-02T08:00:00Z"),
            row("O4", "C3", "S3", "5", null));

    @Test
    void shouldDivideRevenueByDistinctOrders() {
        GroupMetrics overall = aggregator.overall(rows);

        assertThat(overall.getRowCount()).isEqualTo(5);
        assertThat(overall.getDistinctOrders()).isEqualTo(4);
        assertThat(overall.getTotalPrice()).isEqualByComparingTo("105");
        assertThat(overall.getAvgOrderValue()).isEqualByComparingTo("26.25");
        assertThat(overall.getAvgItemPrice()).isEqualByComparingTo("21");
    }

    @Test
    void shouldGroupBySellerInFirstSeenOrder() {
        Map<String, GroupMetrics> bySeller = aggregator.bySeller(rows);

        assertThat(bySeller.keySet()).containsExactly("S1", "S2", "S3");
        assertThat(bySeller.get("S1").getTotalPrice()).isEqualByComparingTo("80");
        assertThat(bySeller.get("S1").getDistinctOrders()).isEqualTo(3);
    }

    @Test
    void shouldGroupByMonthAndSkipRowsWithoutTimestamp() {
        Map<Instant, GroupMetrics> byMonth = aggregator.byTime(rows, TimeBucket.MONTH);

        assertThat(byMonth.keySet()).containsExactly(
                Instant.parse("2018-03-01T00:00:00Z"), Instant.parse("2018-04-01T00:00:00Z"));
        assertThat(byMonth.get(Instant.parse("2018-03-01T00:00:00Z")).getTotalPrice()).isEqualByComparingTo("60");
        assertThat(byMonth.values().stream().mapToLong(GroupMetrics::getRowCount).sum()).isEqualTo(4);
    }

    @Test
    void shouldTruncateToHourAndDayInUtc() {
        Instant at = Instant.parse("2018-03-20T23:59:59Z");

        assertThat(TimeBucket.HOUR.truncate(at)).isEqualTo(Instant.parse("2018-03-20T23:00:00Z"));
        assertThat(TimeBucket.DAY.truncate(at)).isEqualTo(Instant.parse("2018-03-20T00:00:00Z"));
        assertThat(TimeBucket.MONTH.truncate(at)).isEqualTo(Instant.parse("2018-03-01T00:00:00Z"));
    }

    @Test
    void shouldGroupByCustomerSellerPairAndGeography() {
        Map<CustomerSellerKey, GroupMetrics> pairs = aggregator.byCustomerSeller(rows);
        Map<GeoKey, GroupMetrics> geo = aggregator.byCityState(rows);

        assertThat(pairs).hasSize(4);
        assertThat(pairs.get(CustomerSellerKey.of("C1", "S1")).getTotalPrice()).isEqualByComparingTo("50");
        assertThat(geo).containsOnlyKeys(GeoKey.of("sao paulo", "sp"));
    }

    @Test
    void shouldGroupCouponsAtOrderAndItemLevelSeparately() {
        List<FlatRow> couponRows = List.of(
                rows.get(0).toBuilder().orderCampaignCoupon("spring10").itemCampaignCoupon("item5").build(),
                rows.get(1).toBuilder().orderCampaignCoupon("spring10").build(),
                rows.get(2));

        assertThat(aggregator.byCoupon(couponRows).keySet()).containsExactly("spring10", "no_campaign");
        assertThat(aggregator.byCoupon(couponRows).get("spring10").getDistinctOrders()).isEqualTo(1);
        assertThat(aggregator.byItemCoupon(couponRows).keySet()).containsExactly("item5", "no_campaign");
        assertThat(aggregator.byItemCoupon(couponRows).get("no_campaign").getTotalPrice()).isEqualByComparingTo("50");
    }

    @Test
    void shouldRankTopGroupsByRevenue() {
        List<Map.Entry<String, GroupMetrics>> top = aggregator.topByRevenue(aggregator.byCustomer(rows), 2);

        assertThat(top).extracting(Map.Entry::getKey).containsExactly("C1", "C2");
    }

    @Test
    void shouldCombinePartialMetricsAssociatively() {
        GroupMetrics left = new GroupMetrics();
        rows.subList(0, 2).forEach(left::add);
        GroupMetrics right = new GroupMetrics();
        rows.subList(2, 5).forEach(right::add);

        GroupMetrics combined = left.combine(right);
        GroupMetrics whole = aggregator.overall(rows);

        assertThat(combined.getRowCount()).isEqualTo(whole.getRowCount());
        assertThat(combined.getDistinctOrders()).isEqualTo(whole.getDistinctOrders());
        assertThat(combined.getTotalPrice()).isEqualByComparingTo(whole.getTotalPrice());
    }
}
