package com.guno.orderpipeline.service;

import com.guno.orderpipeline.aggregation.ChurnStatus;
import com.guno.orderpipeline.aggregation.CustomerAggregate;
import com.guno.orderpipeline.aggregation.CustomerSegment;
import com.guno.orderpipeline.aggregation.CustomerValueAnalyzer;
import com.guno.orderpipeline.aggregation.RevenueAggregator;
import com.guno.orderpipeline.aggregation.TimeBucket;
import com.guno.orderpipeline.config.PipelineProperties;
import com.guno.orderpipeline.dto.internal.AnalyticsReport;
import com.guno.orderpipeline.entity.FlatRow;
import com.guno.orderpipeline.mapper.FlatRowColumns;
import com.guno.orderpipeline.repository.AggregateSpec;
import com.guno.orderpipeline.repository.AnalyticsStore;
import com.guno.orderpipeline.repository.GroupByQuery;
import com.guno.orderpipeline.repository.SortSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Revenue and customer-value reporting over the canonical store, plus
 * pushed-down group-by queries against the flat table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsService {

    private final OrderImportService importService;
    private final RevenueAggregator revenueAggregator;
    private final CustomerValueAnalyzer customerValueAnalyzer;
    private final AnalyticsStore analyticsStore;
    private final PipelineProperties properties;

    public AnalyticsReport buildReport() {
        return buildReport(importService.currentRows());
    }

    public AnalyticsReport buildReport(List<FlatRow> rows) {
        int limit = properties.getAnalytics().getTopLimit();
        List<CustomerAggregate> customers = customerValueAnalyzer.customers(rows);

        Map<CustomerSegment.Tier, Long> tiers = new EnumMap<>(CustomerSegment.Tier.class);
        customerValueAnalyzer.clvTerciles(customers)
                .forEach(segment -> tiers.merge(segment.getTier(), 1L, Long::sum));

        List<ChurnStatus> churn = customerValueAnalyzer.churn(customers, properties.getAnalytics().getChurnAfterDays());

        AnalyticsReport report = AnalyticsReport.builder()
                .overall(revenueAggregator.overall(rows))
                .topProducts(revenueAggregator.topByRevenue(revenueAggregator.byProduct(rows), limit))
                .topSellers(revenueAggregator.topByRevenue(revenueAggregator.bySeller(rows), limit))
                .revenueByCoupon(revenueAggregator.byCoupon(rows))
                .revenueByMonth(revenueAggregator.byTime(rows, TimeBucket.MONTH))
                .customersByTier(tiers)
                .rfmScores(customerValueAnalyzer.rfm(customers))
                .referenceInstant(customerValueAnalyzer.referenceInstant(customers))
                .churnRate(customerValueAnalyzer.churnRate(churn))
                .customerCount(customers.size())
                .build();

        log.info("📈 Report: {} customers, overall {}, churn rate {}",
                report.getCustomerCount(), report.getOverall(), String.format("%.2f%%", report.getChurnRate() * 100));
        return report;
    }

    /**
     * Sellers by revenue, computed by the analytics store itself
     */
    public List<Map<String, Object>> topSellersFromStore(int limit) {
        GroupByQuery query = GroupByQuery.builder()
                .table(properties.getProjection().getTable())
                .key(FlatRowColumns.SELLER_ID)
                .aggregate(AggregateSpec.of(AggregateSpec.Function.SUM, FlatRowColumns.PRICE, "revenue"))
                .aggregate(AggregateSpec.of(AggregateSpec.Function.COUNT_DISTINCT, FlatRowColumns.ORDER_ID, "orders"))
                .orderBy(SortSpec.desc("revenue"))
                .limit(limit)
                .build();
        return analyticsStore.queryGroupBy(query);
    }
}
