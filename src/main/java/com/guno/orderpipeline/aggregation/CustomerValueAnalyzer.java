package com.guno.orderpipeline.aggregation;

import com.guno.orderpipeline.entity.FlatRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * CustomerValueAnalyzer - customer-level rollup, CLV terciles, RFM quintiles and churn.
 *
 * Binning always runs over one row per customer, in first-seen order, never
 * over the item-level rows. Recency is measured against the latest order in
 * the data set rather than the wall clock so reruns give the same scores.
 */
@Component
@Slf4j
public class CustomerValueAnalyzer {

    private static final int CLV_BINS = 3;
    private static final int RFM_BINS = 5;

    public List<CustomerAggregate> customers(List<FlatRow> rows) {
        Map<String, Accumulator> byCustomer = new LinkedHashMap<>();
        for (FlatRow row : rows) {
            byCustomer.computeIfAbsent(row.getCustomerId(), id -> new Accumulator(row)).add(row);
        }

        List<CustomerAggregate> result = new ArrayList<>(byCustomer.size());
        byCustomer.forEach((customerId, acc) -> result.add(acc.toAggregate(customerId)));
        log.debug("Rolled {} rows up to {} customers", rows.size(), result.size());
        return result;
    }

    /**
     * Lowest third by total spend is LOW, highest third HIGH
     */
    public List<CustomerSegment> clvTerciles(List<CustomerAggregate> customers) {
        List<Integer> bins = QuantileBinner.assign(customers,
                Comparator.comparing(CustomerAggregate::getTotalSpend), CLV_BINS);

        CustomerSegment.Tier[] tiers = CustomerSegment.Tier.values();
        List<CustomerSegment> result = new ArrayList<>(customers.size());
        for (int i = 0; i < customers.size(); i++) {
            CustomerAggregate customer = customers.get(i);
            result.add(new CustomerSegment(customer.getCustomerId(), customer.getTotalSpend(), tiers[bins.get(i)]));
        }
        return result;
    }

    public List<RfmScore> rfm(List<CustomerAggregate> customers) {
        return rfm(customers, referenceInstant(customers));
    }

    public List<RfmScore> rfm(List<CustomerAggregate> customers, Instant reference) {
        // customers without any timestamp rank as least recent
        List<Integer> recency = QuantileBinner.assign(customers,
                Comparator.comparing(CustomerAggregate::getLastOrderAt, Comparator.nullsFirst(Comparator.naturalOrder())),
                RFM_BINS);
        List<Integer> frequency = QuantileBinner.assign(customers,
                Comparator.comparingLong(CustomerAggregate::getOrderCount), RFM_BINS);
        List<Integer> monetary = QuantileBinner.assign(customers,
                Comparator.comparing(CustomerAggregate::getTotalSpend), RFM_BINS);

        List<RfmScore> result = new ArrayList<>(customers.size());
        for (int i = 0; i < customers.size(); i++) {
            CustomerAggregate customer = customers.get(i);
            result.add(new RfmScore(
                    customer.getCustomerId(),
                    recencyDays(customer, reference),
                    customer.getOrderCount(),
                    customer.getTotalSpend(),
                    recency.get(i) + 1,
                    frequency.get(i) + 1,
                    monetary.get(i) + 1));
        }
        return result;
    }

    public List<ChurnStatus> churn(List<CustomerAggregate> customers, long churnAfterDays) {
        Instant reference = referenceInstant(customers);
        return customers.stream()
                .map(c -> {
                    Long days = recencyDays(c, reference);
                    return new ChurnStatus(c.getCustomerId(), days, days != null && days > churnAfterDays);
                })
                .toList();
    }

    public double churnRate(List<ChurnStatus> statuses) {
        if (statuses.isEmpty()) return 0.0;
        long churned = statuses.stream().filter(ChurnStatus::isChurned).count();
        return (double) churned / statuses.size();
    }

    /**
     * Latest order time across all customers, null when no order carries a timestamp
     */
    public Instant referenceInstant(List<CustomerAggregate> customers) {
        return customers.stream()
                .map(CustomerAggregate::getLastOrderAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
    }

    private Long recencyDays(CustomerAggregate customer, Instant reference) {
        if (customer.getLastOrderAt() == null || reference == null) {
            return null;
        }
        return Duration.between(customer.getLastOrderAt(), reference).toDays();
    }

    private static class Accumulator {
        private final String city;
        private final String state;
        private final Set<String> orderIds = new HashSet<>();
        private long itemCount;
        private BigDecimal totalSpend = BigDecimal.ZERO;
        private Instant firstOrderAt;
        private Instant lastOrderAt;

        Accumulator(FlatRow first) {
            this.city = first.getCustomerCity();
            this.state = first.getCustomerState();
        }

        void add(FlatRow row) {
            orderIds.add(row.getOrderId());
            itemCount++;
            totalSpend = totalSpend.add(row.getPrice());
            Instant at = row.getOrderTimestamp();
            if (at != null) {
                if (firstOrderAt == null || at.isBefore(firstOrderAt)) firstOrderAt = at;
                if (lastOrderAt == null || at.isAfter(lastOrderAt)) lastOrderAt = at;
            }
        }

        CustomerAggregate toAggregate(String customerId) {
            return CustomerAggregate.builder()
                    .customerId(customerId)
                    .city(city)
                    .state(state)
                    .orderCount(orderIds.size())
                    .itemCount(itemCount)
                    .totalSpend(totalSpend)
                    .firstOrderAt(firstOrderAt)
                    .lastOrderAt(lastOrderAt)
                    .build();
        }
    }
}
