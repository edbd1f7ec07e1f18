package com.guno.orderpipeline.aggregation;

import com.guno.orderpipeline.entity.FlatRow;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collector;

/**
 * Per-group accumulator: row count, distinct orders, price sum.
 * Partial results combine associatively, so groups can be reduced in parallel.
 */
public class GroupMetrics {

    @Getter private long rowCount;
    @Getter private BigDecimal totalPrice = BigDecimal.ZERO;
    private final Set<String> orderIds = new HashSet<>();

    public static Collector<FlatRow, GroupMetrics, GroupMetrics> collector() {
        return Collector.of(GroupMetrics::new, GroupMetrics::add, GroupMetrics::combine);
    }

    public void add(FlatRow row) {
        rowCount++;
        totalPrice = totalPrice.add(row.getPrice());
        orderIds.add(row.getOrderId());
    }

    public GroupMetrics combine(GroupMetrics other) {
        rowCount += other.rowCount;
        totalPrice = totalPrice.add(other.totalPrice);
        orderIds.addAll(other.orderIds);
        return this;
    }

    public long getDistinctOrders() {
        return orderIds.size();
    }

    /**
     * sum(price) / count(distinct order_id); one order may contribute several rows
     */
    public BigDecimal getAvgOrderValue() {
        if (orderIds.isEmpty()) return BigDecimal.ZERO;
        return totalPrice.divide(BigDecimal.valueOf(orderIds.size()), MathContext.DECIMAL64);
    }

    public BigDecimal getAvgItemPrice() {
        if (rowCount == 0) return BigDecimal.ZERO;
        return totalPrice.divide(BigDecimal.valueOf(rowCount), MathContext.DECIMAL64);
    }

    @Override
    public String toString() {
        return String.format("GroupMetrics(rows=%d, orders=%d, total=%s, aov=%s)",
                rowCount, getDistinctOrders(), totalPrice.toPlainString(), getAvgOrderValue().toPlainString());
    }
}
