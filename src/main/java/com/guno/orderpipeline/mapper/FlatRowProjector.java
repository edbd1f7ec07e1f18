package com.guno.orderpipeline.mapper;

import com.guno.orderpipeline.entity.CampaignInfo;
import com.guno.orderpipeline.entity.FlatRow;
import com.guno.orderpipeline.entity.LineItem;
import com.guno.orderpipeline.entity.Order;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * FlatRowProjector - expands one canonical order into one row per line item.
 *
 * Order and item level fields are threaded onto every row; the two campaign
 * levels stay in separate columns. The returned Iterable is lazy and can be
 * iterated any number of times with the same result.
 */
@Component
@Slf4j
public class FlatRowProjector {

    public Iterable<FlatRow> project(Order order) {
        Objects.requireNonNull(order, "order");
        List<LineItem> items = order.getOrderItems();
        return () -> new Iterator<>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return index < items.size();
            }

            @Override
            public FlatRow next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("Order " + order.getOrderId() + " has " + items.size() + " items");
                }
                FlatRow row = toRow(order, items.get(index), index + 1);
                index++;
                return row;
            }
        };
    }

    public Stream<FlatRow> stream(Order order) {
        return StreamSupport.stream(project(order).spliterator(), false);
    }

    /**
     * Projects a whole snapshot, keeping store order then item order
     */
    public List<FlatRow> projectAll(Collection<Order> orders) {
        List<FlatRow> rows = orders.stream().flatMap(this::stream).toList();
        log.info("Projected {} orders into {} flat rows", orders.size(), rows.size());
        return rows;
    }

    private FlatRow toRow(Order order, LineItem item, int position) {
        CampaignInfo itemCampaign = item.getCampaignDetails();
        CampaignInfo orderCampaign = order.getCampaignDetails();

        return FlatRow.builder()
                .orderId(order.getOrderId())
                .itemPosition(position)
                .customerId(order.getCustomer().getCustomerId())
                .customerCity(order.getCustomer().getCity())
                .customerState(order.getCustomer().getState())
                .orderStatus(order.getOrderStatus())
                .orderTimestamp(order.getOrderTimestamp())
                .productId(item.getProductId())
                .price(item.getPrice())
                .sellerId(item.getSellerId())
                .shippingLimitDate(item.getShippingLimitDate())
                .itemCampaignDiscount(itemCampaign.getDiscount())
                .itemCampaignChannel(itemCampaign.getChannel())
                .itemCampaignCoupon(itemCampaign.getCouponCode())
                .orderCampaignDiscount(orderCampaign.getDiscount())
                .orderCampaignChannel(orderCampaign.getChannel())
                .orderCampaignCoupon(orderCampaign.getCouponCode())
                .build();
    }
}
