package com.guno.orderpipeline.mapper;

import com.guno.orderpipeline.entity.FlatRow;
import com.guno.orderpipeline.repository.ColumnType;
import com.guno.orderpipeline.repository.TableSchema;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column layout of the flattened order-item table and FlatRow conversion both ways
 */
@UtilityClass
public class FlatRowColumns {

    public static final String ORDER_ID = "order_id";
    public static final String ITEM_POSITION = "item_position";
    public static final String CUSTOMER_ID = "customer_id";
    public static final String CUSTOMER_CITY = "customer_city";
    public static final String CUSTOMER_STATE = "customer_state";
    public static final String ORDER_STATUS = "order_status";
    public static final String ORDER_TIMESTAMP = "order_timestamp";
    public static final String PRODUCT_ID = "product_id";
    public static final String PRICE = "price";
    public static final String SELLER_ID = "seller_id";
    public static final String SHIPPING_LIMIT_DATE = "shipping_limit_date";
    public static final String ITEM_CAMPAIGN_DISCOUNT = "item_campaign_discount";
    public static final String ITEM_CAMPAIGN_CHANNEL = "item_campaign_channel";
    public static final String ITEM_CAMPAIGN_COUPON = "item_campaign_coupon";
    public static final String ORDER_CAMPAIGN_DISCOUNT = "order_campaign_discount";
    public static final String ORDER_CAMPAIGN_CHANNEL = "order_campaign_channel";
    public static final String ORDER_CAMPAIGN_COUPON = "order_campaign_coupon";
    public static final String CAMPAIGN_FLAG = "campaign_flag";

    public static final TableSchema SCHEMA = TableSchema.builder()
            .column(ORDER_ID, ColumnType.TEXT)
            .column(ITEM_POSITION, ColumnType.INTEGER)
            .column(CUSTOMER_ID, ColumnType.TEXT)
            .column(CUSTOMER_CITY, ColumnType.TEXT)
            .column(CUSTOMER_STATE, ColumnType.TEXT)
            .column(ORDER_STATUS, ColumnType.TEXT)
            .column(ORDER_TIMESTAMP, ColumnType.TIMESTAMP)
            .column(PRODUCT_ID, ColumnType.TEXT)
            .column(PRICE, ColumnType.DECIMAL)
            .column(SELLER_ID, ColumnType.TEXT)
            .column(SHIPPING_LIMIT_DATE, ColumnType.TIMESTAMP)
            .column(ITEM_CAMPAIGN_DISCOUNT, ColumnType.DECIMAL)
            .column(ITEM_CAMPAIGN_CHANNEL, ColumnType.TEXT)
            .column(ITEM_CAMPAIGN_COUPON, ColumnType.TEXT)
            .column(ORDER_CAMPAIGN_DISCOUNT, ColumnType.DECIMAL)
            .column(ORDER_CAMPAIGN_CHANNEL, ColumnType.TEXT)
            .column(ORDER_CAMPAIGN_COUPON, ColumnType.TEXT)
            .build();

    /**
     * Column values in SCHEMA order; campaign_flag is added only when the row carries one
     */
    public Map<String, Object> toColumns(FlatRow row) {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put(ORDER_ID, row.getOrderId());
        columns.put(ITEM_POSITION, (long) row.getItemPosition());
        columns.put(CUSTOMER_ID, row.getCustomerId());
        columns.put(CUSTOMER_CITY, row.getCustomerCity());
        columns.put(CUSTOMER_STATE, row.getCustomerState());
        columns.put(ORDER_STATUS, row.getOrderStatus());
        columns.put(ORDER_TIMESTAMP, row.getOrderTimestamp());
        columns.put(PRODUCT_ID, row.getProductId());
        columns.put(PRICE, row.getPrice());
        columns.put(SELLER_ID, row.getSellerId());
        columns.put(SHIPPING_LIMIT_DATE, row.getShippingLimitDate());
        columns.put(ITEM_CAMPAIGN_DISCOUNT, row.getItemCampaignDiscount());
        columns.put(ITEM_CAMPAIGN_CHANNEL, row.getItemCampaignChannel());
        columns.put(ITEM_CAMPAIGN_COUPON, row.getItemCampaignCoupon());
        columns.put(ORDER_CAMPAIGN_DISCOUNT, row.getOrderCampaignDiscount());
        columns.put(ORDER_CAMPAIGN_CHANNEL, row.getOrderCampaignChannel());
        columns.put(ORDER_CAMPAIGN_COUPON, row.getOrderCampaignCoupon());
        if (row.getCampaignFlag() != null) {
            columns.put(CAMPAIGN_FLAG, row.getCampaignFlag());
        }
        return columns;
    }

    public List<Map<String, Object>> toColumnRows(List<FlatRow> rows) {
        return rows.stream().map(FlatRowColumns::toColumns).toList();
    }

    public FlatRow fromColumns(Map<String, Object> columns) {
        return FlatRow.builder()
                .orderId((String) columns.get(ORDER_ID))
                .itemPosition(((Number) columns.get(ITEM_POSITION)).intValue())
                .customerId((String) columns.get(CUSTOMER_ID))
                .customerCity((String) columns.get(CUSTOMER_CITY))
                .customerState((String) columns.get(CUSTOMER_STATE))
                .orderStatus((String) columns.get(ORDER_STATUS))
                .orderTimestamp((Instant) columns.get(ORDER_TIMESTAMP))
                .productId((String) columns.get(PRODUCT_ID))
                .price((BigDecimal) columns.get(PRICE))
                .sellerId((String) columns.get(SELLER_ID))
                .shippingLimitDate((Instant) columns.get(SHIPPING_LIMIT_DATE))
                .itemCampaignDiscount((BigDecimal) columns.get(ITEM_CAMPAIGN_DISCOUNT))
                .itemCampaignChannel((String) columns.get(ITEM_CAMPAIGN_CHANNEL))
                .itemCampaignCoupon((String) columns.get(ITEM_CAMPAIGN_COUPON))
                .orderCampaignDiscount((BigDecimal) columns.get(ORDER_CAMPAIGN_DISCOUNT))
                .orderCampaignChannel((String) columns.get(ORDER_CAMPAIGN_CHANNEL))
                .orderCampaignCoupon((String) columns.get(ORDER_CAMPAIGN_COUPON))
                .campaignFlag((String) columns.get(CAMPAIGN_FLAG))
                .build();
    }
}
