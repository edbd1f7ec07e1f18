package com.guno.orderpipeline.normalizer;

import com.fasterxml.jackson.databind.JsonNode;
import com.guno.orderpipeline.entity.CampaignInfo;
import com.guno.orderpipeline.entity.Customer;
import com.guno.orderpipeline.entity.LineItem;
import com.guno.orderpipeline.entity.Order;
import com.guno.orderpipeline.exception.TypeCoercionException;
import com.guno.orderpipeline.util.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * OrderNormalizer - turns a loosely typed raw order into the canonical model.
 *
 * Absent structs become fully defaulted structs, absent scalars take their
 * sentinel, grouping text is trimmed and lower-cased. Pure: the same input
 * always yields the same Order.
 */
@Component
@Slf4j
public class OrderNormalizer {

    public Order normalize(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new TypeCoercionException("$", String.valueOf(raw), "order record must be an object");
        }

        return Order.builder()
                .orderId(identity(raw.get("order_id"), "order_id"))
                .customer(normalizeCustomer(raw.get("customer")))
                .orderStatus(textOrDefault(raw.get("order_status"), "order_status", "unknown"))
                .orderTimestamp(TimestampParser.parse(raw.get("order_timestamp")))
                .orderItems(normalizeItems(raw.get("order_items")))
                .campaignDetails(normalizeCampaign(raw.get("campaign_details"), "campaign_details"))
                .build();
    }

    // ================================
    // STRUCTS
    // ================================

    private Customer normalizeCustomer(JsonNode node) {
        if (isAbsent(node)) {
            return Customer.builder().build();
        }
        requireObject(node, "customer");

        return Customer.builder()
                .customerId(identity(node.get("customer_id"), "customer.customer_id"))
                .city(geography(node.get("city"), "customer.city"))
                .state(geography(node.get("state"), "customer.state"))
                .build();
    }

    private List<LineItem> normalizeItems(JsonNode node) {
        if (isAbsent(node)) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new TypeCoercionException("order_items", node.toString(), "expected an array");
        }

        List<LineItem> items = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            items.add(normalizeItem(node.get(i), "order_items[" + i + "]"));
        }
        return items;
    }

    private LineItem normalizeItem(JsonNode node, String path) {
        if (isAbsent(node)) {
            return LineItem.builder().build();
        }
        requireObject(node, path);

        return LineItem.builder()
                .productId(textOrDefault(node.get("product_id"), path + ".product_id", "unknown"))
                .price(decimal(node.get("price"), path + ".price"))
                .shippingLimitDate(TimestampParser.parse(node.get("shipping_limit_date")))
                .sellerId(textOrDefault(node.get("seller_id"), path + ".seller_id", "unknown"))
                .campaignDetails(normalizeCampaign(node.get("campaign_details"), path + ".campaign_details"))
                .build();
    }

    private CampaignInfo normalizeCampaign(JsonNode node, String path) {
        if (isAbsent(node)) {
            return CampaignInfo.none();
        }
        requireObject(node, path);

        return CampaignInfo.builder()
                .discount(decimal(node.get("discount"), path + ".discount"))
                .channel(campaignText(node.get("channel"), path + ".channel"))
                .couponCode(campaignText(node.get("coupon_code"), path + ".coupon_code"))
                .build();
    }

    // ================================
    // SCALARS
    // ================================

    private String identity(JsonNode node, String path) {
        String value = text(node, path);
        return value == null ? "" : value.trim();
    }

    private String textOrDefault(JsonNode node, String path, String defaultValue) {
        String value = text(node, path);
        return isBlank(value) ? defaultValue : value.trim();
    }

    private String geography(JsonNode node, String path) {
        String value = text(node, path);
        return isBlank(value) ? Customer.UNKNOWN : value.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * NO_CAMPAIGN, no_campaign, blank and null all collapse to the single lower-case sentinel
     */
    private String campaignText(JsonNode node, String path) {
        String value = text(node, path);
        return isBlank(value) ? CampaignInfo.NO_CAMPAIGN : value.trim().toLowerCase(Locale.ROOT);
    }

    private String text(JsonNode node, String path) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isContainerNode()) {
            throw new TypeCoercionException(path, node.toString(), "expected a text value");
        }
        return node.asText();
    }

    private BigDecimal decimal(JsonNode node, String path) {
        if (isAbsent(node)) {
            return BigDecimal.ZERO;
        }

        BigDecimal value;
        if (node.isNumber()) {
            // doubles outside the finite range have no decimal form
            try {
                value = node.decimalValue();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new TypeCoercionException(path, node.toString(), "not a finite decimal number");
            }
        } else if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return BigDecimal.ZERO;
            }
            try {
                value = new BigDecimal(text);
            } catch (NumberFormatException | ArithmeticException e) {
                throw new TypeCoercionException(path, node.asText(), "not a decimal number");
            }
        } else {
            throw new TypeCoercionException(path, node.toString(), "not a decimal number");
        }

        if (value.signum() < 0) {
            throw new TypeCoercionException(path, value.toPlainString(), "must be non-negative");
        }
        return value;
    }

    // ================================
    // HELPERS
    // ================================

    private void requireObject(JsonNode node, String path) {
        if (!node.isObject()) {
            throw new TypeCoercionException(path, node.toString(), "expected an object");
        }
    }

    private boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
