package com.guno.orderpipeline.mapper;

import com.guno.orderpipeline.entity.CampaignInfo;
import com.guno.orderpipeline.entity.FlatRow;
import com.guno.orderpipeline.entity.LineItem;
import com.guno.orderpipeline.entity.Order;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static com.guno.orderpipeline.support.TestOrders.campaign;
import static com.guno.orderpipeline.support.TestOrders.order;
import static org.assertj.core.api.Assertions.*;

class FlatRowProjectorTest {

    private final FlatRowProjector projector = new FlatRowProjector();

    @Test
    void shouldEmitOneRowPerItemInOrder() {
        Order order = order("O1", "C1", "10", "20", "30");

        List<FlatRow> rows = projector.stream(order).toList();

        assertThat(rows).hasSize(3);
        assertThat(rows).extracting(FlatRow::getItemPosition).containsExactly(1, 2, 3);
        assertThat(rows).extracting(FlatRow::getProductId).containsExactly("P1", "P2", "P3");
        assertThat(rows).allSatisfy(row -> {
            assertThat(row.getOrderId()).isEqualTo("O1");
            assertThat(row.getCustomerId()).isEqualTo("C1");
            assertThat(row.getCustomerCity()).isEqualTo("sao paulo");
            assertThat(row.getOrderStatus()).isEqualTo("delivered");
            assertThat(row.getCampaignFlag()).isNull();
        });
    }

    @Test
    void shouldKeepBothCampaignLevelsSideBySide() {
        Order order = order("O1", "C1", "10", "20").toBuilder()
                .campaignDetails(campaign("spring10", "5"))
                .clearOrderItems()
                .orderItem(LineItem.builder().productId("P1").campaignDetails(campaign("item5", "1.5")).build())
                .orderItem(LineItem.builder().productId("P2").build())
                .build();

        List<FlatRow> rows = projector.stream(order).toList();

        assertThat(rows.get(0).getItemCampaignCoupon()).isEqualTo("item5");
        assertThat(rows.get(0).getItemCampaignDiscount()).isEqualByComparingTo("1.5");
        assertThat(rows.get(0).getOrderCampaignCoupon()).isEqualTo("spring10");
        assertThat(rows.get(1).getItemCampaignCoupon()).isEqualTo(CampaignInfo.NO_CAMPAIGN);
        assertThat(rows.get(1).getOrderCampaignCoupon()).isEqualTo("spring10");
        assertThat(rows.get(1).getOrderCampaignDiscount()).isEqualByComparingTo("5");
    }

    @Test
    void shouldRestartOnEveryIteration() {
        Iterable<FlatRow> rows = projector.project(order("O1", "C1", "10", "20"));

        List<FlatRow> first = new ArrayList<>();
        rows.forEach(first::add);
        List<FlatRow> second = new ArrayList<>();
        rows.forEach(second::add);

        assertThat(first).hasSize(2).isEqualTo(second);
    }

    @Test
    void shouldFailPastLastRow() {
        Iterator<FlatRow> iterator = projector.project(order("O1", "C1", "10")).iterator();
        iterator.next();

        assertThat(iterator.hasNext()).isFalse();
        assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void shouldProjectNothingForOrderWithoutItems() {
        assertThat(projector.project(order("O1", "C1"))).isEmpty();
    }

    @Test
    void shouldProjectWholeSnapshotInStoreOrder() {
        List<FlatRow> rows = projector.projectAll(List.of(
                order("O2", "C2", "5"),
                order("O1", "C1", "10", "20")));

        assertThat(rows).extracting(FlatRow::getOrderId).containsExactly("O2", "O1", "O1");
    }

    @Test
    void shouldConvertRowToColumnsAndBack() {
        FlatRow row = projector.stream(order("O1", "C1", "10")).findFirst().orElseThrow();

        var columns = FlatRowColumns.toColumns(row);

        assertThat(columns.keySet()).containsExactlyElementsOf(FlatRowColumns.SCHEMA.getColumnNames());
        assertThat(columns.get(FlatRowColumns.ITEM_POSITION)).isEqualTo(1L);
        assertThat(FlatRowColumns.fromColumns(columns)).isEqualTo(row);
    }
}
