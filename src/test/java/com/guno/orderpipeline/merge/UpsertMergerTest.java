package com.guno.orderpipeline.merge;

import com.guno.orderpipeline.dto.internal.MergeResult;
import com.guno.orderpipeline.entity.Order;
import com.guno.orderpipeline.repository.InMemoryOrderStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.guno.orderpipeline.support.TestOrders.order;
import static org.assertj.core.api.Assertions.*;

class UpsertMergerTest {

    private final UpsertMerger merger = new UpsertMerger();
    private final InMemoryOrderStore store = new InMemoryOrderStore();

    @Test
    void shouldInsertThenReplace() {
        Order first = order("O1", "C1", "10");
        Order second = order("O1", "C1", "99");

        MergeResult inserted = merger.merge(first, store);
        MergeResult replaced = merger.merge(second, store);

        assertThat(inserted.getAction()).isEqualTo(MergeResult.MergeAction.INSERTED);
        assertThat(inserted.getPrevious()).isNull();
        assertThat(replaced.getAction()).isEqualTo(MergeResult.MergeAction.REPLACED);
        assertThat(replaced.getPrevious()).isEqualTo(first);
        assertThat(store.findById("O1")).contains(second);
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void shouldReplaceWholesaleAndTruncateItems() {
        merger.merge(order("O2", "C2", "10", "20", "30").toBuilder().orderStatus("shipped").build(), store);
        Order shorter = order("O2", "C2", "15").toBuilder().orderStatus("delivered").build();

        merger.merge(shorter, store);

        Order stored = store.findById("O2").orElseThrow();
        assertThat(stored.getOrderItems()).hasSize(1);
        assertThat(stored.getOrderItems().get(0).getPrice()).isEqualByComparingTo("15");
        assertThat(stored.getOrderStatus()).isEqualTo("delivered");
    }

    @Test
    void shouldBeIdempotent() {
        Order order = order("O1", "C1", "10", "20");

        merger.merge(order, store);
        List<Order> once = store.findAll();
        merger.merge(order, store);

        assertThat(store.findAll()).isEqualTo(once);
    }

    @Test
    void shouldLetLaterRecordWinInInputOrder() {
        List<MergeResult> results = merger.mergeAll(List.of(
                order("O1", "C1", "1"),
                order("O2", "C2", "2"),
                order("O1", "C1", "3")), store);

        assertThat(results).extracting(MergeResult::getAction).containsExactly(
                MergeResult.MergeAction.INSERTED, MergeResult.MergeAction.INSERTED, MergeResult.MergeAction.REPLACED);
        assertThat(store.findById("O1").orElseThrow().getOrderItems().get(0).getPrice()).isEqualByComparingTo("3");
        assertThat(store.findAll()).extracting(Order::getOrderId).containsExactly("O1", "O2");
    }

    @Test
    void shouldInsertExactlyOnceUnderConcurrentMergesOfSameKey() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Callable<MergeResult>> tasks = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            Order order = order("O1", "C1", String.valueOf(i));
            tasks.add(() -> merger.merge(order, store));
        }

        List<MergeResult> results = new ArrayList<>();
        try {
            for (Future<MergeResult> future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }

        assertThat(results).filteredOn(MergeResult::isInserted).hasSize(1);
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void shouldRejectInvalidStripeCount() {
        assertThatThrownBy(() -> new UpsertMerger(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
