package com.guno.orderpipeline.processor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.orderpipeline.checkpoint.InMemoryCheckpointStore;
import com.guno.orderpipeline.config.PipelineProperties;
import com.guno.orderpipeline.dto.internal.ImportSummary;
import com.guno.orderpipeline.dto.internal.RejectionReason;
import com.guno.orderpipeline.dto.raw.RawOrderRecord;
import com.guno.orderpipeline.entity.Order;
import com.guno.orderpipeline.exception.BatchAbortedException;
import com.guno.orderpipeline.exception.StoreUnavailableException;
import com.guno.orderpipeline.merge.UpsertMerger;
import com.guno.orderpipeline.normalizer.OrderNormalizer;
import com.guno.orderpipeline.reader.NdjsonOrderReader;
import com.guno.orderpipeline.repository.InMemoryOrderStore;
import com.guno.orderpipeline.util.BackoffRetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class OrderBatchProcessorTest {

    private static final String INPUT = String.join("\n",
            "{\"order_id\":\"O1\",\"customer\":{\"customer_id\":\"C1\"},\"order_items\":[{\"price\":10},{\"price\":20}]}",
            "{\"order_id\":\"O2\",\"customer\":{\"customer_id\":\"C2\"},\"order_items\":[{\"price\":5}]}",
            "{\"order_id\":\"\",\"customer\":{\"customer_id\":\"C3\"},\"order_items\":[{\"price\":1}]}",
            "{\"order_id\":\"O4\",\"customer\":{\"customer_id\":\"C4\"},\"order_items\":[]}",
            "{\"order_id\":\"O5\",\"customer\":{\"customer_id\":\"C5\"},\"order_items\":[{\"price\":\"abc\"}]}",
            "not json at all",
            "{\"order_id\":\"O1\",\"customer\":{\"customer_id\":\"C1\"},\"order_items\":[{\"price\":99}]}");

    private final NdjsonOrderReader reader = new NdjsonOrderReader(new ObjectMapper());

    private FlakyOrderStore orderStore;
    private InMemoryCheckpointStore checkpointStore;
    private OrderBatchProcessor processor;

    @BeforeEach
    void setUp() {
        orderStore = new FlakyOrderStore();
        checkpointStore = new InMemoryCheckpointStore();
        PipelineProperties properties = new PipelineProperties();
        properties.getBatch().setWorkerThreads(3);
        processor = new OrderBatchProcessor(new OrderNormalizer(), new ValidationProcessor(), new UpsertMerger(),
                orderStore, checkpointStore, new BackoffRetry(3, 0), properties);
    }

    @Test
    void shouldIsolateRejectionsAndCountThemByReason() {
        ImportSummary summary = processor.process(records(), "run-1");

        assertThat(summary.getInputRecords()).isEqualTo(7);
        assertThat(summary.getNormalized()).isEqualTo(3);
        assertThat(summary.getRejected()).isEqualTo(4);
        assertThat(summary.getRejected(RejectionReason.MISSING_IDENTITY)).isEqualTo(1);
        assertThat(summary.getRejected(RejectionReason.EMPTY_LINE_ITEMS)).isEqualTo(1);
        assertThat(summary.getRejected(RejectionReason.TYPE_COERCION)).isEqualTo(1);
        assertThat(summary.getRejected(RejectionReason.MALFORMED_RECORD)).isEqualTo(1);
        assertThat(summary.getMergedInserted()).isEqualTo(2);
        assertThat(summary.getMergedUpdated()).isEqualTo(1);
        assertThat(summary.getCommitted()).isEqualTo(7);
        assertThat(summary.getErrors()).extracting(e -> e.getPosition()).containsExactly(3L, 4L, 5L, 6L);
    }

    @Test
    void shouldKeepLastDeliveryOfDuplicateOrder() {
        processor.process(records(), "run-1");

        Order o1 = orderStore.findById("O1").orElseThrow();
        assertThat(o1.getOrderItems()).hasSize(1);
        assertThat(o1.getOrderItems().get(0).getPrice()).isEqualByComparingTo("99");
        assertThat(orderStore.findAll()).extracting(Order::getOrderId).containsExactly("O1", "O2");
    }

    @Test
    void shouldRetryTransientStoreFailures() {
        orderStore.failNextPuts(2);

        ImportSummary summary = processor.process(records(), "run-1");

        assertThat(summary.getMergedInserted()).isEqualTo(2);
        assertThat(orderStore.count()).isEqualTo(2);
    }

    @Test
    void shouldAbortWithCommittedCountWhenStoreStaysDown() {
        orderStore.failPutsFor("O2");

        assertThatThrownBy(() -> processor.process(records(), "run-1"))
                .isInstanceOf(BatchAbortedException.class)
                .satisfies(e -> assertThat(((BatchAbortedException) e).getCommittedRecords()).isEqualTo(1));
        assertThat(checkpointStore.load("run-1")).isEqualTo(1);

        orderStore.recover();
        ImportSummary resumed = processor.process(records(), "run-1");

        assertThat(resumed.getSkippedByResume()).isEqualTo(1);
        assertThat(resumed.getCommitted()).isEqualTo(7);
        assertThat(orderStore.count()).isEqualTo(2);
        assertThat(checkpointStore.load("run-1")).isZero();
    }

    @Test
    void shouldStopOnCancellationAndResumeFromCheckpoint() {
        BatchCancellation cancellation = new BatchCancellation();
        orderStore.onPut(count -> {
            if (count == 2) cancellation.cancel();
        });

        ImportSummary cancelled = processor.process(records(), "run-1", cancellation);

        assertThat(cancelled.getStatus()).isEqualTo(ImportSummary.STATUS_CANCELLED);
        assertThat(cancelled.getCommitted()).isEqualTo(2);
        assertThat(checkpointStore.load("run-1")).isEqualTo(2);

        orderStore.onPut(count -> { });
        ImportSummary resumed = processor.process(records(), "run-1");

        assertThat(resumed.getSkippedByResume()).isEqualTo(2);
        assertThat(resumed.getNormalized()).isEqualTo(1);
        assertThat(resumed.getRejected()).isEqualTo(4);
        assertThat(orderStore.findById("O1").orElseThrow().getOrderItems()).hasSize(1);
    }

    @Test
    void shouldRejectOutOfRangeNumberWithoutAbortingBatch() throws Exception {
        // a plain mapper reads 1e400 as an infinite double
        ObjectMapper plainMapper = new ObjectMapper();
        List<RawOrderRecord> input = List.of(
                rawRecord(1, plainMapper.readTree(
                        "{\"order_id\":\"O1\",\"customer\":{\"customer_id\":\"C1\"},\"order_items\":[{\"price\":10}]}")),
                rawRecord(2, plainMapper.readTree(
                        "{\"order_id\":\"O2\",\"customer\":{\"customer_id\":\"C2\"},\"order_items\":[{\"price\":1e400}]}")));

        ImportSummary summary = processor.process(input, "run-range");

        assertThat(summary.getNormalized()).isEqualTo(1);
        assertThat(summary.getRejected(RejectionReason.TYPE_COERCION)).isEqualTo(1);
        assertThat(summary.getErrors()).singleElement().satisfies(error -> {
            assertThat(error.getPosition()).isEqualTo(2L);
            assertThat(error.getErrorMessage()).contains("order_items[0].price");
        });
        assertThat(summary.getCommitted()).isEqualTo(2);
        assertThat(orderStore.findAll()).extracting(Order::getOrderId).containsExactly("O1");
    }

    @Test
    void shouldRejectRecordWhenNormalizerFailsUnexpectedly() {
        OrderNormalizer failing = new OrderNormalizer() {
            @Override
            public Order normalize(JsonNode raw) {
                if ("O2".equals(raw.path("order_id").asText())) {
                    throw new IllegalStateException("boom");
                }
                return super.normalize(raw);
            }
        };
        PipelineProperties properties = new PipelineProperties();
        properties.getBatch().setWorkerThreads(2);
        OrderBatchProcessor guarded = new OrderBatchProcessor(failing, new ValidationProcessor(), new UpsertMerger(),
                orderStore, checkpointStore, new BackoffRetry(3, 0), properties);

        ImportSummary summary = guarded.process(records(), "run-guarded");

        assertThat(summary.getRejected(RejectionReason.MALFORMED_RECORD)).isEqualTo(2);
        assertThat(summary.getErrors()).extracting(e -> e.getPosition()).contains(2L);
        assertThat(orderStore.findAll()).extracting(Order::getOrderId).containsExactly("O1");
        assertThat(summary.getCommitted()).isEqualTo(7);
    }

    @Test
    void shouldHandleEmptyInput() {
        ImportSummary summary = processor.process(List.of(), "empty");

        assertThat(summary.getInputRecords()).isZero();
        assertThat(summary.getCommitted()).isZero();
        assertThat(orderStore.count()).isZero();
    }

    private RawOrderRecord rawRecord(long position, JsonNode payload) {
        return RawOrderRecord.builder().position(position).source("inline").payload(payload).build();
    }

    private List<RawOrderRecord> records() {
        return reader.read(new StringReader(INPUT), "test.ndjson");
    }

    /**
     * Order store whose writes can be made to fail
     */
    static class FlakyOrderStore extends InMemoryOrderStore {
        private final AtomicInteger failuresLeft = new AtomicInteger();
        private final AtomicInteger puts = new AtomicInteger();
        private volatile String failingKey;
        private volatile java.util.function.IntConsumer listener = count -> { };

        void failNextPuts(int count) {
            failuresLeft.set(count);
        }

        void failPutsFor(String key) {
            failingKey = key;
        }

        void recover() {
            failingKey = null;
            failuresLeft.set(0);
        }

        void onPut(java.util.function.IntConsumer listener) {
            this.listener = listener;
        }

        @Override
        public void put(String key, Order value) {
            if (key.equals(failingKey) || failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new StoreUnavailableException("store offline");
            }
            super.put(key, value);
            listener.accept(puts.incrementAndGet());
        }
    }
}
