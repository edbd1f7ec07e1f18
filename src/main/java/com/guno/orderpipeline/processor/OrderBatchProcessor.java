package com.guno.orderpipeline.processor;

import com.guno.orderpipeline.checkpoint.CheckpointStore;
import com.guno.orderpipeline.config.PipelineProperties;
import com.guno.orderpipeline.dto.internal.ErrorReport;
import com.guno.orderpipeline.dto.internal.ImportSummary;
import com.guno.orderpipeline.dto.internal.MergeResult;
import com.guno.orderpipeline.dto.internal.RejectionReason;
import com.guno.orderpipeline.dto.internal.ValidationResult;
import com.guno.orderpipeline.dto.raw.RawOrderRecord;
import com.guno.orderpipeline.entity.Order;
import com.guno.orderpipeline.exception.BatchAbortedException;
import com.guno.orderpipeline.exception.StoreUnavailableException;
import com.guno.orderpipeline.exception.TypeCoercionException;
import com.guno.orderpipeline.merge.UpsertMerger;
import com.guno.orderpipeline.normalizer.OrderNormalizer;
import com.guno.orderpipeline.repository.KeyedStore;
import com.guno.orderpipeline.util.BackoffRetry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * OrderBatchProcessor - normalize, validate and merge one batch of raw orders.
 *
 * FLOW:
 * 1. Skip records already committed by a previous run with the same key
 * 2. Normalize + validate on the worker pool, reassembled in input order
 * 3. Merge accepted orders in input order, checkpoint after every record
 *
 * Per-record failures become rejections in the summary. A store that stays
 * unavailable after the retry budget aborts the batch with the committed count.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderBatchProcessor {

    private final OrderNormalizer normalizer;
    private final ValidationProcessor validationProcessor;
    private final UpsertMerger merger;
    private final KeyedStore<Order> orderStore;
    private final CheckpointStore checkpointStore;
    private final BackoffRetry storeRetry;
    private final PipelineProperties properties;

    public ImportSummary process(List<RawOrderRecord> records, String runKey) {
        return process(records, runKey, BatchCancellation.none());
    }

    public ImportSummary process(List<RawOrderRecord> records, String runKey, BatchCancellation cancellation) {
        ImportSummary summary = ImportSummary.builder().build();
        process(records, runKey, cancellation, summary);
        return summary;
    }

    /**
     * Fills the given summary as it goes, so a caller catching
     * {@link BatchAbortedException} still sees the counts up to the failure.
     */
    public void process(List<RawOrderRecord> records, String runKey,
                        BatchCancellation cancellation, ImportSummary summary) {
        summary.setInputRecords(records.size());

        long resumeFrom = Math.min(checkpointStore.load(runKey), records.size());
        summary.setSkippedByResume(resumeFrom);
        summary.setCommitted(resumeFrom);
        if (resumeFrom > 0) {
            log.info("⏭️ Run {}: skipping {} records committed earlier", runKey, resumeFrom);
        }

        List<RawOrderRecord> pending = records.subList((int) resumeFrom, records.size());
        log.info("🔄 Run {}: processing {} of {} records", runKey, pending.size(), records.size());

        List<RecordOutcome> outcomes = normalizeAll(pending);

        for (RecordOutcome outcome : outcomes) {
            if (cancellation.isCancelled()) {
                log.warn("🛑 Run {} cancelled after {} committed records", runKey, summary.getCommitted());
                summary.markCancelled();
                return;
            }

            if (outcome.getRejection() != null) {
                summary.addRejection(outcome.getRejection());
            } else {
                summary.setNormalized(summary.getNormalized() + 1);
                summary.recordMerge(mergeWithRetry(outcome.getOrder(), summary));
            }

            long committed = summary.getCommitted() + 1;
            try {
                storeRetry.run("checkpoint " + runKey, () -> checkpointStore.save(runKey, committed));
            } catch (StoreUnavailableException e) {
                throw abort("Checkpoint store unavailable", summary, e);
            }
            summary.setCommitted(committed);
        }

        checkpointStore.clear(runKey);
        log.info("✅ Run {}: {} normalized, {} rejected, {} inserted, {} replaced",
                runKey, summary.getNormalized(), summary.getRejected(),
                summary.getMergedInserted(), summary.getMergedUpdated());
    }

    private MergeResult mergeWithRetry(Order order, ImportSummary summary) {
        try {
            return storeRetry.call("merge " + order.getOrderId(), () -> merger.merge(order, orderStore));
        } catch (StoreUnavailableException e) {
            throw abort("Order store unavailable while merging " + order.getOrderId(), summary, e);
        }
    }

    private BatchAbortedException abort(String message, ImportSummary summary, StoreUnavailableException cause) {
        summary.markFailed(message);
        return new BatchAbortedException(message, summary.getCommitted(), cause);
    }

    // ================================
    // NORMALIZATION FAN-OUT
    // ================================

    private List<RecordOutcome> normalizeAll(List<RawOrderRecord> pending) {
        if (pending.isEmpty()) {
            return List.of();
        }

        int threads = Math.max(1, Math.min(properties.getBatch().getWorkerThreads(), pending.size()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<CompletableFuture<RecordOutcome>> futures = new ArrayList<>(pending.size());
            for (RawOrderRecord record : pending) {
                futures.add(CompletableFuture.supplyAsync(() -> normalizeOne(record), executor));
            }

            List<RecordOutcome> outcomes = new ArrayList<>(futures.size());
            for (CompletableFuture<RecordOutcome> future : futures) {
                outcomes.add(future.join());
            }
            return outcomes;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            executor.shutdown();
        }
    }

    RecordOutcome normalizeOne(RawOrderRecord record) {
        if (record.isMalformed()) {
            String message = record.getParseError() != null ? record.getParseError() : "Record is not a JSON object";
            return RecordOutcome.rejected(record, RejectionReason.MALFORMED_RECORD, message);
        }

        Order order;
        try {
            order = normalizer.normalize(record.getPayload());
        } catch (TypeCoercionException e) {
            return RecordOutcome.rejected(record, RejectionReason.TYPE_COERCION, e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ Unexpected failure normalizing record at line {}", record.getPosition(), e);
            return RecordOutcome.rejected(record, RejectionReason.MALFORMED_RECORD,
                    "Unexpected normalization failure: " + e.getMessage());
        }

        ValidationResult result = validationProcessor.validate(order);
        if (!result.isValid()) {
            return RecordOutcome.rejected(record, result.getReason(), result.getMessage());
        }
        return RecordOutcome.accepted(order);
    }

    static final class RecordOutcome {
        private final Order order;
        private final ErrorReport rejection;

        private RecordOutcome(Order order, ErrorReport rejection) {
            this.order = order;
            this.rejection = rejection;
        }

        static RecordOutcome accepted(Order order) {
            return new RecordOutcome(order, null);
        }

        static RecordOutcome rejected(RawOrderRecord record, RejectionReason reason, String message) {
            log.warn("⚠️ Rejected record at line {} (order {}): {} - {}",
                    record.getPosition(), record.getOrderIdHint(), reason, message);
            return new RecordOutcome(null, ErrorReport.rejection(
                    record.getOrderIdHint(), record.getPosition(), reason, message));
        }

        Order getOrder() {
            return order;
        }

        ErrorReport getRejection() {
            return rejection;
        }
    }
}
