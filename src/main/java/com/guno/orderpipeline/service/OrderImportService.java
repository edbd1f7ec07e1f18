package com.guno.orderpipeline.service;

import com.guno.orderpipeline.config.PipelineProperties;
import com.guno.orderpipeline.dto.internal.ImportSummary;
import com.guno.orderpipeline.dto.raw.RawOrderRecord;
import com.guno.orderpipeline.entity.CampaignFlag;
import com.guno.orderpipeline.entity.FlatRow;
import com.guno.orderpipeline.entity.Order;
import com.guno.orderpipeline.exception.BatchAbortedException;
import com.guno.orderpipeline.exception.PipelineException;
import com.guno.orderpipeline.exception.StoreUnavailableException;
import com.guno.orderpipeline.export.FlatRowCsvExporter;
import com.guno.orderpipeline.mapper.FlatRowColumns;
import com.guno.orderpipeline.mapper.FlatRowProjector;
import com.guno.orderpipeline.processor.BatchCancellation;
import com.guno.orderpipeline.processor.OrderBatchProcessor;
import com.guno.orderpipeline.reader.NdjsonOrderReader;
import com.guno.orderpipeline.repository.AnalyticsStore;
import com.guno.orderpipeline.repository.KeyedStore;
import com.guno.orderpipeline.schema.CampaignFlagMigration;
import com.guno.orderpipeline.util.BackoffRetry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * OrderImportService - one full pipeline run.
 *
 * read -> normalize/validate/merge -> project the whole canonical store ->
 * replace the flat table -> derive campaign_flag -> summary
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderImportService {

    private final NdjsonOrderReader reader;
    private final OrderBatchProcessor batchProcessor;
    private final FlatRowProjector projector;
    private final KeyedStore<Order> orderStore;
    private final AnalyticsStore analyticsStore;
    private final CampaignFlagMigration campaignFlagMigration;
    private final FlatRowCsvExporter csvExporter;
    private final BackoffRetry storeRetry;
    private final PipelineProperties properties;

    /**
     * Import the configured input file
     */
    public ImportSummary importConfiguredInput() {
        String input = properties.getInput().getPath();
        if (input == null || input.isBlank()) {
            throw new PipelineException("pipeline.input.path is not configured");
        }
        return importFile(Path.of(input), BatchCancellation.none());
    }

    public ImportSummary importFile(Path path, BatchCancellation cancellation) {
        List<RawOrderRecord> records = reader.read(path);
        return importRecords(records, path.getFileName().toString(), cancellation);
    }

    public ImportSummary importRecords(List<RawOrderRecord> records, String runKey, BatchCancellation cancellation) {
        ImportSummary summary = ImportSummary.builder().build();

        try {
            batchProcessor.process(records, runKey, cancellation, summary);
            if (ImportSummary.STATUS_CANCELLED.equals(summary.getStatus())) {
                log.warn("Run {} cancelled, flat table left as is: {}", runKey, summary.toLogLine());
                return summary;
            }

            summary.setProjectedRows(publishProjection(summary));
            summary.markSuccess();
            log.info("📊 Run {} finished: {}", runKey, summary.toLogLine());
            return summary;
        } catch (BatchAbortedException e) {
            summary.markFailed(e.getMessage());
            log.error("❌ Run {} aborted: {}", runKey, summary.toLogLine(), e);
            throw e;
        } catch (RuntimeException e) {
            summary.markFailed(e.getMessage());
            log.error("❌ Run {} failed: {}", runKey, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Rebuild the flat table from a snapshot of the canonical store
     *
     * @return number of rows written
     */
    public int publishProjection(ImportSummary summary) {
        String table = properties.getProjection().getTable();
        boolean deriveFlag = properties.getProjection().isDeriveCampaignFlag();

        try {
            List<Order> snapshot = storeRetry.call("snapshot", orderStore::findAll);
            List<FlatRow> rows = projector.projectAll(snapshot);

            storeRetry.run("replace " + table, () -> analyticsStore.createOrReplaceTable(
                    table, FlatRowColumns.SCHEMA, FlatRowColumns.toColumnRows(rows)));
            if (deriveFlag) {
                storeRetry.call("campaign_flag " + table, () -> campaignFlagMigration.apply(table));
            }

            exportIfConfigured(rows, deriveFlag);
            return rows.size();
        } catch (StoreUnavailableException e) {
            summary.markFailed(e.getMessage());
            throw new BatchAbortedException("Analytics store unavailable while publishing " + table,
                    summary.getCommitted(), e);
        }
    }

    public List<FlatRow> currentRows() {
        return projector.projectAll(storeRetry.call("snapshot", orderStore::findAll));
    }

    private void exportIfConfigured(List<FlatRow> rows, boolean deriveFlag) {
        String exportPath = properties.getProjection().getExportPath();
        if (exportPath == null || exportPath.isBlank()) {
            return;
        }
        List<FlatRow> exported = deriveFlag ? rows.stream().map(CampaignFlag::apply).toList() : rows;
        csvExporter.export(exported, Path.of(exportPath));
    }
}
