package com.guno.orderpipeline.scheduler;

import com.guno.orderpipeline.config.PipelineProperties;
import com.guno.orderpipeline.dto.internal.ImportSummary;
import com.guno.orderpipeline.exception.BatchAbortedException;
import com.guno.orderpipeline.service.OrderImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * ImportScheduler - periodic import of pipeline.input.path
 *
 * Disabled unless pipeline.scheduler.enabled=true; the manual trigger always works.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ImportScheduler {

    private final OrderImportService importService;
    private final PipelineProperties properties;

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // ================================
    // SCHEDULED IMPORT
    // ================================

    @Scheduled(cron = "${scheduler.import.cron:0 */15 * * * *}")
    public void scheduledImport() {
        if (!properties.getScheduler().isEnabled()) {
            log.debug("Scheduled import disabled");
            return;
        }

        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║   SCHEDULED IMPORT STARTED at {}            ║", now());
        log.info("╚════════════════════════════════════════════════════════════╝");

        ImportSummary summary = runImport("SCHEDULED");

        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║   SCHEDULED IMPORT {} at {}          ║", summary.getStatus(), now());
        log.info("╚════════════════════════════════════════════════════════════╝");
    }

    // ================================
    // MANUAL IMPORT
    // ================================

    /**
     * Manual import trigger (for operators or testing)
     */
    public ImportSummary triggerManualImport() {
        log.info("╔════════════════════════════════════════════════════════════╗");
        log.info("║   MANUAL IMPORT TRIGGERED at {}             ║", now());
        log.info("╚════════════════════════════════════════════════════════════╝");
        return runImport("MANUAL");
    }

    private ImportSummary runImport(String trigger) {
        try {
            ImportSummary summary = importService.importConfiguredInput();
            logImportSummary(summary, trigger);
            return summary;
        } catch (BatchAbortedException e) {
            log.error("❌ {} import aborted, {} records committed; rerun resumes from there",
                    trigger, e.getCommittedRecords(), e);
            return failed(e.getMessage());
        } catch (Exception e) {
            log.error("❌ {} import failed: {}", trigger, e.getMessage(), e);
            return failed(e.getMessage());
        }
    }

    private ImportSummary failed(String message) {
        ImportSummary summary = ImportSummary.builder().build();
        summary.markFailed(message);
        return summary;
    }

    private void logImportSummary(ImportSummary summary, String trigger) {
        log.info("📊 {} IMPORT SUMMARY", trigger);
        log.info("   Input records:   {}", summary.getInputRecords());
        log.info("   Resumed past:    {}", summary.getSkippedByResume());
        log.info("   Normalized:      {}", summary.getNormalized());
        log.info("   Rejected:        {} {}", summary.getRejected(), summary.getRejectedByReason());
        log.info("   Inserted:        {}", summary.getMergedInserted());
        log.info("   Replaced:        {}", summary.getMergedUpdated());
        log.info("   Flat rows:       {}", summary.getProjectedRows());
        log.info("   Duration:        {}ms", summary.getDurationMs());
    }

    private String now() {
        return LocalDateTime.now().format(TIME_FORMATTER);
    }
}
