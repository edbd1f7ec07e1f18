package com.guno.orderpipeline.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Import Summary - run summary of one pipeline execution
 * Counts: normalized, rejected by reason, merged inserted/updated, projected rows
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImportSummary {

    public static final String STATUS_IN_PROGRESS = "IN_PROGRESS";
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_CANCELLED = "CANCELLED";
    public static final String STATUS_FAILED = "FAILED";

    @Builder.Default
    private LocalDateTime startTime = LocalDateTime.now();

    private LocalDateTime endTime;

    @Builder.Default
    private String status = STATUS_IN_PROGRESS;

    private String errorMessage;

    @Builder.Default private long inputRecords = 0;
    @Builder.Default private long skippedByResume = 0;
    @Builder.Default private long normalized = 0;
    @Builder.Default private long mergedInserted = 0;
    @Builder.Default private long mergedUpdated = 0;
    @Builder.Default private long projectedRows = 0;

    /**
     * Input records fully processed and checkpointed, including rejected ones
     */
    @Builder.Default private long committed = 0;

    @Builder.Default
    private Map<RejectionReason, Long> rejectedByReason = new EnumMap<>(RejectionReason.class);

    @Builder.Default
    private List<ErrorReport> errors = new ArrayList<>();

    public void addRejection(ErrorReport report) {
        rejectedByReason.merge(report.getReason(), 1L, Long::sum);
        errors.add(report);
    }

    public long getRejected() {
        return rejectedByReason.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getRejected(RejectionReason reason) {
        return rejectedByReason.getOrDefault(reason, 0L);
    }

    public void recordMerge(MergeResult result) {
        if (result.isInserted()) {
            mergedInserted++;
        } else {
            mergedUpdated++;
        }
    }

    public void markSuccess() {
        this.status = STATUS_SUCCESS;
        if (this.endTime == null) {
            this.endTime = LocalDateTime.now();
        }
    }

    public void markCancelled() {
        this.status = STATUS_CANCELLED;
        if (this.endTime == null) {
            this.endTime = LocalDateTime.now();
        }
    }

    public void markFailed(String errorMessage) {
        this.status = STATUS_FAILED;
        this.errorMessage = errorMessage;
        if (this.endTime == null) {
            this.endTime = LocalDateTime.now();
        }
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    public long getDurationMs() {
        if (startTime == null || endTime == null) return 0;
        return ChronoUnit.MILLIS.between(startTime, endTime);
    }

    public String toLogLine() {
        return String.format(
                "status=%s input=%d skipped=%d normalized=%d rejected=%d %s inserted=%d updated=%d projectedRows=%d committed=%d duration=%dms",
                status, inputRecords, skippedByResume, normalized, getRejected(), rejectedByReason,
                mergedInserted, mergedUpdated, projectedRows, committed, getDurationMs());
    }
}
