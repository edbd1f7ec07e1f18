package com.guno.orderpipeline.aggregation;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * UTC time buckets for temporal groupings
 */
public enum TimeBucket {
    HOUR,
    DAY,
    MONTH;

    public Instant truncate(Instant instant) {
        return switch (this) {
            case HOUR -> instant.truncatedTo(ChronoUnit.HOURS);
            case DAY -> instant.truncatedTo(ChronoUnit.DAYS);
            case MONTH -> instant.atZone(ZoneOffset.UTC)
                    .withDayOfMonth(1)
                    .truncatedTo(ChronoUnit.DAYS)
                    .toInstant();
        };
    }
}
