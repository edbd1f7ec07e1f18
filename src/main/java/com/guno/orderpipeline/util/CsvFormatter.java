package com.guno.orderpipeline.util;

import lombok.experimental.UtilityClass;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * CSV Formatter Utility - CSV formatting for PostgreSQL COPY FROM and flat-row exports
 */
@UtilityClass
public class CsvFormatter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_INSTANT;

    /**
     * Escape value for CSV format. Nulls become empty fields, which COPY reads as NULL.
     */
    public String escape(Object value) {
        if (value == null) return "";

        String str = format(value);
        if (str.contains(",") || str.contains("\"") || str.contains("\n") || str.contains("\r")) {
            return "\"" + str.replace("\"", "\"\"") + "\"";
        }
        return str;
    }

    public String formatInstant(Instant instant) {
        if (instant == null) return "";
        return TIMESTAMP_FORMAT.format(instant);
    }

    /**
     * Plain notation, never scientific
     */
    public String formatDecimal(BigDecimal value) {
        if (value == null) return "";
        return value.toPlainString();
    }

    /**
     * Join CSV row values
     */
    public String joinCsvRow(Object... values) {
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) row.append(",");
            row.append(escape(values[i]));
        }
        return row.toString();
    }

    private String format(Object value) {
        if (value instanceof Instant instant) return formatInstant(instant);
        if (value instanceof BigDecimal decimal) return formatDecimal(decimal);
        return value.toString();
    }
}
