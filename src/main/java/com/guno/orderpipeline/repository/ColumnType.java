package com.guno.orderpipeline.repository;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Column types understood by the analytics store
 */
public enum ColumnType {

    TEXT("TEXT"),
    DECIMAL("NUMERIC(18,4)"),
    INTEGER("BIGINT"),
    TIMESTAMP("TIMESTAMPTZ");

    private final String sqlType;

    ColumnType(String sqlType) {
        this.sqlType = sqlType;
    }

    public String getSqlType() {
        return sqlType;
    }

    public boolean accepts(Object value) {
        if (value == null) return true;
        return switch (this) {
            case TEXT -> value instanceof String;
            case DECIMAL -> value instanceof BigDecimal || value instanceof Integer || value instanceof Long;
            case INTEGER -> value instanceof Integer || value instanceof Long;
            case TIMESTAMP -> value instanceof Instant;
        };
    }

    /**
     * Map an information_schema data_type back to a column type
     */
    public static ColumnType fromSqlType(String dataType) {
        String type = dataType == null ? "" : dataType.toLowerCase();
        if (type.startsWith("timestamp")) return TIMESTAMP;
        if (type.equals("numeric") || type.equals("decimal") || type.startsWith("double") || type.equals("real")) return DECIMAL;
        if (type.equals("bigint") || type.equals("integer") || type.equals("smallint")) return INTEGER;
        return TEXT;
    }
}
