package com.guno.orderpipeline.repository;

import lombok.Value;

import java.util.Map;
import java.util.Objects;

/**
 * Single-column predicate, combined with AND when several are given
 */
@Value
public class ColumnFilter {

    public enum Operator {
        EQ, NE, IS_NULL, NOT_NULL
    }

    String column;
    Operator operator;
    Object value;

    public static ColumnFilter eq(String column, Object value) {
        return new ColumnFilter(column, Operator.EQ, value);
    }

    public static ColumnFilter ne(String column, Object value) {
        return new ColumnFilter(column, Operator.NE, value);
    }

    public static ColumnFilter isNull(String column) {
        return new ColumnFilter(column, Operator.IS_NULL, null);
    }

    public static ColumnFilter notNull(String column) {
        return new ColumnFilter(column, Operator.NOT_NULL, null);
    }

    /**
     * SQL semantics: NE never matches a null cell
     */
    public boolean matches(Map<String, Object> row) {
        Object cell = row.get(column);
        return switch (operator) {
            case EQ -> cell != null && Objects.equals(cell, value);
            case NE -> cell != null && !Objects.equals(cell, value);
            case IS_NULL -> cell == null;
            case NOT_NULL -> cell != null;
        };
    }
}
