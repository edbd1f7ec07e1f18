package com.guno.orderpipeline.repository;

import com.guno.orderpipeline.exception.SchemaMismatchException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Ordered column definitions of one analytics table. Immutable; evolution returns a new schema.
 */
@EqualsAndHashCode
@ToString
public final class TableSchema {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final Map<String, ColumnType> columns;

    private TableSchema(Map<String, ColumnType> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ColumnType> getColumns() {
        return columns;
    }

    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String column) {
        return columns.containsKey(column);
    }

    public ColumnType typeOf(String column) {
        ColumnType type = columns.get(column);
        if (type == null) {
            throw new SchemaMismatchException("Unknown column: " + column);
        }
        return type;
    }

    public TableSchema withColumn(String column, ColumnType type) {
        Map<String, ColumnType> copy = new LinkedHashMap<>(columns);
        copy.put(requireIdentifier(column), type);
        return new TableSchema(copy);
    }

    public TableSchema withoutColumn(String column) {
        Map<String, ColumnType> copy = new LinkedHashMap<>(columns);
        copy.remove(column);
        return new TableSchema(copy);
    }

    /**
     * Every column of the row must exist and hold a value of the declared type
     */
    public void checkRow(String table, Map<String, Object> row) {
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            ColumnType type = columns.get(entry.getKey());
            if (type == null) {
                throw new SchemaMismatchException(
                        String.format("Table %s has no column %s", table, entry.getKey()));
            }
            if (!type.accepts(entry.getValue())) {
                throw new SchemaMismatchException(String.format("Column %s.%s is %s, got %s",
                        table, entry.getKey(), type, entry.getValue().getClass().getSimpleName()));
            }
        }
    }

    public static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new SchemaMismatchException("Invalid identifier: " + name);
        }
        return name;
    }

    public static class Builder {
        private final Map<String, ColumnType> columns = new LinkedHashMap<>();

        public Builder column(String name, ColumnType type) {
            columns.put(requireIdentifier(name), type);
            return this;
        }

        public TableSchema build() {
            return new TableSchema(columns);
        }
    }
}
