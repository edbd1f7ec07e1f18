package com.guno.orderpipeline.repository;

import com.guno.orderpipeline.exception.SchemaMismatchException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory analytics store with the same semantics as the JDBC one.
 * Used by tests and by the memory store profile.
 */
@Slf4j
public class InMemoryAnalyticsStore implements AnalyticsStore {

    private final Map<String, Table> tables = new HashMap<>();

    private static class Table {
        TableSchema schema;
        final List<Map<String, Object>> rows = new ArrayList<>();

        Table(TableSchema schema) {
            this.schema = schema;
        }
    }

    @Override
    public synchronized void createOrReplaceTable(String table, TableSchema schema, List<Map<String, Object>> rows) {
        TableSchema.requireIdentifier(table);
        Table fresh = new Table(schema);
        for (Map<String, Object> row : rows) {
            schema.checkRow(table, row);
            fresh.rows.add(new HashMap<>(row));
        }
        tables.put(table, fresh);
        log.info("Created table {} with {} columns and {} rows", table, schema.getColumns().size(), rows.size());
    }

    @Override
    public synchronized int insertRows(String table, List<Map<String, Object>> rows) {
        Table target = require(table);
        rows.forEach(row -> target.schema.checkRow(table, row));
        rows.forEach(row -> target.rows.add(new HashMap<>(row)));
        return rows.size();
    }

    @Override
    public synchronized int updateWhere(String table, List<ColumnFilter> filters, Map<String, Object> assignments) {
        Table target = require(table);
        filters.forEach(f -> target.schema.typeOf(f.getColumn()));
        target.schema.checkRow(table, assignments);

        int updated = 0;
        for (Map<String, Object> row : target.rows) {
            if (filters.stream().allMatch(f -> f.matches(row))) {
                row.putAll(assignments);
                updated++;
            }
        }
        log.debug("Updated {} rows in {}", updated, table);
        return updated;
    }

    @Override
    public synchronized void alterAddColumn(String table, String column, ColumnType type) {
        Table target = require(table);
        if (target.schema.hasColumn(column)) {
            if (target.schema.typeOf(column) != type) {
                throw new SchemaMismatchException(String.format("Column %s.%s already exists as %s",
                        table, column, target.schema.typeOf(column)));
            }
            return;
        }
        target.schema = target.schema.withColumn(column, type);
        log.info("Added column {}.{} {}", table, column, type);
    }

    @Override
    public synchronized void dropColumn(String table, String column) {
        Table target = require(table);
        if (!target.schema.hasColumn(column)) {
            log.debug("Column {}.{} does not exist, nothing to drop", table, column);
            return;
        }
        target.schema = target.schema.withoutColumn(column);
        target.rows.forEach(row -> row.remove(column));
        log.info("Dropped column {}.{}", table, column);
    }

    @Override
    public synchronized List<Map<String, Object>> queryGroupBy(GroupByQuery query) {
        Table source = require(query.getTable());
        query.getKeys().forEach(source.schema::typeOf);
        query.getFilters().forEach(f -> source.schema.typeOf(f.getColumn()));
        query.getAggregates().stream()
                .filter(a -> a.getColumn() != null)
                .forEach(a -> source.schema.typeOf(a.getColumn()));

        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : source.rows) {
            if (query.getFilters().stream().allMatch(f -> f.matches(row))) {
                List<Object> key = new ArrayList<>();
                query.getKeys().forEach(k -> key.add(row.get(k)));
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
            }
        }

        List<Map<String, Object>> result = new ArrayList<>();
        groups.forEach((key, rows) -> {
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < query.getKeys().size(); i++) {
                out.put(query.getKeys().get(i), key.get(i));
            }
            query.getAggregates().forEach(agg -> out.put(agg.getAlias(), aggregate(agg, rows)));
            result.add(out);
        });

        if (!query.getOrdering().isEmpty()) {
            result.sort(comparator(query.getOrdering()));
        }
        if (query.getLimit() != null && result.size() > query.getLimit()) {
            return new ArrayList<>(result.subList(0, query.getLimit()));
        }
        return result;
    }

    @Override
    public synchronized TableSchema schemaOf(String table) {
        return require(table).schema;
    }

    @Override
    public synchronized boolean tableExists(String table) {
        return tables.containsKey(table);
    }

    /**
     * Copy of the stored rows, for tests and exports
     */
    public synchronized List<Map<String, Object>> rows(String table) {
        List<Map<String, Object>> copy = new ArrayList<>();
        require(table).rows.forEach(row -> copy.add(new HashMap<>(row)));
        return copy;
    }

    // ================================
    // AGGREGATES
    // ================================

    private Object aggregate(AggregateSpec spec, List<Map<String, Object>> rows) {
        String column = spec.getColumn();
        List<Object> values = rows.stream()
                .map(row -> column == null ? Boolean.TRUE : row.get(column))
                .filter(Objects::nonNull)
                .toList();

        return switch (spec.getFunction()) {
            case COUNT -> (long) values.size();
            case COUNT_DISTINCT -> {
                Set<Object> distinct = new HashSet<>(values);
                yield (long) distinct.size();
            }
            case SUM -> values.isEmpty() ? null : sum(values);
            case AVG -> values.isEmpty() ? null
                    : sum(values).divide(BigDecimal.valueOf(values.size()), MathContext.DECIMAL64);
            case MIN -> values.stream().min(InMemoryAnalyticsStore::compareValues).orElse(null);
            case MAX -> values.stream().max(InMemoryAnalyticsStore::compareValues).orElse(null);
        };
    }

    private BigDecimal sum(List<Object> values) {
        BigDecimal total = BigDecimal.ZERO;
        for (Object value : values) {
            total = total.add(toDecimal(value));
        }
        return total;
    }

    private BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) return decimal;
        if (value instanceof Integer || value instanceof Long) return BigDecimal.valueOf(((Number) value).longValue());
        throw new SchemaMismatchException("Cannot sum non-numeric value " + value);
    }

    private Comparator<Map<String, Object>> comparator(List<SortSpec> ordering) {
        Comparator<Map<String, Object>> result = null;
        for (SortSpec sort : ordering) {
            String column = sort.getColumn();
            Comparator<Map<String, Object>> next = (a, b) -> compareNullsLast(a.get(column), b.get(column));
            if (sort.isDescending()) {
                next = next.reversed();
            }
            result = result == null ? next : result.thenComparing(next);
        }
        return result;
    }

    private static int compareNullsLast(Object a, Object b) {
        if (a == null) return b == null ? 0 : 1;
        if (b == null) return -1;
        return compareValues(a, b);
    }

    private static int compareValues(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return toDecimal(x).compareTo(toDecimal(y));
        }
        if (a instanceof String x && b instanceof String y) return x.compareTo(y);
        if (a instanceof Instant x && b instanceof Instant y) return x.compareTo(y);
        throw new SchemaMismatchException("Cannot compare " + a.getClass().getSimpleName()
                + " with " + b.getClass().getSimpleName());
    }

    private static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal decimal) return decimal;
        if (number instanceof Long || number instanceof Integer) return BigDecimal.valueOf(number.longValue());
        return new BigDecimal(number.toString());
    }

    private Table require(String table) {
        Table found = tables.get(table);
        if (found == null) {
            throw new SchemaMismatchException("Unknown table: " + table);
        }
        return found;
    }
}
