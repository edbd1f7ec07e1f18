package com.guno.orderpipeline.repository;

import com.guno.orderpipeline.exception.SchemaMismatchException;
import com.guno.orderpipeline.exception.StoreUnavailableException;
import com.guno.orderpipeline.util.CsvFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.copy.CopyManager;
import org.postgresql.core.BaseConnection;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * PostgreSQL analytics store - JDBC operations with COPY FROM for bulk loads
 */
@RequiredArgsConstructor
@Slf4j
public class JdbcAnalyticsStore implements AnalyticsStore {

    private static final int CHUNK_SIZE = 1000;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void createOrReplaceTable(String table, TableSchema schema, List<Map<String, Object>> rows) {
        TableSchema.requireIdentifier(table);
        rows.forEach(row -> schema.checkRow(table, row));

        String columns = schema.getColumns().entrySet().stream()
                .map(e -> e.getKey() + " " + e.getValue().getSqlType())
                .collect(Collectors.joining(", "));

        execute("createOrReplaceTable " + table, () -> {
            jdbcTemplate.execute("DROP TABLE IF EXISTS " + table);
            jdbcTemplate.execute("CREATE TABLE " + table + " (" + columns + ")");
            return null;
        });
        int loaded = load(table, schema, rows);
        log.info("Created table {} with {} columns, loaded {} rows", table, schema.getColumns().size(), loaded);
    }

    @Override
    public int insertRows(String table, List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) return 0;
        TableSchema schema = schemaOf(table);
        rows.forEach(row -> schema.checkRow(table, row));
        return load(table, schema, rows);
    }

    @Override
    public int updateWhere(String table, List<ColumnFilter> filters, Map<String, Object> assignments) {
        TableSchema schema = schemaOf(table);
        schema.checkRow(table, assignments);
        filters.forEach(f -> schema.typeOf(f.getColumn()));

        List<Object> params = new ArrayList<>();
        String setClause = assignments.entrySet().stream()
                .map(e -> {
                    params.add(toJdbc(e.getValue()));
                    return e.getKey() + " = ?";
                })
                .collect(Collectors.joining(", "));
        String sql = "UPDATE " + table + " SET " + setClause + whereClause(filters, params);

        int updated = execute("updateWhere " + table, () -> jdbcTemplate.update(sql, params.toArray()));
        log.debug("Updated {} rows in {}", updated, table);
        return updated;
    }

    @Override
    public void alterAddColumn(String table, String column, ColumnType type) {
        TableSchema schema = schemaOf(table);
        TableSchema.requireIdentifier(column);
        if (schema.hasColumn(column)) {
            if (schema.typeOf(column) != type) {
                throw new SchemaMismatchException(String.format("Column %s.%s already exists as %s",
                        table, column, schema.typeOf(column)));
            }
            return;
        }
        execute("alterAddColumn " + table, () -> {
            jdbcTemplate.execute("ALTER TABLE " + table + " ADD COLUMN " + column + " " + type.getSqlType());
            return null;
        });
        log.info("Added column {}.{} {}", table, column, type);
    }

    @Override
    public void dropColumn(String table, String column) {
        TableSchema.requireIdentifier(table);
        TableSchema.requireIdentifier(column);
        execute("dropColumn " + table, () -> {
            jdbcTemplate.execute("ALTER TABLE " + table + " DROP COLUMN IF EXISTS " + column);
            return null;
        });
        log.info("Dropped column {}.{}", table, column);
    }

    @Override
    public List<Map<String, Object>> queryGroupBy(GroupByQuery query) {
        String table = query.getTable();
        TableSchema schema = schemaOf(table);
        query.getKeys().forEach(schema::typeOf);

        List<String> selects = new ArrayList<>(query.getKeys());
        for (AggregateSpec agg : query.getAggregates()) {
            TableSchema.requireIdentifier(agg.getAlias());
            if (agg.getColumn() != null) {
                schema.typeOf(agg.getColumn());
            }
            selects.add(aggregateSql(agg) + " AS " + agg.getAlias());
        }

        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(String.join(", ", selects))
                .append(" FROM ").append(table)
                .append(whereClause(query.getFilters(), params));
        if (!query.getKeys().isEmpty()) {
            sql.append(" GROUP BY ").append(String.join(", ", query.getKeys()));
        }
        if (!query.getOrdering().isEmpty()) {
            sql.append(" ORDER BY ").append(query.getOrdering().stream()
                    .map(s -> TableSchema.requireIdentifier(s.getColumn()) + (s.isDescending() ? " DESC" : " ASC"))
                    .collect(Collectors.joining(", ")));
        }
        if (query.getLimit() != null) {
            sql.append(" LIMIT ").append(query.getLimit());
        }

        List<Map<String, Object>> rows = execute("queryGroupBy " + table,
                () -> jdbcTemplate.queryForList(sql.toString(), params.toArray()));

        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> converted = new LinkedHashMap<>();
            row.forEach((k, v) -> converted.put(k, fromJdbc(v)));
            result.add(converted);
        }
        return result;
    }

    @Override
    public TableSchema schemaOf(String table) {
        TableSchema.requireIdentifier(table);
        List<Map<String, Object>> columns = execute("schemaOf " + table, () -> jdbcTemplate.queryForList(
                "SELECT column_name, data_type FROM information_schema.columns " +
                        "WHERE table_schema = current_schema() AND table_name = ? ORDER BY ordinal_position",
                table));
        if (columns.isEmpty()) {
            throw new SchemaMismatchException("Unknown table: " + table);
        }

        TableSchema.Builder builder = TableSchema.builder();
        columns.forEach(c -> builder.column((String) c.get("column_name"),
                ColumnType.fromSqlType((String) c.get("data_type"))));
        return builder.build();
    }

    @Override
    public boolean tableExists(String table) {
        TableSchema.requireIdentifier(table);
        Integer count = execute("tableExists " + table, () -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM information_schema.tables WHERE table_schema = current_schema() AND table_name = ?",
                Integer.class, table));
        return count != null && count > 0;
    }

    // === COPY FROM Implementation ===

    private int load(String table, TableSchema schema, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) return 0;
        try {
            return copyIn(table, schema, rows);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (Exception e) {
            log.warn("COPY into {} failed, using batch insert: {}", table, e.getMessage());
            return executeBatchInsert(table, schema, rows);
        }
    }

    private int copyIn(String table, TableSchema schema, List<Map<String, Object>> rows) {
        List<String> columns = schema.getColumnNames();
        String copySql = "COPY " + table + " (" + String.join(", ", columns) + ") FROM STDIN WITH (FORMAT CSV, DELIMITER ',')";
        String csvData = rows.stream()
                .map(row -> CsvFormatter.joinCsvRow(columns.stream().map(row::get).toArray()))
                .collect(Collectors.joining("\n"));

        Long copied = execute("copy " + table, () -> jdbcTemplate.execute((Connection conn) -> {
            CopyManager copyManager = new CopyManager(conn.unwrap(BaseConnection.class));
            try (StringReader reader = new StringReader(csvData)) {
                return copyManager.copyIn(copySql, reader);
            } catch (IOException e) {
                throw new StoreUnavailableException("COPY stream failed for " + table, e);
            }
        }));
        return copied == null ? 0 : copied.intValue();
    }

    private int executeBatchInsert(String table, TableSchema schema, List<Map<String, Object>> rows) {
        List<String> columns = schema.getColumnNames();
        String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
                + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";

        int total = 0;
        for (int i = 0; i < rows.size(); i += CHUNK_SIZE) {
            List<Object[]> chunk = rows.subList(i, Math.min(i + CHUNK_SIZE, rows.size())).stream()
                    .map(row -> columns.stream().map(c -> toJdbc(row.get(c))).toArray())
                    .toList();
            int[] counts = execute("batchInsert " + table, () -> jdbcTemplate.batchUpdate(sql, chunk));
            total += counts.length;
        }
        log.info("Batch insert into {} completed: {} rows", table, total);
        return total;
    }

    // === SQL helpers ===

    private String whereClause(List<ColumnFilter> filters, List<Object> params) {
        if (filters.isEmpty()) return "";
        return " WHERE " + filters.stream()
                .map(f -> {
                    String column = TableSchema.requireIdentifier(f.getColumn());
                    return switch (f.getOperator()) {
                        case EQ -> {
                            params.add(toJdbc(f.getValue()));
                            yield column + " = ?";
                        }
                        case NE -> {
                            params.add(toJdbc(f.getValue()));
                            yield column + " <> ?";
                        }
                        case IS_NULL -> column + " IS NULL";
                        case NOT_NULL -> column + " IS NOT NULL";
                    };
                })
                .collect(Collectors.joining(" AND "));
    }

    private String aggregateSql(AggregateSpec agg) {
        String column = agg.getColumn() == null ? "*" : TableSchema.requireIdentifier(agg.getColumn());
        return switch (agg.getFunction()) {
            case COUNT -> "COUNT(" + column + ")";
            case COUNT_DISTINCT -> "COUNT(DISTINCT " + column + ")";
            case SUM -> "SUM(" + column + ")";
            case AVG -> "AVG(" + column + ")";
            case MIN -> "MIN(" + column + ")";
            case MAX -> "MAX(" + column + ")";
        };
    }

    /**
     * Instants are bound with an explicit UTC offset so the JVM zone never shifts them
     */
    static Object toJdbc(Object value) {
        if (value instanceof Instant instant) return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
        return value;
    }

    static Object fromJdbc(Object value) {
        if (value instanceof Timestamp timestamp) return timestamp.toInstant();
        if (value instanceof OffsetDateTime dateTime) return dateTime.toInstant();
        if (value instanceof Integer number) return number.longValue();
        if (value instanceof Double number) return BigDecimal.valueOf(number);
        return value;
    }

    /**
     * Translate driver failures: connectivity and transient errors are retryable, grammar errors are schema errors
     */
    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException | RecoverableDataAccessException e) {
            throw new StoreUnavailableException("Store unavailable during " + operation, e);
        } catch (BadSqlGrammarException e) {
            throw new SchemaMismatchException(operation + " rejected by store: " + e.getMessage());
        } catch (DataAccessException e) {
            log.error("Store error during {}: {}", operation, e.getMessage());
            throw e;
        }
    }
}
