package com.guno.orderpipeline.repository;

import java.util.List;
import java.util.Map;

/**
 * Boundary with the columnar storage/query engine.
 *
 * Rows are column name to value maps. Implementations throw
 * {@link com.guno.orderpipeline.exception.StoreUnavailableException} for
 * transient failures and
 * {@link com.guno.orderpipeline.exception.SchemaMismatchException} when rows or
 * statements do not fit the table.
 */
public interface AnalyticsStore {

    void createOrReplaceTable(String table, TableSchema schema, List<Map<String, Object>> rows);

    int insertRows(String table, List<Map<String, Object>> rows);

    int updateWhere(String table, List<ColumnFilter> filters, Map<String, Object> assignments);

    /**
     * No-op when the column already exists with the same type
     */
    void alterAddColumn(String table, String column, ColumnType type);

    void dropColumn(String table, String column);

    List<Map<String, Object>> queryGroupBy(GroupByQuery query);

    TableSchema schemaOf(String table);

    boolean tableExists(String table);
}
