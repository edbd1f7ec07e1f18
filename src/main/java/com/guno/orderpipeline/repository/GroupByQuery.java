package com.guno.orderpipeline.repository;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Group-by request against an analytics table. Ordering may name keys or aggregate aliases.
 */
@Value
@Builder
public class GroupByQuery {

    String table;
    @Singular List<String> keys;
    @Singular List<AggregateSpec> aggregates;
    @Singular List<ColumnFilter> filters;
    @Singular("orderBy") List<SortSpec> ordering;
    Integer limit;
}
