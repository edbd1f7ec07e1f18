package com.guno.orderpipeline.repository;

import lombok.Value;

/**
 * One aggregate column of a group-by query
 */
@Value
public class AggregateSpec {

    public enum Function {
        COUNT, COUNT_DISTINCT, SUM, AVG, MIN, MAX
    }

    Function function;

    /**
     * Null for COUNT means count rows
     */
    String column;

    String alias;

    public static AggregateSpec of(Function function, String column, String alias) {
        return new AggregateSpec(function, column, alias);
    }

    public static AggregateSpec countRows(String alias) {
        return new AggregateSpec(Function.COUNT, null, alias);
    }
}
