package com.guno.orderpipeline.repository;

import lombok.Value;

@Value
public class SortSpec {

    String column;
    boolean descending;

    public static SortSpec asc(String column) {
        return new SortSpec(column, false);
    }

    public static SortSpec desc(String column) {
        return new SortSpec(column, true);
    }
}
