package com.guno.orderpipeline.repository;

import java.util.List;
import java.util.Optional;

/**
 * Keyed record store backing the canonical orders
 */
public interface KeyedStore<T> {

    Optional<T> findById(String key);

    /**
     * Insert or replace the whole record stored under key
     */
    void put(String key, T value);

    boolean deleteById(String key);

    /**
     * Snapshot in first-insert order
     */
    List<T> findAll();

    long count();
}
