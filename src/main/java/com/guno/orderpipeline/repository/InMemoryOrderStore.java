package com.guno.orderpipeline.repository;

import com.guno.orderpipeline.entity.Order;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory canonical order store. Keeps first-insert order so snapshots are reproducible.
 */
@Slf4j
public class InMemoryOrderStore implements KeyedStore<Order> {

    private final Map<String, Order> orders = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Order> findById(String key) {
        return Optional.ofNullable(orders.get(key));
    }

    @Override
    public synchronized void put(String key, Order value) {
        orders.put(key, value);
    }

    @Override
    public synchronized boolean deleteById(String key) {
        boolean removed = orders.remove(key) != null;
        if (removed) {
            log.debug("Deleted order {}", key);
        }
        return removed;
    }

    @Override
    public synchronized List<Order> findAll() {
        return new ArrayList<>(orders.values());
    }

    @Override
    public synchronized long count() {
        return orders.size();
    }
}
