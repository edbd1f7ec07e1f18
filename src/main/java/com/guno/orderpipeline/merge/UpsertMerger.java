package com.guno.orderpipeline.merge;

import com.guno.orderpipeline.dto.internal.MergeResult;
import com.guno.orderpipeline.entity.Order;
import com.guno.orderpipeline.repository.KeyedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * UpsertMerger - insert-or-replace keyed by orderId.
 *
 * A matching record is replaced as a whole: no field survives from the old
 * record, a shorter items array truncates the stored one. Merges on the same
 * key are serialized through a striped lock, different keys only contend when
 * they hash to the same stripe.
 */
@Component
@Slf4j
public class UpsertMerger {

    private static final int DEFAULT_STRIPES = 64;

    private final ReentrantLock[] stripes;

    public UpsertMerger() {
        this(DEFAULT_STRIPES);
    }

    public UpsertMerger(int stripeCount) {
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public MergeResult merge(Order incoming, KeyedStore<Order> store) {
        String orderId = incoming.getOrderId();
        ReentrantLock lock = lockFor(orderId);
        lock.lock();
        try {
            Optional<Order> existing = store.findById(orderId);
            store.put(orderId, incoming);

            if (existing.isPresent()) {
                log.debug("Replaced order {} ({} -> {} items)", orderId,
                        existing.get().getOrderItems().size(), incoming.getOrderItems().size());
                return MergeResult.replaced(orderId, existing.get());
            }
            log.debug("Inserted order {}", orderId);
            return MergeResult.inserted(orderId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Merge in input order; a later record with the same key wins
     */
    public List<MergeResult> mergeAll(List<Order> incoming, KeyedStore<Order> store) {
        List<MergeResult> results = new ArrayList<>(incoming.size());
        for (Order order : incoming) {
            results.add(merge(order, store));
        }
        return results;
    }

    private ReentrantLock lockFor(String orderId) {
        return stripes[Math.floorMod(orderId.hashCode(), stripes.length)];
    }
}
