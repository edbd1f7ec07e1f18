package com.guno.orderpipeline.aggregation;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rank-based binning into equal-sized groups.
 *
 * Items are stably sorted by the comparator (ties keep input order, so the
 * first-seen item takes the earlier bin) and rank r of n lands in bin
 * r * bins / n. No reliance on a store's ranking functions.
 */
@UtilityClass
public class QuantileBinner {

    /**
     * @return zero-based bin per item, aligned with the input list
     */
    public <T> List<Integer> assign(List<T> items, Comparator<? super T> order, int bins) {
        if (bins <= 0) {
            throw new IllegalArgumentException("bins must be positive: " + bins);
        }
        int n = items.size();
        List<Integer> ranked = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ranked.add(i);
        }
        ranked.sort((a, b) -> order.compare(items.get(a), items.get(b)));

        Integer[] result = new Integer[n];
        for (int rank = 0; rank < n; rank++) {
            result[ranked.get(rank)] = (int) ((long) rank * bins / n);
        }
        return List.of(result);
    }
}
