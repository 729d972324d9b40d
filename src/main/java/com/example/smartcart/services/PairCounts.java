package com.example.smartcart.services;

import java.util.HashMap;
import java.util.Map;

/**
 * Sparse co-occurrence accumulator for one shard of orders. Pairs are keyed by
 * the two catalog indices, smaller first, packed into a long. Shards combine
 * with {@link #merge}, which is plain key-wise addition.
 */
public final class PairCounts {
    private final Map<Long, Long> pairs = new HashMap<>();
    private final Map<Integer, Long> totals = new HashMap<>();
    private long orders;

    public static long pairKey(int a, int b) {
        int lo = Math.min(a, b), hi = Math.max(a, b);
        return ((long) lo << 32) | (hi & 0xffffffffL);
    }

    public static int first(long key) { return (int) (key >>> 32); }

    public static int second(long key) { return (int) key; }

    /**
     * Counts one order given as distinct catalog indices.
     */
    public void addOrder(int[] distinctItems) {
        orders++;
        for (int i = 0; i < distinctItems.length; i++) {
            totals.merge(distinctItems[i], 1L, Long::sum);
            for (int j = i + 1; j < distinctItems.length; j++) {
                pairs.merge(pairKey(distinctItems[i], distinctItems[j]), 1L, Long::sum);
            }
        }
    }

    public PairCounts merge(PairCounts other) {
        other.pairs.forEach((k, v) -> pairs.merge(k, v, Long::sum));
        other.totals.forEach((k, v) -> totals.merge(k, v, Long::sum));
        orders += other.orders;
        return this;
    }

    public long pairCount(int a, int b) { return pairs.getOrDefault(pairKey(a, b), 0L); }

    public long total(int item) { return totals.getOrDefault(item, 0L); }

    public Map<Long, Long> pairs() { return pairs; }

    public Map<Integer, Long> totals() { return totals; }

    public long orders() { return orders; }
}
