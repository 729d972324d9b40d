package com.example.smartcart.services;

import java.util.*;

/**
 * Picks at most {@code limit} orders. {@link Strategy#UNIFORM} is reservoir
 * sampling with a seeded {@link Random}, so memory grows only with the orders kept and
 * the same seed always picks the same orders. Picked orders keep their input order.
 */
public class OrderSampler {
    public enum Strategy { UNIFORM, FIRST_N }

    private final Integer limit; // null = keep everything
    private final Strategy strategy;
    private final long seed;

    public OrderSampler(Integer limit, Strategy strategy, long seed) {
        if (limit != null && limit < 0) throw new IllegalArgumentException("Sample limit must be >= 0, got " + limit);
        this.limit = limit;
        this.strategy = strategy == null ? Strategy.UNIFORM : strategy;
        this.seed = seed;
    }

    public static OrderSampler all() { return new OrderSampler(null, Strategy.FIRST_N, 0L); }

    public Integer limit() { return limit; }

    public Strategy strategy() { return strategy; }

    public long seed() { return seed; }

    public <T> List<T> sample(Iterable<T> orders) {
        if (limit == null) {
            List<T> out = new ArrayList<>();
            orders.forEach(out::add);
            return out;
        }
        if (strategy == Strategy.FIRST_N) {
            List<T> out = new ArrayList<>(Math.min(limit, 1 << 16));
            for (T o : orders) {
                if (out.size() >= limit) break;
                out.add(o);
            }
            return out;
        }
        return reservoir(orders);
    }

    private <T> List<T> reservoir(Iterable<T> orders) {
        Random rnd = new Random(seed);
        List<Long> positions = new ArrayList<>(Math.min(limit, 1 << 16));
        List<T> picked = new ArrayList<>(Math.min(limit, 1 << 16));
        long seen = 0;
        for (T o : orders) {
            if (seen < limit) {
                positions.add(seen);
                picked.add(o);
            } else {
                long j = rnd.nextLong(seen + 1);
                if (j < limit) {
                    positions.set((int) j, seen);
                    picked.set((int) j, o);
                }
            }
            seen++;
        }
        int n = picked.size();
        Integer[] slots = new Integer[n];
        for (int i = 0; i < n; i++) slots[i] = i;
        Arrays.sort(slots, Comparator.comparingLong(i -> positions.get(i)));
        List<T> out = new ArrayList<>(n);
        for (Integer s : slots) out.add(picked.get(s));
        return out;
    }
}
