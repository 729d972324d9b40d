package com.example.smartcart.services;

import com.example.smartcart.model.AffinityMatrix;
import com.example.smartcart.model.Catalog;
import com.example.smartcart.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;

/**
 * Counts how often catalog items share an order and normalizes the counts
 * into an {@link AffinityMatrix}: affinity(a, b) = pairs(a, b) / orders(a).
 * With parallelism above 1 the sampled orders are split into contiguous
 * shards, counted on a worker pool and merged once at the end.
 */
public class CoOccurrenceBuilder {
    private static final Logger log = LoggerFactory.getLogger(CoOccurrenceBuilder.class);

    public static class Result {
        public final AffinityMatrix matrix;
        public final PairCounts counts;
        public final long inputOrders;
        public final long sampledOrders;

        public Result(AffinityMatrix matrix, PairCounts counts, long inputOrders, long sampledOrders) {
            this.matrix = matrix; this.counts = counts; this.inputOrders = inputOrders; this.sampledOrders = sampledOrders;
        }
    }

    private final int parallelism;

    public CoOccurrenceBuilder() { this(1); }

    public CoOccurrenceBuilder(int parallelism) {
        if (parallelism < 1) throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
        this.parallelism = parallelism;
    }

    public Result build(List<? extends List<String>> orders, Catalog catalog, OrderSampler sampler) {
        List<? extends List<String>> sample = sampler.sample(orders);
        log.info("Counting pairs over {} of {} orders ({} shard(s))", sample.size(), orders.size(),
                Math.min(parallelism, Math.max(1, sample.size())));

        PairCounts counts = count(sample, catalog);
        AffinityMatrix matrix = normalize(counts, catalog);
        log.info("Co-occurrence matrix: {} unordered pairs, {} directed affinities", counts.pairs().size(), matrix.pairCount());
        return new Result(matrix, counts, orders.size(), sample.size());
    }

    PairCounts count(List<? extends List<String>> orders, Catalog catalog) {
        int shards = Math.min(parallelism, Math.max(1, orders.size()));
        if (shards == 1) return countShard(orders, catalog);

        ExecutorService pool = Executors.newFixedThreadPool(shards);
        try {
            List<Future<PairCounts>> futures = new ArrayList<>(shards);
            int size = orders.size();
            for (int s = 0; s < shards; s++) {
                int from = (int) ((long) size * s / shards);
                int to = (int) ((long) size * (s + 1) / shards);
                List<? extends List<String>> slice = orders.subList(from, to);
                futures.add(pool.submit(() -> countShard(slice, catalog)));
            }
            PairCounts merged = new PairCounts();
            for (Future<PairCounts> f : futures) merged.merge(f.get());
            return merged;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while counting item pairs", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Pair counting failed in a worker shard", ex.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    static PairCounts countShard(List<? extends List<String>> orders, Catalog catalog) {
        PairCounts counts = new PairCounts();
        for (List<String> order : orders) {
            if (order == null || order.isEmpty()) continue;
            counts.addOrder(distinctIndices(order, catalog));
        }
        return counts;
    }

    private static int[] distinctIndices(List<String> order, Catalog catalog) {
        LinkedHashSet<Integer> seen = new LinkedHashSet<>();
        for (Item it : ItemTagger.resolve(catalog, order)) seen.add(it.index);
        int[] out = new int[seen.size()];
        int i = 0;
        for (Integer idx : seen) out[i++] = idx;
        return out;
    }

    static AffinityMatrix normalize(PairCounts counts, Catalog catalog) {
        List<Item> items = catalog.items();
        // sorted so the matrix (and its JSON form) does not depend on hash order
        TreeMap<Integer, TreeMap<Integer, Double>> byIndex = new TreeMap<>();
        for (Map.Entry<Long, Long> e : new TreeMap<>(counts.pairs()).entrySet()) {
            int a = PairCounts.first(e.getKey());
            int b = PairCounts.second(e.getKey());
            long together = e.getValue();
            byIndex.computeIfAbsent(a, k -> new TreeMap<>()).put(b, (double) together / counts.total(a));
            byIndex.computeIfAbsent(b, k -> new TreeMap<>()).put(a, (double) together / counts.total(b));
        }
        Map<String, Map<String, Double>> rows = new LinkedHashMap<>();
        for (var row : byIndex.entrySet()) {
            Map<String, Double> cells = new LinkedHashMap<>();
            for (var cell : row.getValue().entrySet()) cells.put(items.get(cell.getKey()).key(), cell.getValue());
            rows.put(items.get(row.getKey()).key(), cells);
        }
        return new AffinityMatrix(rows);
    }
}
