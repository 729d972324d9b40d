package com.example.smartcart.model;

import java.util.*;

/**
 * Sparse directed affinities: {@code affinity(a, b)} is the share of a's
 * orders that also contain b. Keyed by catalog item key. Unobserved pairs are 0.
 */
public final class AffinityMatrix {
    private final Map<String, Map<String, Double>> rows;
    private final long pairCount;

    public AffinityMatrix(Map<String, Map<String, Double>> rows) {
        Map<String, Map<String, Double>> copy = new LinkedHashMap<>();
        long pairs = 0;
        for (var e : rows.entrySet()) {
            if (e.getValue() == null) throw new IllegalArgumentException("Missing affinity row for " + e.getKey());
            Map<String, Double> row = new LinkedHashMap<>();
            for (var cell : e.getValue().entrySet()) {
                if (cell.getKey().equals(e.getKey())) continue;
                Double v = cell.getValue();
                if (v == null || v < 0.0 || v > 1.0 || v.isNaN()) {
                    throw new IllegalArgumentException(
                            "Affinity out of range for " + e.getKey() + " -> " + cell.getKey() + ": " + v);
                }
                row.put(cell.getKey(), v);
            }
            if (!row.isEmpty()) {
                copy.put(e.getKey(), Collections.unmodifiableMap(row));
                pairs += row.size();
            }
        }
        this.rows = Collections.unmodifiableMap(copy);
        this.pairCount = pairs;
    }

    public static AffinityMatrix empty() { return new AffinityMatrix(Map.of()); }

    public double affinity(Item from, Item to) { return affinity(from.key(), to.key()); }

    public double affinity(String fromKey, String toKey) {
        Map<String, Double> row = rows.get(fromKey);
        if (row == null) return 0.0;
        return row.getOrDefault(toKey, 0.0);
    }

    /** Non-zero affinities from one item, keyed by target item key. */
    public Map<String, Double> row(String fromKey) { return rows.getOrDefault(fromKey, Map.of()); }

    public Map<String, Map<String, Double>> rows() { return rows; }

    /** Number of stored directed pairs. */
    public long pairCount() { return pairCount; }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AffinityMatrix)) return false;
        return rows.equals(((AffinityMatrix) o).rows);
    }

    @Override public int hashCode() { return rows.hashCode(); }
}
