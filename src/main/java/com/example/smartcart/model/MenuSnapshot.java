package com.example.smartcart.model;

import java.time.Instant;
import java.util.Objects;

/** Everything the scorer needs for one dataset snapshot. Immutable. */
public final class MenuSnapshot {
    public final String snapshotKey;
    public final Instant builtAt;
    public final long orderCount;
    public final long sampledOrderCount;
    public final Catalog catalog;
    public final AffinityMatrix affinities;

    public MenuSnapshot(String snapshotKey, Instant builtAt, long orderCount, long sampledOrderCount,
                        Catalog catalog, AffinityMatrix affinities) {
        this.snapshotKey = snapshotKey;
        this.builtAt = builtAt;
        this.orderCount = orderCount;
        this.sampledOrderCount = sampledOrderCount;
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.affinities = Objects.requireNonNull(affinities, "affinities");
    }

    @Override public String toString() {
        return "Snapshot " + snapshotKey + ": " + catalog.size() + " items, "
                + affinities.pairCount() + " pairs from " + sampledOrderCount + "/" + orderCount + " orders";
    }
}
