package com.example.smartcart.model;

import java.util.List;

/** Scored result for a single {@link TestRow}. */
public final class EvaluationRow {
    public final String id;
    public final List<Item> cart;
    public final List<Recommendation> recommendations;
    public final List<String> groundTruth;
    public final List<Boolean> hits; // one flag per ground-truth item
    public final double recall;
    public final double precision;
    public final boolean top1;

    public EvaluationRow(String id, List<Item> cart, List<Recommendation> recommendations,
                         List<String> groundTruth, List<Boolean> hits,
                         double recall, double precision, boolean top1) {
        this.id = id;
        this.cart = List.copyOf(cart);
        this.recommendations = List.copyOf(recommendations);
        this.groundTruth = List.copyOf(groundTruth);
        this.hits = List.copyOf(hits);
        this.recall = recall;
        this.precision = precision;
        this.top1 = top1;
    }

    public boolean hasGroundTruth() { return !groundTruth.isEmpty(); }

    public boolean anyHit() { return hits.contains(Boolean.TRUE); }
}
