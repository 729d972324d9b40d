package com.example.smartcart.model;

public final class Recommendation {
    public enum Source { AFFINITY, FALLBACK }

    public final Item item;
    public final double score;
    public final int rank;
    public final Source source;

    public Recommendation(Item item, double score, int rank, Source source) {
        this.item = item; this.score = score; this.rank = rank; this.source = source;
    }

    public String name() { return item.name; }

    public Category category() { return item.category; }

    @Override public String toString() {
        return String.format("#%d %s (%s) %.3f%s", rank, item.name, item.category.label(), score,
                source == Source.FALLBACK ? " *" : "");
    }
}
