package com.example.smartcart.services;

import com.example.smartcart.model.Item;

/** Transparent breakdown of one candidate's score. */
public class ScoreBreakdown {
    public final Item candidate;
    public final long popularity;

    public double base;             // combined affinity to the cart
    public double categoryBias;     // 0 or the configured bias
    public double attributeBonus;   // 0 or the configured bonus
    public double total;

    public ScoreBreakdown(Item candidate, long popularity) {
        this.candidate = candidate; this.popularity = popularity;
    }

    @Override public String toString() {
        return String.format("%s: base %.3f  +category %.3f  +attribute %.3f  =>  %.3f",
                candidate.name, base, categoryBias, attributeBonus, total);
    }
}
