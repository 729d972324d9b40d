package com.example.smartcart.model;

/** An item with its occurrence count, as listed in a per-category ranking. */
public final class RankedItem {
    public final Item item;
    public final long frequency;

    public RankedItem(Item item, long frequency) { this.item = item; this.frequency = frequency; }

    @Override public String toString() { return item.name + " (" + frequency + ")"; }
}
