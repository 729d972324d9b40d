package com.example.smartcart.model;

import java.util.List;

/** One labeled evaluation row: prior cart items and the items that actually followed. */
public final class TestRow {
    public final String id;
    public final List<String> cart;
    public final List<String> groundTruth;

    public TestRow(String id, List<String> cart, List<String> groundTruth) {
        this.id = id;
        this.cart = cart == null ? List.of() : List.copyOf(cart);
        this.groundTruth = groundTruth == null ? List.of() : List.copyOf(groundTruth);
    }
}
