package com.example.smartcart.services;

import com.example.smartcart.model.Item;
import com.example.smartcart.model.MenuSnapshot;
import com.example.smartcart.model.Recommendation;

import java.util.List;

/** Anything that can turn a normalized cart into ranked recommendations. */
public interface Recommender {
    int LIMIT = 3;

    List<Recommendation> recommend(List<Item> cart, MenuSnapshot snapshot);
}
