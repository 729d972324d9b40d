package com.example.smartcart.services;

import com.example.smartcart.model.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reference recommender for evaluation: the most ordered items overall that
 * are not already in the cart. Score is frequency relative to the top item.
 */
public class PopularityBaseline implements Recommender {
    private final RecommendationScorer filter;

    public PopularityBaseline(RecommendationScorer filter) { this.filter = filter; }

    @Override
    public List<Recommendation> recommend(List<Item> cart, MenuSnapshot snapshot) {
        if (cart == null || cart.isEmpty()) return List.of();
        Set<Item> inCart = new HashSet<>(cart);
        List<RankedItem> popular = snapshot.catalog.mostPopular();
        double top = popular.isEmpty() ? 1.0 : Math.max(1L, popular.get(0).frequency);

        List<Recommendation> out = new ArrayList<>(LIMIT);
        for (RankedItem r : popular) {
            if (out.size() == LIMIT) break;
            if (inCart.contains(r.item) || filter.isBlacklisted(r.item)) continue;
            out.add(new Recommendation(r.item, r.frequency / top, out.size() + 1, Recommendation.Source.FALLBACK));
        }
        return out;
    }
}
