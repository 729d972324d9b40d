package com.example.smartcart.services;

import com.example.smartcart.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Ranks up to three add-ons for a cart:
 * <ol>
 *   <li>base score = affinity from the cart items, summed or averaged</li>
 *   <li>cart items and blacklisted items are never candidates</li>
 *   <li>categories missing from the cart get a soft bias</li>
 *   <li>open slots are filled from the per-category popularity lists</li>
 * </ol>
 * Stateless apart from its settings, so one instance can serve concurrent requests.
 */
public class RecommendationScorer implements Recommender {
    private static final Logger log = LoggerFactory.getLogger(RecommendationScorer.class);

    public enum Aggregation { SUM, MEAN }

    public static final double DEFAULT_CATEGORY_BIAS = 0.15;
    public static final double DEFAULT_ATTRIBUTE_BONUS = 0.05;
    public static final List<String> DEFAULT_BLACKLIST = List.of(
            "bag", "bags", "utensils", "no utensils", "napkins", "plates", "extra plates", "straw", "straws",
            "delivery fee", "service fee", "online order fee", "tip", "gift card", "special instructions");

    static final List<Category> FALLBACK_ORDER = List.of(
            Category.MAIN, Category.SIDE, Category.DRINK, Category.DIP, Category.DESSERT, Category.OTHER);

    private final Aggregation aggregation;
    private final double categoryBias;
    private final double attributeBonus;
    private final Set<String> blacklist = new HashSet<>();

    public RecommendationScorer(Aggregation aggregation, double categoryBias, double attributeBonus, Collection<String> blacklist) {
        if (categoryBias < 0 || attributeBonus < 0) throw new IllegalArgumentException("Bias values must be >= 0");
        this.aggregation = aggregation == null ? Aggregation.SUM : aggregation;
        this.categoryBias = categoryBias;
        this.attributeBonus = attributeBonus;
        if (blacklist != null) for (String b : blacklist) this.blacklist.add(Catalog.key(b));
    }

    public static RecommendationScorer defaults() {
        return new RecommendationScorer(Aggregation.SUM, DEFAULT_CATEGORY_BIAS, DEFAULT_ATTRIBUTE_BONUS, DEFAULT_BLACKLIST);
    }

    public boolean isBlacklisted(Item item) { return blacklist.contains(item.key()); }

    @Override
    public List<Recommendation> recommend(List<Item> cart, MenuSnapshot snapshot) {
        if (cart == null || cart.isEmpty()) return List.of();

        List<ScoreBreakdown> scored = explain(cart, snapshot);
        List<Item> picks = new ArrayList<>(LIMIT);
        List<Double> scores = new ArrayList<>(LIMIT);
        for (ScoreBreakdown s : scored) {
            if (picks.size() == LIMIT) break;
            picks.add(s.candidate);
            scores.add(s.total);
        }
        int fromAffinity = picks.size();
        if (fromAffinity < LIMIT) fillFromPopular(cart, picks, snapshot.catalog);

        List<Recommendation> out = new ArrayList<>(picks.size());
        for (int i = 0; i < picks.size(); i++) {
            boolean affinity = i < fromAffinity;
            out.add(new Recommendation(picks.get(i), affinity ? scores.get(i) : 0.0, i + 1,
                    affinity ? Recommendation.Source.AFFINITY : Recommendation.Source.FALLBACK));
        }
        if (log.isDebugEnabled()) log.debug("Cart {} -> {} ({} from fallback)", cart, out, out.size() - fromAffinity);
        return out;
    }

    /**
     * Every candidate with positive combined affinity to the cart, best first.
     */
    public List<ScoreBreakdown> explain(List<Item> cart, MenuSnapshot snapshot) {
        if (cart == null || cart.isEmpty()) return List.of();
        Catalog catalog = snapshot.catalog;
        Set<String> inCart = new HashSet<>();
        EnumSet<Category> cartCategories = EnumSet.noneOf(Category.class);
        boolean allVegetarian = true;
        for (Item it : cart) {
            inCart.add(it.key());
            cartCategories.add(it.category);
            allVegetarian &= it.has(Attribute.VEGETARIAN);
        }

        // 1) Base: only observed pairs can be non-zero, so walk the sparse rows
        Map<String, Double> base = new HashMap<>();
        for (Item it : cart) {
            for (var e : snapshot.affinities.row(it.key()).entrySet()) base.merge(e.getKey(), e.getValue(), Double::sum);
        }

        List<ScoreBreakdown> out = new ArrayList<>();
        for (var e : base.entrySet()) {
            Item candidate = catalog.get(e.getKey());
            // 2) Filters
            if (candidate == null || inCart.contains(e.getKey()) || isBlacklisted(candidate)) continue;
            double b = aggregation == Aggregation.MEAN ? e.getValue() / cart.size() : e.getValue();
            if (b <= 0.0) continue;

            ScoreBreakdown s = new ScoreBreakdown(candidate, catalog.frequency(candidate));
            s.base = b;
            // 3) Soft bias toward categories the cart lacks
            if (!cartCategories.contains(candidate.category)) s.categoryBias = categoryBias;
            if (allVegetarian && candidate.has(Attribute.VEGETARIAN)) s.attributeBonus = attributeBonus;
            s.total = s.base + s.categoryBias + s.attributeBonus;
            out.add(s);
        }
        out.sort(ORDER);
        return out;
    }

    static final Comparator<ScoreBreakdown> ORDER = Comparator
            .comparingDouble((ScoreBreakdown s) -> s.total).reversed()
            .thenComparing(Comparator.comparingLong((ScoreBreakdown s) -> s.popularity).reversed())
            .thenComparingInt(s -> s.candidate.index);

    /**
     * Fills open slots with popular items. First one item from each category
     * that neither the cart nor the picks cover, then one from each category the
     * picks lack, then round-robin over all categories.
     */
    void fillFromPopular(List<Item> cart, List<Item> picks, Catalog catalog) {
        Set<Item> taken = new HashSet<>(cart);
        taken.addAll(picks);
        EnumSet<Category> cartCategories = EnumSet.noneOf(Category.class);
        for (Item it : cart) cartCategories.add(it.category);

        for (int pass = 0; pass < 3 && picks.size() < LIMIT; pass++) {
            boolean progress = true;
            while (progress && picks.size() < LIMIT) {
                progress = false;
                for (Category c : FALLBACK_ORDER) {
                    if (picks.size() == LIMIT) break;
                    if (pass == 0 && (cartCategories.contains(c) || covers(picks, c))) continue;
                    if (pass == 1 && covers(picks, c)) continue;
                    Item next = mostPopularEligible(catalog, c, taken);
                    if (next == null) continue;
                    picks.add(next);
                    taken.add(next);
                    progress = true;
                }
                if (pass < 2) break;
            }
        }
    }

    private Item mostPopularEligible(Catalog catalog, Category c, Set<Item> taken) {
        for (RankedItem r : catalog.topByCategory(c)) {
            if (!taken.contains(r.item) && !isBlacklisted(r.item)) return r.item;
        }
        return null;
    }

    private static boolean covers(List<Item> picks, Category c) {
        for (Item it : picks) if (it.category == c) return true;
        return false;
    }
}
