package com.example.smartcart.storage;

import com.example.smartcart.model.Catalog;
import com.example.smartcart.model.Category;
import com.example.smartcart.services.CartNormalizer;
import com.example.smartcart.services.ItemRules;
import com.example.smartcart.services.OrderSampler;
import com.example.smartcart.services.RecommendationScorer;

import java.util.*;

/** Build, scoring and input-format settings. Every field has a usable default. */
public class EngineSettings {
    // building
    public Integer sampleSize;                       // null = use every order
    public OrderSampler.Strategy sampleStrategy = OrderSampler.Strategy.UNIFORM;
    public long seed = 42L;
    public int parallelism = 1;
    public Map<String, Category> categoryOverrides = new LinkedHashMap<>();

    // scoring
    public RecommendationScorer.Aggregation aggregation = RecommendationScorer.Aggregation.SUM;
    public double categoryBias = RecommendationScorer.DEFAULT_CATEGORY_BIAS;
    public double attributeBonus = RecommendationScorer.DEFAULT_ATTRIBUTE_BONUS;
    public List<String> blacklist = new ArrayList<>(RecommendationScorer.DEFAULT_BLACKLIST);
    public Map<String, List<String>> aliases = new LinkedHashMap<>();

    // CSV layout
    public String orderColumn = "ORDERS";
    public List<String> testCartColumns = new ArrayList<>(List.of("item1", "item2", "item3"));
    public List<String> testTruthColumns = new ArrayList<>(List.of("item4"));
    public String testIdColumn = "ORDER_ID";
    public String listDelimiter = "|";

    public OrderSampler sampler() { return new OrderSampler(sampleSize, sampleStrategy, seed); }

    public ItemRules itemRules() { return ItemRules.withOverrides(categoryOverrides); }

    public RecommendationScorer scorer() {
        return new RecommendationScorer(aggregation, categoryBias, attributeBonus, blacklist);
    }

    public CartNormalizer normalizer(Catalog catalog) { return new CartNormalizer(catalog, aliases); }

    /** Identifies the build inputs that change the artifact; part of the snapshot key. */
    public String buildFingerprint() {
        return "sample=" + (sampleSize == null ? "all" : sampleSize) + ",strategy=" + sampleStrategy + ",seed=" + seed
                + ",overrides=" + new TreeMap<>(categoryOverrides);
    }
}
