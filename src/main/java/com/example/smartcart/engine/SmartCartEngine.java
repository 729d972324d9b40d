package com.example.smartcart.engine;

import com.example.smartcart.model.*;
import com.example.smartcart.services.*;
import com.example.smartcart.storage.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Entry point for callers: builds a {@link MenuSnapshot} from raw orders and
 * answers recommendation and evaluation requests against it. The snapshot is
 * passed in explicitly; the engine keeps no per-dataset state.
 */
public class SmartCartEngine {
    private static final Logger log = LoggerFactory.getLogger(SmartCartEngine.class);

    private final EngineSettings settings;
    private final OrderParser parser = new OrderParser();
    private final ItemTagger tagger;
    private final CoOccurrenceBuilder builder;
    private final RecommendationScorer scorer;
    private final Clock clock;

    public SmartCartEngine(EngineSettings settings) { this(settings, Clock.systemUTC()); }

    public SmartCartEngine(EngineSettings settings, Clock clock) {
        this.settings = settings == null ? new EngineSettings() : settings;
        this.tagger = new ItemTagger(this.settings.itemRules());
        this.builder = new CoOccurrenceBuilder(this.settings.parallelism);
        this.scorer = this.settings.scorer();
        this.clock = clock;
    }

    public EngineSettings settings() { return settings; }

    public RecommendationScorer scorer() { return scorer; }

    /**
     * @param rawOrders one raw order cell per order
     * @param source    name of the dataset, used in the snapshot key
     */
    public MenuSnapshot build(List<String> rawOrders, String source) {
        List<List<String>> orders = new ArrayList<>(rawOrders.size());
        int empty = 0;
        for (String raw : rawOrders) {
            List<String> items = parser.parse(raw);
            if (items.isEmpty()) empty++;
            orders.add(items);
        }
        if (empty > 0) log.warn("{} of {} orders had no readable items", empty, rawOrders.size());
        return buildFromItems(orders, source);
    }

    /** Same as {@link #build} for orders that are already item lists. */
    public MenuSnapshot buildFromItems(List<List<String>> orders, String source) {
        Catalog catalog = tagger.tag(orders);
        CoOccurrenceBuilder.Result result = builder.build(orders, catalog, settings.sampler());
        String key = (source == null ? "orders" : source) + "#" + orders.size() + "[" + settings.buildFingerprint() + "]";
        MenuSnapshot snapshot = new MenuSnapshot(key, Instant.now(clock), result.inputOrders, result.sampledOrders,
                catalog, result.matrix);
        log.info("Built {}", snapshot);
        return snapshot;
    }

    public CartNormalizer normalizer(MenuSnapshot snapshot) { return settings.normalizer(snapshot.catalog); }

    /**
     * Interactive request: free-form item names in, ranked recommendations out.
     * Only the first three names are used. Unknown names are ignored; if none
     * is known the result is empty.
     */
    public List<Recommendation> recommend(MenuSnapshot snapshot, List<String> selected) {
        return scorer.recommend(cart(snapshot, selected), snapshot);
    }

    public List<ScoreBreakdown> explain(MenuSnapshot snapshot, List<String> selected) {
        return scorer.explain(cart(snapshot, selected), snapshot);
    }

    public List<Item> cart(MenuSnapshot snapshot, List<String> selected) {
        if (selected == null) return List.of();
        List<String> names = selected;
        if (names.size() > Recommender.LIMIT) {
            log.warn("Cart has {} items, only the first {} are used", names.size(), Recommender.LIMIT);
            names = names.subList(0, Recommender.LIMIT);
        }
        return normalizer(snapshot).normalize(names);
    }

    public EvaluationReport evaluate(MenuSnapshot snapshot, List<TestRow> rows, boolean withBaseline) {
        BatchEvaluator evaluator = new BatchEvaluator(normalizer(snapshot));
        return evaluator.evaluate(rows, snapshot, scorer, withBaseline ? new PopularityBaseline(scorer) : null);
    }
}
