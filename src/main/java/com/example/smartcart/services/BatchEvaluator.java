package com.example.smartcart.services;

import com.example.smartcart.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs a recommender over labeled rows and scores the results. A row whose
 * cart normalizes to nothing gets no recommendations and therefore zero
 * credit; it is never allowed to stop the batch.
 */
public class BatchEvaluator {
    private static final Logger log = LoggerFactory.getLogger(BatchEvaluator.class);

    private final CartNormalizer normalizer;
    private final int cartLimit;

    public BatchEvaluator(CartNormalizer normalizer) { this(normalizer, Recommender.LIMIT); }

    public BatchEvaluator(CartNormalizer normalizer, int cartLimit) {
        this.normalizer = normalizer;
        this.cartLimit = cartLimit;
    }

    public EvaluationReport evaluate(List<TestRow> rows, MenuSnapshot snapshot, Recommender recommender) {
        return evaluate(rows, snapshot, recommender, null);
    }

    /**
     * @param baseline optional second recommender scored on the same rows for comparison
     */
    public EvaluationReport evaluate(List<TestRow> rows, MenuSnapshot snapshot, Recommender recommender, Recommender baseline) {
        List<EvaluationRow> results = new ArrayList<>(rows.size());
        List<EvaluationRow> baselineResults = new ArrayList<>();
        int emptyCarts = 0;
        for (TestRow row : rows) {
            List<Item> cart = cart(row);
            if (cart.isEmpty()) emptyCarts++;
            List<String> truth = truth(row);
            results.add(score(row.id, cart, recommender.recommend(cart, snapshot), truth));
            if (baseline != null) baselineResults.add(score(row.id, cart, baseline.recommend(cart, snapshot), truth));
        }
        if (emptyCarts > 0) log.warn("{} of {} rows had no known cart items and scored zero", emptyCarts, rows.size());

        EvaluationReport.Metrics metrics = metrics(results);
        EvaluationReport.Metrics baseMetrics = baseline == null ? null : metrics(baselineResults);
        log.info("Evaluated {} rows: {}", rows.size(), metrics);
        if (baseMetrics != null) log.info("Baseline: {}", baseMetrics);
        return new EvaluationReport(results, metrics, baseMetrics);
    }

    List<Item> cart(TestRow row) {
        List<String> names = row.cart.size() > cartLimit ? row.cart.subList(0, cartLimit) : row.cart;
        return normalizer.normalize(names);
    }

    /** Ground truth in catalog spelling where known; unknown names stay as typed. */
    List<String> truth(TestRow row) {
        LinkedHashMap<String, String> byKey = new LinkedHashMap<>();
        for (String t : row.groundTruth) {
            if (t == null || t.isBlank()) continue;
            String name = normalizer.resolve(t).map(i -> i.name).orElse(t.trim());
            byKey.putIfAbsent(Catalog.key(name), name);
        }
        return new ArrayList<>(byKey.values());
    }

    static EvaluationRow score(String id, List<Item> cart, List<Recommendation> recs, List<String> truth) {
        Set<String> recommended = new HashSet<>();
        for (Recommendation r : recs) recommended.add(r.item.key());
        Set<String> truthKeys = new HashSet<>();
        for (String t : truth) truthKeys.add(Catalog.key(t));

        List<Boolean> hits = new ArrayList<>(truth.size());
        int found = 0;
        for (String t : truth) {
            boolean hit = recommended.contains(Catalog.key(t));
            hits.add(hit);
            if (hit) found++;
        }
        int correctSlots = 0;
        for (Recommendation r : recs) if (truthKeys.contains(r.item.key())) correctSlots++;

        double recall = truth.isEmpty() ? 0.0 : (double) found / truth.size();
        double precision = (double) correctSlots / Recommender.LIMIT;
        boolean top1 = !recs.isEmpty() && truthKeys.contains(recs.get(0).item.key());
        return new EvaluationRow(id, cart, recs, truth, hits, recall, precision, top1);
    }

    static EvaluationReport.Metrics metrics(List<EvaluationRow> rows) {
        double recall = 0, precision = 0, top1 = 0;
        int n = 0;
        for (EvaluationRow r : rows) {
            if (!r.hasGroundTruth()) continue;
            recall += r.recall;
            precision += r.precision;
            if (r.top1) top1++;
            n++;
        }
        if (n == 0) return new EvaluationReport.Metrics(0, 0, 0, 0);
        return new EvaluationReport.Metrics(recall / n, precision / n, top1 / n, n);
    }
}
