package com.example.smartcart;

import com.example.smartcart.model.*;
import com.example.smartcart.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

public class CoOccurrenceBuilderTests {
    private static final List<List<String>> WINGS_ORDERS = List.of(
            List.of("Wings", "Fries"),
            List.of("Wings", "Ranch"),
            List.of("Wings", "Fries", "Ranch"));

    private static CoOccurrenceBuilder.Result build(List<List<String>> orders, int parallelism, OrderSampler sampler) {
        Catalog catalog = new ItemTagger().tag(orders);
        return new CoOccurrenceBuilder(parallelism).build(orders, catalog, sampler);
    }

    @Test
    void affinity_is_share_of_source_orders() {
        CoOccurrenceBuilder.Result r = build(WINGS_ORDERS, 1, new OrderSampler(3, OrderSampler.Strategy.UNIFORM, 42L));
        AffinityMatrix m = r.matrix;
        assertEquals(2.0 / 3.0, m.affinity("wings", "fries"), 1e-9);
        assertEquals(2.0 / 3.0, m.affinity("wings", "ranch"), 1e-9);
        assertEquals(1.0, m.affinity("fries", "wings"), 1e-9);
        assertEquals(0.5, m.affinity("fries", "ranch"), 1e-9);
        assertEquals(0.0, m.affinity("fries", "pizza"), 1e-9);
        assertEquals(3, r.inputOrders);
        assertEquals(3, r.sampledOrders);
    }

    @Test
    void repeated_item_in_one_order_counts_once_and_never_pairs_with_itself() {
        CoOccurrenceBuilder.Result r = build(List.of(List.of("Wings", "Wings", "Fries")), 1, OrderSampler.all());
        assertEquals(1.0, r.matrix.affinity("wings", "fries"), 1e-9);
        assertEquals(0.0, r.matrix.affinity("wings", "wings"), 1e-9);
        for (var row : r.matrix.rows().entrySet()) assertFalse(row.getValue().containsKey(row.getKey()));
        assertEquals(1, r.counts.total(0));
    }

    @Test
    void pair_counts_never_exceed_item_totals() {
        List<List<String>> orders = syntheticOrders(300, 11L);
        CoOccurrenceBuilder.Result r = build(orders, 1, OrderSampler.all());
        Catalog catalog = new ItemTagger().tag(orders);
        for (Item a : catalog.items()) {
            for (Item b : catalog.items()) {
                if (a.index == b.index) continue;
                long together = r.counts.pairCount(a.index, b.index);
                assertTrue(together <= r.counts.total(a.index), a + " / " + b);
                double v = r.matrix.affinity(a, b);
                assertTrue(v >= 0.0 && v <= 1.0);
            }
        }
    }

    @Test
    void building_twice_gives_the_same_matrix() {
        List<List<String>> orders = syntheticOrders(200, 3L);
        assertEquals(build(orders, 1, OrderSampler.all()).matrix, build(orders, 1, OrderSampler.all()).matrix);
    }

    @Test
    void parallel_build_matches_single_threaded_build() {
        List<List<String>> orders = syntheticOrders(500, 5L);
        AffinityMatrix single = build(orders, 1, OrderSampler.all()).matrix;
        AffinityMatrix parallel = build(orders, 4, OrderSampler.all()).matrix;
        assertEquals(single, parallel);
        assertEquals(new ArrayList<>(single.rows().keySet()), new ArrayList<>(parallel.rows().keySet()));
    }

    @Test
    void empty_and_unknown_orders_are_skipped() {
        List<List<String>> orders = new ArrayList<>();
        orders.add(List.of());
        orders.add(List.of("Wings", "Fries"));
        CoOccurrenceBuilder.Result r = build(orders, 2, OrderSampler.all());
        assertEquals(1, r.counts.orders());
        assertEquals(2, r.matrix.pairCount());
    }

    @Test
    void parallelism_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new CoOccurrenceBuilder(0));
    }

    @Test
    void pair_keys_are_symmetric() {
        assertEquals(PairCounts.pairKey(3, 9), PairCounts.pairKey(9, 3));
        long k = PairCounts.pairKey(9, 3);
        assertEquals(3, PairCounts.first(k));
        assertEquals(9, PairCounts.second(k));
    }

    @Test
    void merged_shards_add_up() {
        PairCounts a = new PairCounts();
        a.addOrder(new int[]{0, 1});
        PairCounts b = new PairCounts();
        b.addOrder(new int[]{0, 1, 2});
        a.merge(b);
        assertEquals(2, a.pairCount(1, 0));
        assertEquals(1, a.pairCount(0, 2));
        assertEquals(2, a.total(0));
        assertEquals(2, a.orders());
    }

    @Test
    void first_n_sampling_keeps_the_head() {
        OrderSampler s = new OrderSampler(2, OrderSampler.Strategy.FIRST_N, 0L);
        assertEquals(List.of("a", "b"), s.sample(List.of("a", "b", "c", "d")));
    }

    @Test
    void uniform_sampling_is_bounded_and_reproducible() {
        List<Integer> input = new ArrayList<>();
        for (int i = 0; i < 1000; i++) input.add(i);
        List<Integer> first = new OrderSampler(50, OrderSampler.Strategy.UNIFORM, 42L).sample(input);
        List<Integer> second = new OrderSampler(50, OrderSampler.Strategy.UNIFORM, 42L).sample(input);
        assertEquals(50, first.size());
        assertEquals(first, second);
        assertEquals(50, new HashSet<>(first).size());
        // picks keep their input order
        List<Integer> sorted = new ArrayList<>(first);
        Collections.sort(sorted);
        assertEquals(sorted, first);
    }

    @Test
    void sample_limit_edges() {
        List<String> input = List.of("a", "b");
        assertEquals(input, new OrderSampler(10, OrderSampler.Strategy.UNIFORM, 1L).sample(input));
        assertTrue(new OrderSampler(0, OrderSampler.Strategy.UNIFORM, 1L).sample(input).isEmpty());
        assertEquals(input, OrderSampler.all().sample(input));
        assertThrows(IllegalArgumentException.class, () -> new OrderSampler(-1, OrderSampler.Strategy.UNIFORM, 1L));
    }

    @Test
    void huge_sample_bound_keeps_every_order() {
        List<String> input = List.of("a", "b");
        assertEquals(input, new OrderSampler(Integer.MAX_VALUE - 8, OrderSampler.Strategy.UNIFORM, 42L).sample(input));
        assertEquals(input, new OrderSampler(Integer.MAX_VALUE, OrderSampler.Strategy.FIRST_N, 42L).sample(input));
    }

    @Test
    void sampled_build_only_counts_sampled_orders() {
        List<List<String>> orders = syntheticOrders(100, 9L);
        CoOccurrenceBuilder.Result r = build(orders, 1, new OrderSampler(10, OrderSampler.Strategy.UNIFORM, 42L));
        assertEquals(100, r.inputOrders);
        assertEquals(10, r.sampledOrders);
        assertEquals(10, r.counts.orders());
    }

    static List<List<String>> syntheticOrders(int n, long seed) {
        List<String> menu = List.of("Wings", "Boneless Wings", "Regular Fries", "Cajun Fries", "Ranch Dip",
                "Blue Cheese Dip", "Sweet Tea", "Lemonade", "Brownie", "Veggie Sticks", "Chicken Sandwich");
        Random rnd = new Random(seed);
        List<List<String>> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int size = 1 + rnd.nextInt(4);
            List<String> order = new ArrayList<>(size);
            for (int j = 0; j < size; j++) order.add(menu.get(rnd.nextInt(menu.size())));
            out.add(order);
        }
        return out;
    }
}
