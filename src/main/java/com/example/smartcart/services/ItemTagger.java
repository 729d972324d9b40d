package com.example.smartcart.services;

import com.example.smartcart.model.Catalog;
import com.example.smartcart.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds the catalog from cleaned orders: one {@link Item} per distinct name
 * (case-insensitive, first spelling wins), tagged by {@link ItemRules}, with
 * every mention counted toward popularity.
 */
public class ItemTagger {
    private static final Logger log = LoggerFactory.getLogger(ItemTagger.class);

    private final ItemRules rules;

    public ItemTagger() { this(ItemRules.defaults()); }

    public ItemTagger(ItemRules rules) { this.rules = rules; }

    public Catalog tag(Iterable<? extends List<String>> orders) {
        Map<String, String> spelling = new LinkedHashMap<>();
        Map<String, Long> counts = new HashMap<>();
        long mentions = 0;

        for (List<String> order : orders) {
            if (order == null) continue;
            for (String name : order) {
                String key = Catalog.key(name);
                if (key.isEmpty()) continue;
                spelling.putIfAbsent(key, name.trim());
                counts.merge(key, 1L, Long::sum);
                mentions++;
            }
        }

        List<Item> items = new ArrayList<>(spelling.size());
        int index = 0;
        for (String name : spelling.values()) {
            items.add(new Item(name, rules.categorize(name), rules.attributes(name), index++));
        }
        Catalog catalog = new Catalog(items, counts);
        log.info("Tagged {} distinct items from {} mentions", catalog.size(), mentions);
        return catalog;
    }

    /** Maps an order's names onto catalog spellings, dropping unknown names. */
    public static List<Item> resolve(Catalog catalog, List<String> order) {
        List<Item> out = new ArrayList<>(order.size());
        for (String name : order) catalog.find(name).ifPresent(out::add);
        return out;
    }
}
