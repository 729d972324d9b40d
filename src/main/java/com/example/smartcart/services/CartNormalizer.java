package com.example.smartcart.services;

import com.example.smartcart.model.Catalog;
import com.example.smartcart.model.Item;

import java.util.*;

/** Resolves user-typed item names to catalog items, case-insensitively and through optional aliases. */
public class CartNormalizer {
    private final Catalog catalog;
    private final Map<String, String> aliasToCanonical = new HashMap<>();

    public CartNormalizer(Catalog catalog) { this(catalog, Map.of()); }

    /**
     * @param aliases canonical item name -> alternative spellings
     */
    public CartNormalizer(Catalog catalog, Map<String, List<String>> aliases) {
        this.catalog = catalog;
        if (aliases == null) return;
        for (var e : aliases.entrySet()) {
            String canon = Catalog.key(e.getKey());
            if (e.getValue() == null) continue;
            for (String a : e.getValue()) aliasToCanonical.put(Catalog.key(a), canon);
        }
    }

    public Optional<Item> resolve(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        Optional<Item> direct = catalog.find(name);
        if (direct.isPresent()) return direct;
        String canon = aliasToCanonical.get(Catalog.key(name));
        return canon == null ? Optional.empty() : catalog.find(canon);
    }

    /** Known items in input order, duplicates and unknown names dropped. */
    public List<Item> normalize(List<String> names) {
        if (names == null) return List.of();
        LinkedHashSet<Item> out = new LinkedHashSet<>();
        for (String n : names) resolve(n).ifPresent(out::add);
        return new ArrayList<>(out);
    }
}
