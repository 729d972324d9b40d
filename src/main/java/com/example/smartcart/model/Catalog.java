package com.example.smartcart.model;

import java.util.*;

/**
 * Distinct items of one dataset snapshot, their occurrence counts and the
 * per-category popularity rankings. Lookups are case-insensitive; the first
 * spelling seen is the canonical one.
 */
public final class Catalog {
    private final List<Item> items;
    private final Map<String, Item> byKey;
    private final Map<String, Long> frequency;
    private final Map<Category, List<RankedItem>> topByCategory;

    /**
     * @param items     items ordered by first-seen index
     * @param frequency occurrence count per item key
     */
    public Catalog(List<Item> items, Map<String, Long> frequency) {
        List<Item> ordered = new ArrayList<>(items);
        ordered.sort(Comparator.comparingInt(i -> i.index));
        Map<String, Item> keys = new LinkedHashMap<>();
        Map<String, Long> freq = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            Item it = ordered.get(i);
            if (it.index != i) {
                throw new IllegalArgumentException("Catalog indices must run 0.." + (ordered.size() - 1) + ", found " + it.index + " for " + it.name);
            }
            if (keys.putIfAbsent(it.key(), it) != null) {
                throw new IllegalArgumentException("Duplicate catalog item: " + it.name);
            }
            freq.put(it.key(), frequency == null ? 0L : frequency.getOrDefault(it.key(), 0L));
        }
        this.items = Collections.unmodifiableList(ordered);
        this.byKey = Collections.unmodifiableMap(keys);
        this.frequency = Collections.unmodifiableMap(freq);
        this.topByCategory = rank(ordered, freq);
    }

    private static Map<Category, List<RankedItem>> rank(List<Item> ordered, Map<String, Long> freq) {
        Map<Category, List<RankedItem>> out = new EnumMap<>(Category.class);
        for (Category c : Category.values()) out.put(c, new ArrayList<>());
        for (Item it : ordered) out.get(it.category).add(new RankedItem(it, freq.get(it.key())));
        // List.sort is stable, so equal counts keep first-seen order
        for (var e : out.entrySet()) {
            e.getValue().sort((a, b) -> Long.compare(b.frequency, a.frequency));
            e.setValue(Collections.unmodifiableList(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    public static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }

    public List<Item> items() { return items; }

    public int size() { return items.size(); }

    public boolean isEmpty() { return items.isEmpty(); }

    public Optional<Item> find(String name) { return Optional.ofNullable(byKey.get(key(name))); }

    public Item get(String name) { return byKey.get(key(name)); }

    public long frequency(Item item) { return frequency.getOrDefault(item.key(), 0L); }

    public List<RankedItem> topByCategory(Category category) { return topByCategory.get(category); }

    public Map<Category, List<RankedItem>> topByCategory() { return topByCategory; }

    /** Items of every category, most frequent first, ties by first-seen index. */
    public List<RankedItem> mostPopular() {
        List<RankedItem> all = new ArrayList<>();
        for (Item it : items) all.add(new RankedItem(it, frequency(it)));
        all.sort((a, b) -> Long.compare(b.frequency, a.frequency));
        return all;
    }
}
