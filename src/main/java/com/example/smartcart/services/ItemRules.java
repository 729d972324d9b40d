package com.example.smartcart.services;

import com.example.smartcart.model.Attribute;
import com.example.smartcart.model.Category;

import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Keyword rules that classify a menu item by its name. Category rules are
 * evaluated in list order and the first match wins; attribute rules are all
 * evaluated. Names are matched on whole lowercase words, plurals included.
 */
public class ItemRules {

    /** A lowercased, word-padded form of an item name: " cajun fried corn ". */
    public static final class Name {
        public final String raw;
        public final String padded;
        final String[] words;

        Name(String raw) {
            this.raw = raw == null ? "" : raw;
            String norm = NON_WORD.matcher(this.raw.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
            this.words = norm.isEmpty() ? new String[0] : norm.split(" ");
            this.padded = " " + norm + " ";
        }

        public boolean hasAny(Collection<String> keywords) {
            for (String k : keywords) {
                if (padded.contains(" " + k + " ") || padded.contains(" " + k + "s ") || padded.contains(" " + k + "es ")) return true;
            }
            return false;
        }

        public String lastWord() { return words.length == 0 ? "" : words[words.length - 1]; }
    }

    public static final class CategoryRule {
        public final String label;
        public final Predicate<Name> when;
        public final Category category;
        public CategoryRule(String label, Predicate<Name> when, Category category) {
            this.label = label; this.when = when; this.category = category;
        }
    }

    public static final class AttributeRule {
        public final Predicate<Name> when;
        public final Attribute attribute;
        public AttributeRule(Predicate<Name> when, Attribute attribute) { this.when = when; this.attribute = attribute; }
    }

    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WITH_JOIN = Pattern.compile("\\w\\s+(with|w/)\\s+\\w");

    static final Set<String> DESSERT = set("cake", "brownie", "cookie", "dessert", "ice cream", "pie", "sundae", "churro",
            "cheesecake", "cobbler", "donut", "doughnut");
    static final Set<String> DRINK = set("drink", "soda", "cola", "coke", "sprite", "pepsi", "tea", "lemonade", "water",
            "juice", "shake", "coffee", "fountain", "beverage", "dr pepper", "bottle", "fanta", "mountain dew");
    static final Set<String> DIP_SUFFIX = set("dip", "dips", "sauce", "sauces", "dressing");
    static final Set<String> MAIN = set("wing", "boneless", "tender", "strip", "burger", "sandwich", "wrap", "chicken",
            "combo", "meal", "pizza", "platter", "bundle", "thigh", "drumstick", "nugget");
    static final Set<String> SIDE = set("fries", "fry", "corn", "coleslaw", "slaw", "onion ring", "mac", "cheese curd",
            "potato", "salad", "chips", "bread", "roll", "rice", "beans", "veggie stick", "tots", "okra", "pickle");
    static final Set<String> DIP = set("ranch", "blue cheese", "bleu cheese", "honey mustard", "queso", "gravy", "aioli",
            "ketchup", "marinara");

    static final Set<String> VEGETARIAN = set("veg", "veggie", "vegetarian", "vegan", "paneer", "tofu", "plant");
    static final Set<String> SPICY = set("spicy", "hot", "cajun", "buffalo", "jalapeno", "habanero", "nashville", "fire",
            "atomic", "ghost", "chili", "chilli");
    static final Set<String> COMBO = set("combo", "meal", "bundle", "pack", "family", "platter", "box");

    private final List<CategoryRule> categoryRules;
    private final List<AttributeRule> attributeRules;
    private final Map<String, Category> overrides;

    public ItemRules(List<CategoryRule> categoryRules, List<AttributeRule> attributeRules, Map<String, Category> overrides) {
        this.categoryRules = List.copyOf(categoryRules);
        this.attributeRules = List.copyOf(attributeRules);
        Map<String, Category> o = new HashMap<>();
        if (overrides != null) overrides.forEach((k, v) -> o.put(k.trim().toLowerCase(Locale.ROOT), v));
        this.overrides = o;
    }

    public static ItemRules defaults() { return withOverrides(Map.of()); }

    /** Default rules, with explicit per-item categories taking precedence over keywords. */
    public static ItemRules withOverrides(Map<String, Category> overrides) {
        return new ItemRules(defaultCategoryRules(), defaultAttributeRules(), overrides);
    }

    public static List<CategoryRule> defaultCategoryRules() {
        return List.of(
                new CategoryRule("dessert keyword", n -> n.hasAny(DESSERT), Category.DESSERT),
                new CategoryRule("drink keyword", n -> n.hasAny(DRINK), Category.DRINK),
                new CategoryRule("dip suffix", n -> DIP_SUFFIX.contains(n.lastWord()), Category.DIP),
                new CategoryRule("main keyword", n -> n.hasAny(MAIN), Category.MAIN),
                new CategoryRule("side keyword", n -> n.hasAny(SIDE), Category.SIDE),
                new CategoryRule("dip keyword", n -> n.hasAny(DIP), Category.DIP)
        );
    }

    public static List<AttributeRule> defaultAttributeRules() {
        return List.of(
                new AttributeRule(n -> n.hasAny(VEGETARIAN), Attribute.VEGETARIAN),
                new AttributeRule(n -> n.hasAny(SPICY), Attribute.SPICY),
                new AttributeRule(n -> n.hasAny(COMBO) || n.raw.contains("+")
                        || WITH_JOIN.matcher(n.raw.toLowerCase(Locale.ROOT)).find(), Attribute.COMBO)
        );
    }

    public Category categorize(String itemName) {
        Category forced = overrides.get(itemName == null ? "" : itemName.trim().toLowerCase(Locale.ROOT));
        if (forced != null) return forced;
        Name n = new Name(itemName);
        for (CategoryRule r : categoryRules) if (r.when.test(n)) return r.category;
        return Category.OTHER;
    }

    public Set<Attribute> attributes(String itemName) {
        Name n = new Name(itemName);
        EnumSet<Attribute> out = EnumSet.noneOf(Attribute.class);
        for (AttributeRule r : attributeRules) if (r.when.test(n)) out.add(r.attribute);
        return out;
    }

    private static Set<String> set(String... s) { return new LinkedHashSet<>(Arrays.asList(s)); }
}
