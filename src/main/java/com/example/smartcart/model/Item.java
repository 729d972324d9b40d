package com.example.smartcart.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/** A catalog entry. Identity is the lowercased name. */
public final class Item {
    public final String name;
    public final Category category;
    public final Set<Attribute> attributes;
    public final int index; // first-seen position in the catalog

    public Item(String name, Category category, Set<Attribute> attributes, int index) {
        this.name = Objects.requireNonNull(name, "name");
        this.category = category == null ? Category.OTHER : category;
        this.attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(attributes));
        this.index = index;
    }

    public boolean has(Attribute a) { return attributes.contains(a); }

    public String key() { return Catalog.key(name); }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item)) return false;
        return key().equals(((Item) o).key());
    }

    @Override public int hashCode() { return key().hashCode(); }

    @Override public String toString() { return name + " [" + category.label() + "]"; }
}
