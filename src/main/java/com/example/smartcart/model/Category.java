package com.example.smartcart.model;

import java.util.Locale;

public enum Category {
    MAIN, SIDE, DRINK, DIP, DESSERT, OTHER;

    /** Lowercase label used in CSV output and the JSON bundle. */
    public String label() { return name().toLowerCase(Locale.ROOT); }

    public static Category fromLabel(String label) {
        if (label == null) return OTHER;
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return OTHER;
        }
    }
}
