package com.example.smartcart.model;

import java.util.Locale;

public enum Attribute {
    VEGETARIAN, SPICY, COMBO;

    public String label() { return name().toLowerCase(Locale.ROOT); }
}
