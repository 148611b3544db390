package com.example.foodscan.model;

import java.util.Locale;

public enum WeightUnit {
    G("g"),
    KG("kg"),
    ML("ml");

    private final String symbol;

    WeightUnit(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Resolves a unit as printed on a pack ({@code g}, {@code grams}, {@code KG}, {@code kilogram}, ...).
     */
    public static WeightUnit fromLabel(String label) {
        String lower = label.toLowerCase(Locale.ROOT);
        if (lower.startsWith("kilogram") || lower.equals("kg")) {
            return KG;
        }
        if (lower.startsWith("gram") || lower.equals("g")) {
            return G;
        }
        if (lower.equals("ml")) {
            return ML;
        }
        throw new IllegalArgumentException("Unsupported weight unit: " + label);
    }
}
