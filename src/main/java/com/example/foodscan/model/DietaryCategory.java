package com.example.foodscan.model;

public enum DietaryCategory {
    VEGAN("Vegan"),
    VEGETARIAN("Vegetarian"),
    NON_VEGETARIAN("Non-Vegetarian"),
    POSSIBLY_NON_VEGETARIAN("Possibly Non-Vegetarian");

    private final String label;

    DietaryCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
