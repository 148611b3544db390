package com.example.foodscan.service.label;

import java.util.List;

/**
 * Header tokens, lower-case, that open a label section. Other-section headers double as the name
 * the section is stored under.
 */
public record SectionHeaders(List<String> ingredients, List<String> allergens, List<String> other) {

    public static final List<String> DEFAULT_INGREDIENTS = List.of(
            "ingredients", "ingredient", "ingrédients", "ingredientes",
            "ingredienti", "zutaten", "成分", "材料", "ingrediënten");

    public static final List<String> DEFAULT_ALLERGENS = List.of(
            "allergen", "allergens", "allergen information", "allergen info",
            "contains", "may contain", "contains:", "may contain:",
            "allergène", "allergènes", "alérgenos", "allergeni",
            "allergene", "アレルゲン", "过敏原", "allergenen");

    public static final List<String> DEFAULT_OTHER = List.of(
            "storage instructions", "storage", "directions", "preparation", "best before",
            "manufactured by", "packed by", "distributed by", "imported by");

    public SectionHeaders {
        ingredients = ingredients == null || ingredients.isEmpty() ? DEFAULT_INGREDIENTS : List.copyOf(ingredients);
        allergens = allergens == null || allergens.isEmpty() ? DEFAULT_ALLERGENS : List.copyOf(allergens);
        other = other == null ? DEFAULT_OTHER : List.copyOf(other);
    }

    public static SectionHeaders defaults() {
        return new SectionHeaders(null, null, null);
    }
}
