package com.example.foodscan.service.classification;

import java.util.List;
import java.util.Locale;

/**
 * Lower-case keyword sets the classifier searches for. Order matters: evidence is reported in
 * list order.
 */
public record DietaryKeywords(
        List<String> nonVeg,
        List<String> veganSafe,
        List<String> dairy,
        List<String> egg,
        List<String> commonPlant) {

    public static final List<String> DEFAULT_NON_VEG = List.of(
            "beef", "pork", "chicken", "fish", "shrimp", "prawn", "squid", "anchovy",
            "gelatin", "lard", "oyster sauce", "meat", "poultry", "seafood", "bacon",
            "ham", "sausage", "turkey", "duck", "lamb", "mutton", "crab", "lobster",
            "mussel", "clam", "scallop", "octopus", "tuna", "salmon", "cod", "mackerel",
            "rennet", "carmine", "cochineal", "shellfish", "anchovies");

    public static final List<String> DEFAULT_VEGAN_SAFE = List.of(
            "soy", "tofu", "lentils", "vegetables", "grains", "rice", "wheat", "oats",
            "quinoa", "beans", "chickpeas", "peas", "carrots", "potatoes", "tomatoes",
            "spinach", "broccoli", "cabbage", "onions", "garlic", "ginger", "coconut",
            "almond", "cashew", "peanut", "walnut", "sunflower", "sesame", "flax",
            "chia", "hemp", "plant-based", "vegan", "dairy-free", "egg-free");

    public static final List<String> DEFAULT_DAIRY = List.of(
            "milk", "cheese", "butter", "cream", "yogurt", "yoghurt", "whey", "casein",
            "lactose", "ghee", "curd", "paneer", "dairy");

    public static final List<String> DEFAULT_EGG = List.of(
            "egg", "eggs", "albumin", "lecithin", "mayonnaise");

    public static final List<String> DEFAULT_COMMON_PLANT = List.of(
            "potato", "potatoes", "corn", "maize", "rice", "wheat", "flour",
            "oil", "vegetable oil", "sunflower oil", "salt", "sugar",
            "spices", "herbs", "onion", "garlic", "tomato", "pepper");

    public DietaryKeywords {
        nonVeg = orDefault(nonVeg, DEFAULT_NON_VEG);
        veganSafe = orDefault(veganSafe, DEFAULT_VEGAN_SAFE);
        dairy = orDefault(dairy, DEFAULT_DAIRY);
        egg = orDefault(egg, DEFAULT_EGG);
        commonPlant = orDefault(commonPlant, DEFAULT_COMMON_PLANT);
    }

    public static DietaryKeywords defaults() {
        return new DietaryKeywords(null, null, null, null, null);
    }

    private static List<String> orDefault(List<String> keywords, List<String> fallback) {
        if (keywords == null || keywords.isEmpty()) {
            return fallback;
        }
        return keywords.stream()
                .map(String::strip)
                .filter(keyword -> !keyword.isEmpty())
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
    }
}
