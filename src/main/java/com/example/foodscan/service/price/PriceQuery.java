package com.example.foodscan.service.price;

import com.example.foodscan.model.ProductInfo;
import com.example.foodscan.model.Weight;

import java.util.Optional;

/**
 * Search terms for a price lookup: the product name followed by its weight, e.g.
 * {@code "Crispy Potato Chips 150g"}.
 */
public record PriceQuery(String productName, String weight) {

    /**
     * @param fallbackGrams weight entered by the user, used when none was read from the pack
     * @return empty when neither a name nor a weight is known
     */
    public static Optional<PriceQuery> from(ProductInfo info, Integer fallbackGrams) {
        String name = info == null ? null : info.name();
        Weight weight = info == null ? null : info.weight();
        String weightText = weight != null ? weight.toString()
                : fallbackGrams != null ? fallbackGrams + "g" : null;
        if ((name == null || name.isBlank()) && weightText == null) {
            return Optional.empty();
        }
        return Optional.of(new PriceQuery(name, weightText));
    }

    public String text() {
        StringBuilder text = new StringBuilder();
        if (productName != null) {
            text.append(productName);
        }
        if (weight != null) {
            text.append(' ').append(weight);
        }
        return text.toString().trim();
    }
}
