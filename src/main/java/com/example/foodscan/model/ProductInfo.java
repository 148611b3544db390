package com.example.foodscan.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Product facts recovered from the front of the pack")
public record ProductInfo(
        @Schema(description = "Product name taken from the topmost lines", example = "Crispy Potato Chips") String name,
        @Schema(description = "Declared weight, when printed") Weight weight) {

    private static final ProductInfo EMPTY = new ProductInfo(null, null);

    public static ProductInfo empty() {
        return EMPTY;
    }
}
