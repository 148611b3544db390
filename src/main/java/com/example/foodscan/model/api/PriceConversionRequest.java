package com.example.foodscan.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record PriceConversionRequest(
        @Schema(description = "Price including its currency symbol", example = "₫50000", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String price,
        @Schema(description = "Pack weight in grams for the per-kilogram price", example = "500")
        @Positive
        Integer weightInGrams) {
}
