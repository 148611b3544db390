package com.example.foodscan.model.api;

import com.example.foodscan.model.RawFragment;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record FrontOfPackRequest(
        @Schema(description = "Text fragments recognized on the front of the pack", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        List<RawFragment> fragments,
        @Schema(description = "Shelf price when known; otherwise the configured price source is asked", example = "₫45,000")
        String priceText,
        @Schema(description = "Pack weight in grams, used when none is printed on the pack", example = "150")
        @Positive
        Integer weightInGrams) {
}
