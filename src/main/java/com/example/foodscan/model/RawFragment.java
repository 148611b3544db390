package com.example.foodscan.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * One recognized text region reported by the OCR collaborator. Coordinates are normalized to the
 * image size with the origin in the top-left corner, so {@code centerY} grows downwards.
 */
@Schema(description = "Text region recognized by the OCR engine")
public record RawFragment(
        @Schema(description = "Recognized text", example = "Ingredients: wheat flour, sugar") String text,
        @Schema(description = "Recognition confidence between 0 and 1", example = "0.92") double confidence,
        @Schema(description = "Horizontal center, normalized to [0,1]", example = "0.41") double centerX,
        @Schema(description = "Vertical center, normalized to [0,1], growing downwards", example = "0.18") double centerY) {

    public RawFragment {
        if (text == null) {
            throw new IllegalArgumentException("Fragment text must not be null");
        }
        requireUnitInterval(confidence, "confidence");
        requireUnitInterval(centerX, "centerX");
        requireUnitInterval(centerY, "centerY");
    }

    private static void requireUnitInterval(double value, String name) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException("Fragment " + name + " must be within [0,1] but was " + value);
        }
    }
}
