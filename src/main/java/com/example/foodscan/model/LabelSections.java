package com.example.foodscan.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Schema(description = "Label text split into formatted ingredient and allergen lists plus any other named sections")
public record LabelSections(
        @Schema(description = "Bulleted, alphabetically sorted ingredient list", example = "• salt\n• sugar\n• wheat flour") String ingredientsText,
        @Schema(description = "Bulleted allergen list when the label declares one", example = "• milk\n• soy") String allergenText,
        @Schema(description = "Other recognized sections keyed by section name") Map<String, String> otherSections) {

    public LabelSections {
        ingredientsText = ingredientsText == null ? "" : ingredientsText;
        otherSections = otherSections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(otherSections));
    }
}
