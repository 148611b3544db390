package com.example.foodscan.model.api;

import com.example.foodscan.model.ClassificationResult;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Dietary classification with its justification")
public record ClassificationResponse(
        @Schema(description = "Dietary category", example = "Vegetarian") String category,
        @Schema(description = "Full reason; quoted evidence lines follow a blank line",
                example = "Found dairy: milk") String reason,
        @Schema(description = "Keywords that justify the category, with the label line they were found on")
        List<ClassificationResult.Evidence> evidence) {

    public static ClassificationResponse from(ClassificationResult result) {
        return new ClassificationResponse(result.category().label(), result.reason(), result.evidence());
    }
}
