package com.example.foodscan.model.api;

import com.example.foodscan.model.LabelAnalysis;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "Result of scanning an ingredient label")
public record LabelScanResponse(
        @Schema(description = "Normalized OCR text before filtering") String originalText,
        @Schema(description = "English lines kept from the label") String translatedText,
        @Schema(description = "Best-effort language of the original text", example = "vi") String detectedLanguage,
        @Schema(description = "Bulleted ingredient list") String ingredients,
        @Schema(description = "Bulleted allergen list, when declared") String allergens,
        @Schema(description = "Other named label sections") Map<String, String> otherSections,
        @Schema(description = "Dietary classification") ClassificationResponse classification,
        @Schema(description = "Declared energy", example = "250 kcal") String calories) {

    public static LabelScanResponse from(LabelAnalysis analysis) {
        return new LabelScanResponse(
                analysis.originalText(),
                analysis.translatedText(),
                analysis.detectedLanguage(),
                analysis.sections().ingredientsText(),
                analysis.sections().allergenText(),
                analysis.sections().otherSections(),
                ClassificationResponse.from(analysis.classification()),
                analysis.calories().toString());
    }
}
