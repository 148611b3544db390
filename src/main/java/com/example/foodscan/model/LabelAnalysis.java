package com.example.foodscan.model;

/**
 * Everything derived from one ingredient-label capture.
 */
public record LabelAnalysis(
        String originalText,
        String translatedText,
        String detectedLanguage,
        LabelSections sections,
        ClassificationResult classification,
        CaloriesValue calories) {
}
