package com.example.foodscan.model;

import java.util.List;
import java.util.Objects;

/**
 * Dietary verdict for an ingredient list. The reason always explains the verdict; when evidence
 * lines are quoted they follow the primary reason after a blank line.
 */
public record ClassificationResult(DietaryCategory category, String reason, List<Evidence> evidence) {

    public ClassificationResult {
        Objects.requireNonNull(category, "category");
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Classification reason must not be blank");
        }
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    /**
     * Reason text before the first blank line.
     */
    public String primaryReason() {
        int split = reason.indexOf("\n\n");
        return split < 0 ? reason : reason.substring(0, split);
    }

    public List<String> keywords() {
        return evidence.stream().map(Evidence::keyword).toList();
    }

    public record Evidence(String keyword, String sourceLine) {

        public Evidence {
            Objects.requireNonNull(keyword, "keyword");
        }

        public static Evidence of(String keyword) {
            return new Evidence(keyword, null);
        }
    }
}
