package com.example.foodscan.service.classification;

import com.example.foodscan.model.ClassificationResult;
import com.example.foodscan.model.DietaryCategory;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One step of the classification procedure: when {@code condition} holds the rule fires and
 * {@code verdict} builds the result for {@code category}.
 */
record ClassificationRule(
        String name,
        Predicate<KeywordMatches> condition,
        DietaryCategory category,
        Function<KeywordMatches, Verdict> verdict) {

    boolean appliesTo(KeywordMatches matches) {
        return condition.test(matches);
    }

    ClassificationResult apply(KeywordMatches matches) {
        Verdict built = verdict.apply(matches);
        return new ClassificationResult(category, built.reason(), built.evidence());
    }

    record Verdict(String reason, List<ClassificationResult.Evidence> evidence) {
    }
}
