package com.example.foodscan.service.classification;

import com.example.foodscan.model.ClassificationResult;
import com.example.foodscan.model.ClassificationResult.Evidence;
import com.example.foodscan.model.DietaryCategory;
import com.example.foodscan.service.classification.ClassificationRule.Verdict;
import com.example.foodscan.service.classification.KeywordMatches.LineHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Keyword-based dietary classifier. Rules are evaluated in a fixed order and the first rule whose
 * condition holds decides the category. When the evidence is thin the verdict falls back to
 * {@link DietaryCategory#POSSIBLY_NON_VEGETARIAN}, so the classifier always returns a result.
 */
public class DietaryClassifier {

    private static final Logger log = LoggerFactory.getLogger(DietaryClassifier.class);

    private static final int MAX_LISTED_KEYWORDS = 3;
    private static final int MAX_QUOTED_LINES = 2;
    private static final int MAX_KEYWORDS_PER_GROUP = 2;
    private static final int MIN_READABLE_LENGTH = 10;

    private final DietaryKeywords keywords;
    private final List<ClassificationRule> rules;

    public DietaryClassifier(DietaryKeywords keywords) {
        this.keywords = Objects.requireNonNull(keywords, "keywords");
        this.rules = List.of(
                new ClassificationRule("non-vegetarian",
                        matches -> !matches.nonVeg().isEmpty(),
                        DietaryCategory.NON_VEGETARIAN,
                        DietaryClassifier::nonVegetarian),
                new ClassificationRule("vegan",
                        matches -> !matches.veganSafe().isEmpty() && !matches.hasDairyOrEgg(),
                        DietaryCategory.VEGAN,
                        DietaryClassifier::vegan),
                new ClassificationRule("dairy-or-egg",
                        KeywordMatches::hasDairyOrEgg,
                        DietaryCategory.VEGETARIAN,
                        DietaryClassifier::dairyOrEgg),
                new ClassificationRule("plant-fallback",
                        matches -> !matches.commonPlant().isEmpty() && !matches.hasDairyOrEgg(),
                        DietaryCategory.VEGETARIAN,
                        DietaryClassifier::plantFallback),
                new ClassificationRule("ambiguous-vegan",
                        matches -> !matches.veganSafe().isEmpty(),
                        DietaryCategory.POSSIBLY_NON_VEGETARIAN,
                        DietaryClassifier::ambiguousVegan),
                new ClassificationRule("undetermined",
                        matches -> matches.lowerText().length() > MIN_READABLE_LENGTH,
                        DietaryCategory.POSSIBLY_NON_VEGETARIAN,
                        matches -> new Verdict("Unable to determine classification from ingredients. "
                                + "Ingredients may contain animal products not clearly listed.", List.of())),
                new ClassificationRule("unreadable",
                        matches -> true,
                        DietaryCategory.POSSIBLY_NON_VEGETARIAN,
                        matches -> new Verdict("Could not read ingredients clearly. "
                                + "Please try scanning again with better lighting.", List.of()))
        );
    }

    public ClassificationResult classify(String ingredientsText) {
        KeywordMatches matches = KeywordMatches.scan(ingredientsText, keywords);
        for (ClassificationRule rule : rules) {
            if (rule.appliesTo(matches)) {
                ClassificationResult result = rule.apply(matches);
                log.debug("Classification rule '{}' fired: {}", rule.name(), result.category());
                return result;
            }
        }
        throw new IllegalStateException("Classification rules are not exhaustive");
    }

    private static Verdict nonVegetarian(KeywordMatches matches) {
        List<String> found = matches.nonVeg();
        StringBuilder reason = new StringBuilder("Found non-vegetarian ingredients: ")
                .append(listWithRemainder(found));

        List<LineHit> lines = matches.nonVegLines();
        if (!lines.isEmpty()) {
            String quoted = lines.stream()
                    .limit(MAX_QUOTED_LINES)
                    .map(hit -> "\"" + hit.line() + "\" (contains: " + String.join(", ", hit.keywords()) + ")")
                    .collect(Collectors.joining("\n"));
            reason.append("\n\nFound in: ").append(quoted);
        }

        List<Evidence> evidence = new ArrayList<>();
        for (String keyword : found.subList(0, Math.min(MAX_LISTED_KEYWORDS, found.size()))) {
            evidence.add(new Evidence(keyword, matches.sourceLineOf(keyword)));
        }
        return new Verdict(reason.toString(), evidence);
    }

    private static Verdict vegan(KeywordMatches matches) {
        List<String> found = matches.veganSafe();
        return new Verdict("Found vegan-safe ingredients: " + listWithRemainder(found),
                evidenceOf(found, MAX_LISTED_KEYWORDS));
    }

    private static Verdict dairyOrEgg(KeywordMatches matches) {
        List<String> parts = new ArrayList<>();
        List<Evidence> evidence = new ArrayList<>();
        if (!matches.dairy().isEmpty()) {
            parts.add("dairy: " + joinFirst(matches.dairy(), MAX_KEYWORDS_PER_GROUP));
            evidence.addAll(evidenceOf(matches.dairy(), MAX_KEYWORDS_PER_GROUP));
        }
        if (!matches.egg().isEmpty()) {
            parts.add("eggs: " + joinFirst(matches.egg(), MAX_KEYWORDS_PER_GROUP));
            evidence.addAll(evidenceOf(matches.egg(), MAX_KEYWORDS_PER_GROUP));
        }
        return new Verdict("Found " + String.join(" and ", parts), evidence);
    }

    private static Verdict plantFallback(KeywordMatches matches) {
        List<String> found = matches.commonPlant();
        return new Verdict("Found plant-based ingredients: " + joinFirst(found, MAX_LISTED_KEYWORDS)
                + ". No animal products detected.", evidenceOf(found, MAX_LISTED_KEYWORDS));
    }

    private static Verdict ambiguousVegan(KeywordMatches matches) {
        List<String> found = matches.veganSafe();
        return new Verdict("Found plant-based ingredients (" + joinFirst(found, MAX_KEYWORDS_PER_GROUP)
                + ") but unable to confirm if fully vegan. May contain hidden animal products.",
                evidenceOf(found, MAX_KEYWORDS_PER_GROUP));
    }

    private static String listWithRemainder(List<String> found) {
        String listed = joinFirst(found, MAX_LISTED_KEYWORDS);
        int remaining = found.size() - MAX_LISTED_KEYWORDS;
        return remaining > 0 ? listed + " and " + remaining + " more" : listed;
    }

    private static String joinFirst(List<String> values, int limit) {
        return values.stream().limit(limit).collect(Collectors.joining(", "));
    }

    private static List<Evidence> evidenceOf(List<String> found, int limit) {
        return found.stream().limit(limit).map(Evidence::of).toList();
    }
}
