package com.example.foodscan.service.classification;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword hits found in one ingredient text, computed once and shared by every rule.
 */
final class KeywordMatches {

    private final String lowerText;
    private final List<String> nonVeg;
    private final List<LineHit> nonVegLines;
    private final List<String> veganSafe;
    private final List<String> dairy;
    private final List<String> egg;
    private final List<String> commonPlant;

    private KeywordMatches(String lowerText, List<String> nonVeg, List<LineHit> nonVegLines,
                           List<String> veganSafe, List<String> dairy, List<String> egg, List<String> commonPlant) {
        this.lowerText = lowerText;
        this.nonVeg = nonVeg;
        this.nonVegLines = nonVegLines;
        this.veganSafe = veganSafe;
        this.dairy = dairy;
        this.egg = egg;
        this.commonPlant = commonPlant;
    }

    static KeywordMatches scan(String text, DietaryKeywords keywords) {
        String source = text == null ? "" : text;
        String lower = source.toLowerCase(Locale.ROOT);
        return new KeywordMatches(
                lower,
                found(lower, keywords.nonVeg()),
                lineHits(source, keywords.nonVeg()),
                found(lower, keywords.veganSafe()),
                found(lower, keywords.dairy()),
                found(lower, keywords.egg()),
                found(lower, keywords.commonPlant()));
    }

    String lowerText() {
        return lowerText;
    }

    List<String> nonVeg() {
        return nonVeg;
    }

    List<LineHit> nonVegLines() {
        return nonVegLines;
    }

    List<String> veganSafe() {
        return veganSafe;
    }

    List<String> dairy() {
        return dairy;
    }

    List<String> egg() {
        return egg;
    }

    List<String> commonPlant() {
        return commonPlant;
    }

    boolean hasDairyOrEgg() {
        return !dairy.isEmpty() || !egg.isEmpty();
    }

    /**
     * @return the line a keyword was first attributed to, or {@code null}
     */
    String sourceLineOf(String keyword) {
        for (LineHit hit : nonVegLines) {
            if (hit.keywords().contains(keyword)) {
                return hit.line();
            }
        }
        return null;
    }

    private static List<String> found(String lowerText, List<String> keywords) {
        List<String> matches = new ArrayList<>();
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                matches.add(keyword);
            }
        }
        return List.copyOf(matches);
    }

    private static List<LineHit> lineHits(String text, List<String> keywords) {
        Set<String> attributed = new LinkedHashSet<>();
        List<LineHit> hits = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String lowerLine = line.toLowerCase(Locale.ROOT);
            List<String> lineKeywords = new ArrayList<>();
            for (String keyword : keywords) {
                if (lowerLine.contains(keyword) && attributed.add(keyword)) {
                    lineKeywords.add(keyword);
                }
            }
            if (!lineKeywords.isEmpty()) {
                hits.add(new LineHit(line.trim(), List.copyOf(lineKeywords)));
            }
        }
        return List.copyOf(hits);
    }

    record LineHit(String line, List<String> keywords) {
    }
}
