package com.example.foodscan.model;

import java.util.List;

/**
 * Logical lines of a capture, ordered top-to-bottom.
 */
public record NormalizedText(List<String> lines) {

    private static final NormalizedText EMPTY = new NormalizedText(List.of());

    public NormalizedText {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static NormalizedText empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public String text() {
        return String.join("\n", lines);
    }
}
