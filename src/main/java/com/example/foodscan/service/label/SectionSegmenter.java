package com.example.foodscan.service.label;

import com.example.foodscan.model.LabelSections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Splits label text into ingredient, allergen and other sections by detecting multilingual section
 * headers line by line. Text before the first header is treated as ingredients.
 */
public class SectionSegmenter {

    private static final Logger log = LoggerFactory.getLogger(SectionSegmenter.class);

    private static final String INGREDIENTS = "ingredients";
    private static final String ALLERGENS = "allergens";
    private static final int MAX_HEADER_REMAINDER = 100;

    private final SectionHeaders headers;
    private final IngredientFormatter formatter;

    public SectionSegmenter(SectionHeaders headers, IngredientFormatter formatter) {
        this.headers = Objects.requireNonNull(headers, "headers");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
    }

    public LabelSections segment(String text) {
        String source = text == null ? "" : text;

        SectionBuffers buffers = new SectionBuffers();
        String currentSection = null;
        List<String> currentContent = new ArrayList<>();

        for (String line : source.split("\\R", -1)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                if (!currentContent.isEmpty() && currentSection != null) {
                    currentContent.add("");
                }
                continue;
            }

            HeaderMatch header = detectHeader(trimmed);
            if (header != null) {
                buffers.flush(currentSection, currentContent);
                currentSection = header.section();
                currentContent = new ArrayList<>();
                String remainder = header.remainder();
                if (!remainder.isEmpty() && remainder.length() < MAX_HEADER_REMAINDER) {
                    currentContent.add(remainder);
                }
                continue;
            }

            if (currentSection == null) {
                currentSection = INGREDIENTS;
            }
            currentContent.add(trimmed);
        }
        buffers.flush(currentSection, currentContent);

        String ingredients = buffers.ingredients.isEmpty() ? source : buffers.ingredients;
        String allergens = buffers.allergens.isEmpty() ? null : formatter.format(buffers.allergens);

        log.debug("Segmented label: ingredients={}, allergens={}, other={}",
                !buffers.ingredients.isEmpty(), allergens != null, buffers.other.keySet());
        return new LabelSections(formatter.format(ingredients), allergens, buffers.other);
    }

    private HeaderMatch detectHeader(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        HeaderMatch match = matchFamily(line, lower, headers.ingredients(), INGREDIENTS);
        if (match == null) {
            match = matchFamily(line, lower, headers.allergens(), ALLERGENS);
        }
        if (match == null) {
            match = matchOtherSection(line, lower);
        }
        return match;
    }

    private HeaderMatch matchFamily(String line, String lower, List<String> family, String section) {
        for (String header : family) {
            if (isHeaderLine(lower, header)) {
                return new HeaderMatch(section, remainderAfterHeader(line, family));
            }
        }
        return null;
    }

    /**
     * Named sections such as storage or directions open only on a line that is the header itself or
     * starts with {@code header:}, so ingredient lines mentioning those words stay in place.
     */
    private HeaderMatch matchOtherSection(String line, String lower) {
        for (String header : headers.other()) {
            if (lower.equals(header) || lower.startsWith(header + ":")) {
                return new HeaderMatch(header, remainderAfterHeader(line, List.of(header)));
            }
        }
        return null;
    }

    private static boolean isHeaderLine(String lower, String header) {
        return lower.startsWith(header) || lower.equals(header) || lower.contains(": " + header);
    }

    // Offsets are taken from the original line; lower-casing may change its length.
    private static String remainderAfterHeader(String line, List<String> family) {
        String leading = family.stream()
                .filter(header -> line.regionMatches(true, 0, header, 0, header.length()))
                .max(Comparator.comparingInt(String::length))
                .orElse(null);
        if (leading != null) {
            return stripColonsAndSpaces(line.substring(leading.length()));
        }
        for (String header : family) {
            String marker = ": " + header;
            for (int index = 0; index + marker.length() <= line.length(); index++) {
                if (line.regionMatches(true, index, marker, 0, marker.length())) {
                    return stripColonsAndSpaces(line.substring(index + marker.length()));
                }
            }
        }
        return stripColonsAndSpaces(line);
    }

    private static String stripColonsAndSpaces(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isColonOrSpace(value.charAt(start))) {
            start++;
        }
        while (end > start && isColonOrSpace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isColonOrSpace(char c) {
        return c == ':' || c == ' ';
    }

    private record HeaderMatch(String section, String remainder) {
    }

    private static final class SectionBuffers {

        private String ingredients = "";
        private String allergens = "";
        private final Map<String, String> other = new LinkedHashMap<>();

        private void flush(String section, List<String> content) {
            if (section == null || content.isEmpty()) {
                return;
            }
            String block = String.join("\n", content).trim();
            if (block.isEmpty()) {
                return;
            }
            switch (section) {
                case INGREDIENTS -> ingredients = append(ingredients, block);
                case ALLERGENS -> allergens = append(allergens, block);
                default -> other.merge(section, block, SectionBuffers::append);
            }
        }

        private static String append(String existing, String block) {
            return existing.isEmpty() ? block : existing + "\n" + block;
        }
    }
}
