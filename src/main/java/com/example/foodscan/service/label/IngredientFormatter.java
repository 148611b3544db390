package com.example.foodscan.service.label;

import com.example.foodscan.util.LatinText;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a raw ingredient (or allergen) section into a bulleted list sorted case-insensitively.
 * Contact details, manufacturer lines, reference numbers and non-Latin lines are removed first.
 */
public class IngredientFormatter {

    public static final String BULLET = "• ";

    private static final Pattern LEADING_HEADER = Pattern.compile("^\\s*ingredients?\\s*:?", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_LONG_NUMBER = Pattern.compile("^\\d{4,}");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final List<String> NOISE_MARKERS = List.of(
            "address", "phone", "tel:", "email", "@", "www.", "http", "website", "contact",
            "manufactured", "packed by", "distributed by", "imported by");
    private static final List<String> SEPARATORS = List.of(",", ";", "\n");
    private static final String WORD_PUNCTUATION = ".,;:!?()[]{}'\"";
    private static final int SHORT_LINE_LENGTH = 20;
    private static final int MIN_ENTRY_LENGTH = 2;
    private static final int MIN_LINE_LENGTH = 3;

    public String format(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String cleaned = LEADING_HEADER.matcher(text).replaceFirst("").trim();
        cleaned = LINE_BREAK.matcher(cleaned).replaceAll("\n");

        List<String> validLines = new ArrayList<>();
        for (String line : cleaned.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty() && isIngredientLine(trimmed)) {
                validLines.add(trimmed);
            }
        }

        if (validLines.isEmpty()) {
            String words = englishWords(cleaned);
            if (!words.isEmpty()) {
                cleaned = words;
            }
        } else {
            cleaned = String.join("\n", validLines);
        }

        List<String> entries = splitEntries(cleaned);
        entries.sort(Comparator.comparing(entry -> entry.toLowerCase(Locale.ROOT)));

        List<String> bulleted = new ArrayList<>(entries.size());
        for (String entry : entries) {
            bulleted.add(BULLET + entry);
        }
        return String.join("\n", bulleted);
    }

    static boolean isIngredientLine(String line) {
        if (line.length() < MIN_LINE_LENGTH || !LatinText.hasOnlyLatinLetters(line)) {
            return false;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        if (LatinText.containsAny(lower, NOISE_MARKERS)) {
            return false;
        }
        if (LEADING_LONG_NUMBER.matcher(lower).find()) {
            return false;
        }
        return !(LatinText.containsLongDigitRun(lower) && lower.length() < SHORT_LINE_LENGTH);
    }

    private static String englishWords(String text) {
        List<String> words = new ArrayList<>();
        for (String word : text.split("\\s+")) {
            String stripped = stripPunctuation(word);
            if (!stripped.isEmpty() && LatinText.hasOnlyLatinLetters(stripped)) {
                words.add(stripped);
            }
        }
        return String.join(" ", words);
    }

    private static List<String> splitEntries(String text) {
        List<String> entries = new ArrayList<>();
        for (String separator : SEPARATORS) {
            if (text.contains(separator)) {
                for (String part : text.split(Pattern.quote(separator))) {
                    String entry = part.trim().replaceAll("\\s*\\n\\s*", " ");
                    if (entry.length() >= MIN_ENTRY_LENGTH) {
                        entries.add(entry);
                    }
                }
                break;
            }
        }
        if (entries.isEmpty()) {
            entries.add(text.trim());
        }
        return entries;
    }

    private static String stripPunctuation(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && WORD_PUNCTUATION.indexOf(word.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && WORD_PUNCTUATION.indexOf(word.charAt(end - 1)) >= 0) {
            end--;
        }
        return word.substring(start, end);
    }
}
