package com.example.foodscan.util;

import java.util.regex.Pattern;

/**
 * Character-level tests shared by the filters that decide whether label text is English.
 */
public final class LatinText {

    private static final Pattern LONG_DIGIT_RUN = Pattern.compile("\\d{4,}");

    private LatinText() {
    }

    /**
     * @return {@code true} when every letter in {@code value} is an ASCII Latin letter. Digits,
     * punctuation and symbols such as currency signs are ignored.
     */
    public static boolean hasOnlyLatinLetters(String value) {
        if (value == null) {
            return true;
        }
        return value.codePoints()
                .filter(Character::isLetter)
                .allMatch(LatinText::isAsciiLetter);
    }

    public static boolean containsLongDigitRun(String value) {
        return value != null && LONG_DIGIT_RUN.matcher(value).find();
    }

    public static boolean containsAny(String lowerCaseValue, Iterable<String> needles) {
        for (String needle : needles) {
            if (lowerCaseValue.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAsciiLetter(int codePoint) {
        return (codePoint >= 'a' && codePoint <= 'z') || (codePoint >= 'A' && codePoint <= 'Z');
    }
}
