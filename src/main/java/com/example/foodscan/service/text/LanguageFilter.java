package com.example.foodscan.service.text;

import com.example.foodscan.util.LatinText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Approximates translation to English by keeping only the English-looking lines of a label. Many
 * packs print a local-language block followed by an English one, so once an English section header
 * is seen only the English lines from that point on are kept. Lines in other scripts are dropped,
 * never translated.
 */
public class LanguageFilter {

    private static final Logger log = LoggerFactory.getLogger(LanguageFilter.class);

    private static final List<String> ENGLISH_HEADERS = List.of("ingredients", "ingredient", "contains", "allergen");
    private static final List<String> NOISE_MARKERS = List.of("address", "phone", "email", "@", "www.", "http");
    private static final int MIN_LINE_LENGTH = 3;

    private static final List<LanguageHint> LANGUAGE_HINTS = List.of(
            new LanguageHint(Pattern.compile("[àáâãäåæçèéêëìíîïðñòóôõöøùúûüýþÿ]"), "es"),
            new LanguageHint(Pattern.compile("[\\u4E00-\\u9FAF]"), "zh"),
            new LanguageHint(Pattern.compile("[\\u3042-\\u3093]"), "ja"),
            new LanguageHint(Pattern.compile("[\\uAC00-\\uD7A3]"), "ko"),
            new LanguageHint(Pattern.compile("[\\u0E01-\\u0E59]"), "th"),
            new LanguageHint(Pattern.compile("[àáạảãâầấậẩẫăằắặẳẵèéẹẻẽêềếệểễìíịỉĩòóọỏõôồốộổỗơờớợởỡùúụủũưừứựửữỳýỵỷỹđ]"), "vi")
    );

    /**
     * @param text normalized label text, one logical line per line break
     * @return the English lines of {@code text}, or {@code text} unchanged when none qualify
     */
    public String translateToEnglish(String text) {
        if (text == null || text.isBlank()) {
            return text == null ? "" : text;
        }

        List<String> lines = nonBlankLines(text);

        List<String> sectionLines = new ArrayList<>();
        boolean englishSection = false;
        for (String line : lines) {
            if (!englishSection && startsWithEnglishHeader(line)) {
                englishSection = true;
            }
            if (englishSection && isEnglishLine(line)) {
                sectionLines.add(line);
            }
        }
        if (englishSection && !sectionLines.isEmpty()) {
            log.debug("Kept {} of {} lines from the English section", sectionLines.size(), lines.size());
            return String.join("\n", sectionLines);
        }

        List<String> englishLines = lines.stream()
                .filter(LanguageFilter::isEnglishLine)
                .toList();
        if (englishLines.isEmpty()) {
            log.debug("No English lines among {} lines, keeping the original text", lines.size());
            return text;
        }
        log.debug("Kept {} of {} English lines", englishLines.size(), lines.size());
        return String.join("\n", englishLines);
    }

    /**
     * Best-effort language guess from the scripts and diacritics present in {@code text}.
     *
     * @return an ISO 639-1 code, {@code en} when nothing else is recognized
     */
    public String detectLanguage(String text) {
        if (text == null || text.isBlank()) {
            return "en";
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (LanguageHint hint : LANGUAGE_HINTS) {
            if (hint.pattern().matcher(lower).find()) {
                return hint.language();
            }
        }
        return "en";
    }

    static boolean isEnglishLine(String line) {
        if (line.length() < MIN_LINE_LENGTH || !LatinText.hasOnlyLatinLetters(line)) {
            return false;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        return !LatinText.containsAny(lower, NOISE_MARKERS) && !LatinText.containsLongDigitRun(lower);
    }

    private static boolean startsWithEnglishHeader(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String header : ENGLISH_HEADERS) {
            if (lower.startsWith(header)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> nonBlankLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    private record LanguageHint(Pattern pattern, String language) {
    }
}
