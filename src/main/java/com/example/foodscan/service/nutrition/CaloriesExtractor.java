package com.example.foodscan.service.nutrition;

import com.example.foodscan.model.CaloriesValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the declared energy value from label text. Patterns are tried in order and the first one
 * that matches decides the value.
 */
public class CaloriesExtractor {

    private static final Logger log = LoggerFactory.getLogger(CaloriesExtractor.class);

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("(\\d+)\\s*(?:kcal|calories?|cal)\\s*(?:per\\s*(?:serving|100g|100\\s*g)?)?"),
            Pattern.compile("calories?[:\\s]+(\\d+)"),
            Pattern.compile("energy[:\\s]+(\\d+)\\s*(?:kcal|cal)")
    );

    public CaloriesValue extract(String text) {
        if (text == null || text.isBlank()) {
            return CaloriesValue.notListed();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            if (!matcher.find()) {
                continue;
            }
            try {
                return CaloriesValue.of(Long.parseLong(matcher.group(1)));
            } catch (NumberFormatException ex) {
                log.debug("Ignoring out-of-range calorie value {}", matcher.group(1));
            }
        }
        return CaloriesValue.notListed();
    }
}
