package com.example.foodscan.service.product;

import com.example.foodscan.model.NormalizedText;
import com.example.foodscan.model.ProductInfo;
import com.example.foodscan.model.Weight;
import com.example.foodscan.model.WeightUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers a product name and declared weight from front-of-pack text. The name is taken from the
 * topmost lines, skipping weight, price and very short lines; the weight is the first weight-like
 * token anywhere on the pack whose gram amount fits in an {@code int}; barcodes followed by a unit
 * letter are skipped.
 */
public class ProductInfoExtractor {

    private static final Logger log = LoggerFactory.getLogger(ProductInfoExtractor.class);

    private static final int NAME_LINE_COUNT = 3;
    private static final int MIN_NAME_LINE_LENGTH = 3;
    private static final Pattern LEADING_WEIGHT = Pattern.compile("^\\d+[gkml]");
    private static final Pattern LEADING_CURRENCY = Pattern.compile("^[₫₹$]");
    private static final Pattern WEIGHT = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)\\s*(kilograms?|kg|grams?|g|ml)", Pattern.CASE_INSENSITIVE);

    public ProductInfo extract(NormalizedText text) {
        if (text == null || text.isEmpty()) {
            return ProductInfo.empty();
        }
        String name = extractName(text.lines());
        Weight weight = extractWeight(String.join(" ", text.lines()));
        log.debug("Front of pack: name={}, weight={}", name, weight);
        return new ProductInfo(name, weight);
    }

    String extractName(List<String> lines) {
        List<String> candidates = lines.stream()
                .limit(NAME_LINE_COUNT)
                .filter(ProductInfoExtractor::isNameLine)
                .toList();
        return candidates.isEmpty() ? null : String.join(" ", candidates);
    }

    public Weight extractWeight(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = WEIGHT.matcher(text);
        while (matcher.find()) {
            Weight weight = new Weight(new BigDecimal(matcher.group(1)), WeightUnit.fromLabel(matcher.group(2)));
            try {
                weight.toGrams();
                return weight;
            } catch (ArithmeticException ex) {
                log.debug("Ignoring out-of-range weight token '{}'", matcher.group());
            }
        }
        return null;
    }

    private static boolean isNameLine(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return !lower.contains("net")
                && !lower.contains("weight")
                && !LEADING_WEIGHT.matcher(lower).find()
                && !LEADING_CURRENCY.matcher(lower).find()
                && line.length() > MIN_NAME_LINE_LENGTH;
    }
}
