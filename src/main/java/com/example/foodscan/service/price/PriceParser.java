package com.example.foodscan.service.price;

import com.example.foodscan.model.Currency;
import com.example.foodscan.model.PriceInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses a shelf or online price string, detects its currency and converts Vietnamese Dong to
 * Indian Rupee at a fixed rate. With a pack weight the price is also normalized per kilogram.
 */
public class PriceParser {

    private static final Logger log = LoggerFactory.getLogger(PriceParser.class);

    static final String UNABLE_TO_CONVERT = "Unable to convert";
    static final String CURRENCY_NOT_SUPPORTED = "Currency not supported";

    // decimal points are stripped along with thousands separators
    private static final Pattern CURRENCY_NOISE = Pattern.compile("[₫₹$,.]");
    private static final Pattern NUMBER = Pattern.compile("[+-]?\\d+(?:[eE][+-]?\\d+)?");

    private final double dongToRupeeRate;

    public PriceParser(double dongToRupeeRate) {
        if (!(dongToRupeeRate > 0)) {
            throw new IllegalArgumentException("Conversion rate must be positive");
        }
        this.dongToRupeeRate = dongToRupeeRate;
    }

    public double convertDongToRupee(double dongAmount) {
        return dongAmount * dongToRupeeRate;
    }

    /**
     * @param priceString   price as printed or found, e.g. {@code ₫50,000}
     * @param weightInGrams pack weight, or {@code null} when unknown
     */
    public PriceInfo convert(String priceString, Integer weightInGrams) {
        String original = priceString == null ? "" : priceString;
        String cleaned = CURRENCY_NOISE.matcher(original).replaceAll("");
        if (!NUMBER.matcher(cleaned).matches()) {
            log.debug("Price '{}' is not numeric after cleanup", original);
            return new PriceInfo(detectCurrency(original), original, UNABLE_TO_CONVERT, null);
        }
        double amount = Double.parseDouble(cleaned);
        boolean hasWeight = weightInGrams != null && weightInGrams > 0;

        Currency currency = detectCurrency(original);
        switch (currency) {
            case VIETNAMESE_DONG -> {
                String converted = String.format(Locale.ROOT, "₹%.2f", convertDongToRupee(amount));
                String perKg = null;
                if (hasWeight) {
                    double perKgDong = perKilogram(amount, weightInGrams);
                    perKg = String.format(Locale.ROOT, "₫%.0f/kg (₹%.2f/kg)", perKgDong, convertDongToRupee(perKgDong));
                }
                return new PriceInfo(currency, original, converted, perKg);
            }
            case INDIAN_RUPEE -> {
                String perKg = hasWeight
                        ? String.format(Locale.ROOT, "₹%.2f/kg", perKilogram(amount, weightInGrams))
                        : null;
                return new PriceInfo(currency, original, original, perKg);
            }
            default -> {
                return new PriceInfo(currency, original, CURRENCY_NOT_SUPPORTED, null);
            }
        }
    }

    static Currency detectCurrency(String priceString) {
        if (priceString.contains("₫") || priceString.contains("đ")) {
            return Currency.VIETNAMESE_DONG;
        }
        if (priceString.contains("₹")) {
            return Currency.INDIAN_RUPEE;
        }
        return Currency.UNSUPPORTED;
    }

    private static double perKilogram(double amount, int weightInGrams) {
        return (amount / weightInGrams) * 1000;
    }
}
