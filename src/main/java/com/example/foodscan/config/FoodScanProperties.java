package com.example.foodscan.config;

import com.example.foodscan.service.classification.DietaryKeywords;
import com.example.foodscan.service.label.SectionHeaders;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "foodscan")
public record FoodScanProperties(
        @DefaultValue OcrProperties ocr,
        @DefaultValue PriceProperties price,
        @DefaultValue ClassifierProperties classifier,
        @DefaultValue SectionProperties sections) {

    public static FoodScanProperties defaults() {
        return new FoodScanProperties(
                new OcrProperties(OcrProperties.LABEL_THRESHOLD, OcrProperties.FRONT_THRESHOLD, OcrProperties.LINE_TOLERANCE),
                new PriceProperties(PriceProperties.DONG_TO_RUPEE_RATE, PriceProperties.LOOKUP_TIMEOUT),
                new ClassifierProperties(null, null, null, null, null),
                new SectionProperties(null, null, null));
    }

    /**
     * @param labelConfidenceThreshold minimum confidence for ingredient-label fragments
     * @param frontConfidenceThreshold minimum confidence for front-of-pack fragments
     * @param lineTolerance            maximum vertical distance between fragments on one line
     */
    public record OcrProperties(
            @DefaultValue("0.5") double labelConfidenceThreshold,
            @DefaultValue("0.3") double frontConfidenceThreshold,
            @DefaultValue("0.02") double lineTolerance) {

        static final double LABEL_THRESHOLD = 0.5;
        static final double FRONT_THRESHOLD = 0.3;
        static final double LINE_TOLERANCE = 0.02;
    }

    public record PriceProperties(
            @DefaultValue("0.0033") double dongToRupeeRate,
            @DefaultValue("5s") Duration lookupTimeout) {

        static final double DONG_TO_RUPEE_RATE = 0.0033;
        static final Duration LOOKUP_TIMEOUT = Duration.ofSeconds(5);
    }

    public record ClassifierProperties(
            List<String> nonVeg,
            List<String> veganSafe,
            List<String> dairy,
            List<String> egg,
            List<String> commonPlant) {

        public DietaryKeywords toKeywords() {
            return new DietaryKeywords(nonVeg, veganSafe, dairy, egg, commonPlant);
        }
    }

    public record SectionProperties(
            List<String> ingredientHeaders,
            List<String> allergenHeaders,
            List<String> otherHeaders) {

        public SectionHeaders toHeaders() {
            return new SectionHeaders(ingredientHeaders, allergenHeaders, otherHeaders);
        }
    }
}
