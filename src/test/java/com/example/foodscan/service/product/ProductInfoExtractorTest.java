package com.example.foodscan.service.product;

import com.example.foodscan.model.NormalizedText;
import com.example.foodscan.model.ProductInfo;
import com.example.foodscan.model.Weight;
import com.example.foodscan.model.WeightUnit;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ProductInfoExtractorTest {

    private final ProductInfoExtractor extractor = new ProductInfoExtractor();

    @Test
    void extractsNameFromTopLinesAndWeightFromWholeText() {
        ProductInfo info = extractor.extract(new NormalizedText(
                List.of("Crispy Potato Chips", "Sea Salt Flavour", "Net Wt 150g", "₫45,000")));

        assertEquals("Crispy Potato Chips Sea Salt Flavour", info.name());
        assertEquals("150g", info.weight().toString());
        assertEquals(150, info.weight().toGrams());
    }

    @Test
    void findsWeightBelowNameLines() {
        ProductInfo info = extractor.extract(new NormalizedText(
                List.of("Masala Tea", "Premium Blend", "Strong", "Pack of 1", "250 grams")));

        assertEquals("Masala Tea Premium Blend Strong", info.name());
        assertEquals(new Weight(new BigDecimal("250"), WeightUnit.G), info.weight());
    }

    @Test
    void skipsWeightPriceAndShortLinesInName() {
        assertNull(extractor.extractName(List.of("150g", "₹99", "Tea", "Masala Chai")));
        assertEquals("Masala Chai", extractor.extractName(List.of("Masala Chai", "Net weight 100g", "500ml")));
    }

    @Test
    void normalizesWeightUnits() {
        assertEquals(new Weight(new BigDecimal("500"), WeightUnit.G), extractor.extractWeight("NET WT 500G"));

        Weight kilograms = extractor.extractWeight("1.5 kilograms");
        assertEquals("1.5kg", kilograms.toString());
        assertEquals(1500, kilograms.toGrams());

        Weight millilitres = extractor.extractWeight("Juice 330 ml");
        assertEquals(WeightUnit.ML, millilitres.unit());
        assertEquals(330, millilitres.toGrams());
    }

    @Test
    void refusesToTruncateOversizedWeightToGrams() {
        Weight oversized = new Weight(new BigDecimal("5000000"), WeightUnit.KG);

        assertThrows(ArithmeticException.class, oversized::toGrams);
        assertEquals(2, new Weight(new BigDecimal("2.7"), WeightUnit.G).toGrams());
    }

    @Test
    void returnsNothingWhenWeightAbsent() {
        assertNull(extractor.extractWeight("Crispy Potato Chips"));
        assertNull(extractor.extractWeight(null));
    }

    @Test
    void ignoresWeightsTooLargeToCountInGrams() {
        assertNull(extractor.extractWeight("8934563123456g"));
        assertNull(extractor.extractWeight("5000000kg"));
        assertEquals(new Weight(new BigDecimal("200"), WeightUnit.G),
                extractor.extractWeight("8934563123456 glucose syrup 200g"));
    }

    @Test
    void returnsEmptyInfoForEmptyText() {
        assertEquals(ProductInfo.empty(), extractor.extract(NormalizedText.empty()));
    }
}
