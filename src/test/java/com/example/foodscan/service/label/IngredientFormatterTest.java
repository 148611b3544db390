package com.example.foodscan.service.label;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IngredientFormatterTest {

    private final IngredientFormatter formatter = new IngredientFormatter();

    @Test
    void shouldSortCaseInsensitivelyWithoutMergingCaseVariants() {
        assertThat(formatter.format("Salt, salt, Flour")).isEqualTo("• Flour\n• Salt\n• salt");
    }

    @Test
    void shouldStripLeadingIngredientsHeader() {
        assertThat(formatter.format("Ingredients: sugar, cocoa")).isEqualTo("• cocoa\n• sugar");
        assertThat(formatter.format("INGREDIENT sugar")).isEqualTo("• sugar");
    }

    @Test
    void shouldDropContactAndManufacturerLines() {
        String text = "wheat flour, sugar\nManufactured by ACME Foods\nwww.acme.com\nTel: 555 0100";

        assertThat(formatter.format(text)).isEqualTo("• sugar\n• wheat flour");
    }

    @Test
    void shouldDropReferenceNumberLines() {
        assertThat(formatter.format("wheat, oats\nLot 12345\n20240101 best")).isEqualTo("• oats\n• wheat");
    }

    @Test
    void shouldKeepLongLinesContainingNumbers() {
        assertThat(formatter.format("vitamin premix 1000 mg per serving"))
                .isEqualTo("• vitamin premix 1000 mg per serving");
    }

    @Test
    void shouldSplitOnSemicolonWhenNoComma() {
        assertThat(formatter.format("rice; water; salt")).isEqualTo("• rice\n• salt\n• water");
    }

    @Test
    void shouldSplitOnLineBreaksAsLastResort() {
        assertThat(formatter.format("water\nrice")).isEqualTo("• rice\n• water");
    }

    @Test
    void shouldJoinLinesInsideCommaSeparatedEntries() {
        assertThat(formatter.format("wheat\nflour, sugar")).isEqualTo("• sugar\n• wheat flour");
    }

    @Test
    void shouldFallBackToEnglishWordsWhenEveryLineIsFiltered() {
        assertThat(formatter.format("成分 sugar 塩")).isEqualTo("• sugar");
    }

    @Test
    void shouldDropSingleCharacterEntries() {
        assertThat(formatter.format("a, rice, b")).isEqualTo("• rice");
    }

    @Test
    void shouldDropLinesShorterThanThreeCharacters() {
        assertThat(formatter.format("rice, water\nab")).isEqualTo("• rice\n• water");
    }

    @Test
    void shouldReturnEmptyForBlankInput() {
        assertThat(formatter.format("  ")).isEmpty();
        assertThat(formatter.format(null)).isEmpty();
    }
}
