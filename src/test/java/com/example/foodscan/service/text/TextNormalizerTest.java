package com.example.foodscan.service.text;

import com.example.foodscan.model.NormalizedText;
import com.example.foodscan.model.RawFragment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer(0.02);

    @Test
    void shouldGroupFragmentsIntoLinesByVerticalPosition() {
        List<RawFragment> fragments = List.of(
                new RawFragment("sugar", 0.9, 0.6, 0.101),
                new RawFragment("Ingredients:", 0.9, 0.1, 0.1),
                new RawFragment("flour,", 0.9, 0.4, 0.105),
                new RawFragment("salt", 0.9, 0.2, 0.3));

        NormalizedText text = normalizer.normalize(fragments, 0.5);

        assertThat(text.lines()).containsExactly("Ingredients: flour, sugar", "salt");
        assertThat(text.text()).isEqualTo("Ingredients: flour, sugar\nsalt");
    }

    @Test
    void shouldKeepFragmentsAtOrAboveThreshold() {
        List<RawFragment> fragments = List.of(
                new RawFragment("kept", 0.5, 0.1, 0.1),
                new RawFragment("dropped", 0.49, 0.2, 0.1),
                new RawFragment("also kept", 0.3, 0.1, 0.5));

        assertThat(normalizer.normalize(fragments, 0.5).lines()).containsExactly("kept");
        assertThat(normalizer.normalize(fragments, 0.3).lines()).containsExactly("kept dropped", "also kept");
    }

    @Test
    void shouldCollapseWhitespaceAndRepeatedCommas() {
        List<RawFragment> fragments = List.of(new RawFragment("  milk,, ,sugar   and\tsalt ", 0.9, 0.5, 0.5));

        assertThat(normalizer.normalize(fragments, 0.5).lines()).containsExactly("milk,sugar and salt");
    }

    @Test
    void shouldPreserveInputOrderForIdenticalPositions() {
        List<RawFragment> fragments = List.of(
                new RawFragment("first", 0.9, 0.5, 0.5),
                new RawFragment("second", 0.9, 0.5, 0.5),
                new RawFragment("third", 0.9, 0.5, 0.5));

        assertThat(normalizer.normalize(fragments, 0.5).text()).isEqualTo("first second third");
    }

    @Test
    void shouldStartNewLineRelativeToFirstFragmentOfLine() {
        List<RawFragment> fragments = List.of(
                new RawFragment("a", 0.9, 0.1, 0.10),
                new RawFragment("b", 0.9, 0.2, 0.115),
                new RawFragment("c", 0.9, 0.3, 0.13));

        assertThat(normalizer.normalize(fragments, 0.5).lines()).containsExactly("a b", "c");
    }

    @Test
    void shouldReturnEmptyTextWhenNothingPassesThreshold() {
        List<RawFragment> fragments = List.of(
                new RawFragment("blurry", 0.1, 0.5, 0.5),
                new RawFragment("   ", 0.9, 0.5, 0.6));

        assertThat(normalizer.normalize(fragments, 0.5).isEmpty()).isTrue();
        assertThat(normalizer.normalize(List.of(), 0.5).text()).isEmpty();
    }

    @Test
    void shouldBeDeterministic() {
        List<RawFragment> fragments = List.of(
                new RawFragment("Net", 0.9, 0.1, 0.8),
                new RawFragment("Wt 150g", 0.9, 0.3, 0.81),
                new RawFragment("Potato Chips", 0.9, 0.2, 0.2));

        assertThat(normalizer.normalize(fragments, 0.3)).isEqualTo(normalizer.normalize(fragments, 0.3));
    }

    @Test
    void shouldRejectNullInput() {
        assertThatThrownBy(() -> normalizer.normalize(null, 0.5))
                .isInstanceOf(IllegalArgumentException.class);

        List<RawFragment> withNull = new ArrayList<>();
        withNull.add(null);
        assertThatThrownBy(() -> normalizer.normalize(withNull, 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectFragmentsOutsideUnitInterval() {
        assertThatThrownBy(() -> new RawFragment("x", 1.2, 0.5, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confidence");
        assertThatThrownBy(() -> new RawFragment("x", 0.5, -0.1, 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("centerX");
    }
}
