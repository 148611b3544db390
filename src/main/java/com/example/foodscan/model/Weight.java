package com.example.foodscan.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

@Schema(description = "Declared net weight or volume")
public record Weight(
        @Schema(description = "Numeric amount", example = "500") BigDecimal value,
        @Schema(description = "Unit of the amount", example = "G") WeightUnit unit) {

    private static final BigDecimal GRAMS_PER_KILOGRAM = BigDecimal.valueOf(1000);

    public Weight {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(unit, "unit");
    }

    /**
     * Weight in whole grams, fractions truncated. Millilitres count as grams.
     *
     * @throws ArithmeticException when the weight does not fit in an {@code int} number of grams
     */
    public int toGrams() {
        BigDecimal grams = unit == WeightUnit.KG ? value.multiply(GRAMS_PER_KILOGRAM) : value;
        return grams.setScale(0, RoundingMode.DOWN).intValueExact();
    }

    @Override
    public String toString() {
        return value.toPlainString() + unit.symbol();
    }
}
