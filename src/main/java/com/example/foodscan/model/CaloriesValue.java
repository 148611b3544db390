package com.example.foodscan.model;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Energy declared on a label, or the "not listed" sentinel.
 */
public final class CaloriesValue {

    public static final String NOT_LISTED = "Calories not listed";
    public static final String UNIT = "kcal";

    private static final CaloriesValue NONE = new CaloriesValue(null);

    private final Long amount;

    private CaloriesValue(Long amount) {
        this.amount = amount;
    }

    public static CaloriesValue of(long amount) {
        return new CaloriesValue(amount);
    }

    public static CaloriesValue notListed() {
        return NONE;
    }

    public boolean isListed() {
        return amount != null;
    }

    public OptionalLong amount() {
        return amount == null ? OptionalLong.empty() : OptionalLong.of(amount);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CaloriesValue that)) {
            return false;
        }
        return Objects.equals(amount, that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(amount);
    }

    @Override
    public String toString() {
        return amount == null ? NOT_LISTED : amount + " " + UNIT;
    }
}
