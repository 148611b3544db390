package com.example.foodscan.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Parsed price with conversion to Indian Rupee")
public record PriceInfo(
        @Schema(description = "Detected currency of the input price") Currency currency,
        @Schema(description = "Price as supplied", example = "₫50000") String localAmountText,
        @Schema(description = "Price converted to rupee, or a reason why it could not be", example = "₹165.00") String convertedAmountText,
        @Schema(description = "Price per kilogram when a weight was supplied", example = "₫100000/kg (₹330.00/kg)") String perKilogramText) {
}
