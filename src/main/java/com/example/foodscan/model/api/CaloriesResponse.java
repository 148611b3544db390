package com.example.foodscan.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

public record CaloriesResponse(
        @Schema(description = "Declared energy or the not-listed sentinel", example = "250 kcal") String calories) {
}
