package com.example.foodscan.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

public record TextRequest(
        @Schema(description = "Label text, one logical line per line break", example = "wheat flour, sugar, milk solids",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        String text) {
}
