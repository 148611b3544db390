package com.example.foodscan.model.api;

import com.example.foodscan.model.RawFragment;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record LabelScanRequest(
        @Schema(description = "Text fragments recognized on the ingredient label", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        List<RawFragment> fragments) {
}
