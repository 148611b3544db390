package com.example.foodscan.model.api;

import com.example.foodscan.model.PriceInfo;
import com.example.foodscan.model.ProductScan;
import com.example.foodscan.model.Weight;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of scanning the front of a pack")
public record ProductScanResponse(
        @Schema(description = "Product name", example = "Crispy Potato Chips") String productName,
        @Schema(description = "Declared weight as printed", example = "150g") String weight,
        @Schema(description = "Declared weight in grams", example = "150") Integer weightInGrams,
        @Schema(description = "Price details, when a price was supplied or found") PriceInfo price) {

    public static ProductScanResponse from(ProductScan scan) {
        Weight weight = scan.productInfo().weight();
        return new ProductScanResponse(
                scan.productInfo().name(),
                weight != null ? weight.toString() : null,
                weight != null ? weight.toGrams() : null,
                scan.priceInfo());
    }
}
