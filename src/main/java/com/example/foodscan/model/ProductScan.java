package com.example.foodscan.model;

/**
 * Everything derived from one front-of-pack capture. {@code priceInfo} is null when no price was
 * supplied or found.
 */
public record ProductScan(ProductInfo productInfo, PriceInfo priceInfo) {
}
