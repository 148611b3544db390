package com.example.foodscan.service.price;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Default source used when no online price search is configured. It never finds a price.
 */
public class NoOpPriceSource implements PriceSource {

    @Override
    public CompletableFuture<Optional<String>> findPrice(PriceQuery query) {
        return CompletableFuture.completedFuture(Optional.empty());
    }
}
