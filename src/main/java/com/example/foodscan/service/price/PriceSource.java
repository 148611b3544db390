package com.example.foodscan.service.price;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Looks up the current price of a product, for example through an online shop search. Lookups
 * are asynchronous and may be cancelled through the returned future; the caller bounds them with
 * a timeout. Implementations can be wired in through Spring configuration.
 */
public interface PriceSource {

    /**
     * @param query product name and weight to search for
     * @return the first price string found, e.g. {@code ₫52,000}, or empty when nothing was found
     */
    CompletableFuture<Optional<String>> findPrice(PriceQuery query);
}
