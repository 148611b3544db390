package com.example.foodscan.service;

import com.example.foodscan.config.FoodScanProperties;
import com.example.foodscan.model.NormalizedText;
import com.example.foodscan.model.PriceInfo;
import com.example.foodscan.model.ProductInfo;
import com.example.foodscan.model.ProductScan;
import com.example.foodscan.model.RawFragment;
import com.example.foodscan.service.price.PriceParser;
import com.example.foodscan.service.price.PriceQuery;
import com.example.foodscan.service.price.PriceSource;
import com.example.foodscan.service.product.ProductInfoExtractor;
import com.example.foodscan.service.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs the front-of-pack pipeline: product name and weight from the capture, then the price,
 * either as supplied by the caller or looked up through the configured {@link PriceSource}.
 */
@Service
public class ProductScanService {

    private static final Logger log = LoggerFactory.getLogger(ProductScanService.class);

    private final TextNormalizer normalizer;
    private final ProductInfoExtractor extractor;
    private final PriceParser priceParser;
    private final PriceSource priceSource;
    private final FoodScanProperties properties;
    private final Executor executor;

    public ProductScanService(TextNormalizer normalizer,
                              ProductInfoExtractor extractor,
                              PriceParser priceParser,
                              PriceSource priceSource,
                              FoodScanProperties properties,
                              @Qualifier("labelScanExecutor") Executor executor) {
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.priceParser = priceParser;
        this.priceSource = priceSource;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * @param fragments     front-of-pack OCR output
     * @param priceText     price entered by the user, or {@code null} to look it up
     * @param weightInGrams weight entered by the user, used when none is printed on the pack
     */
    public CompletableFuture<ProductScan> scan(List<RawFragment> fragments, String priceText, Integer weightInGrams) {
        if (fragments == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Fragments must not be null"));
        }
        double threshold = properties.ocr().frontConfidenceThreshold();
        CompletableFuture<ProductInfo> extraction;
        try {
            extraction = CompletableFuture.supplyAsync(() -> {
                NormalizedText text = normalizer.normalize(fragments, threshold);
                return extractor.extract(text);
            }, executor);
        } catch (RejectedExecutionException ex) {
            log.warn("Product scan rejected, executor is saturated: {}", ex.getMessage());
            return CompletableFuture.failedFuture(ex);
        }
        return extraction.thenCompose(info -> resolvePrice(info, priceText, weightInGrams)
                .thenApply(price -> new ProductScan(info, price)));
    }

    private CompletableFuture<PriceInfo> resolvePrice(ProductInfo info, String priceText, Integer weightInGrams) {
        Integer grams = info.weight() != null ? Integer.valueOf(info.weight().toGrams()) : weightInGrams;
        if (priceText != null && !priceText.isBlank()) {
            return CompletableFuture.completedFuture(priceParser.convert(priceText.trim(), grams));
        }

        Optional<PriceQuery> query = PriceQuery.from(info, weightInGrams);
        if (query.isEmpty()) {
            log.debug("Could not extract product information for a price lookup");
            return CompletableFuture.completedFuture(null);
        }

        Duration timeout = properties.price().lookupTimeout();
        return priceSource.findPrice(query.get())
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((price, ex) -> {
                    if (ex != null) {
                        log.warn("Price lookup for '{}' failed: {}", query.get().text(), ex.toString());
                        return null;
                    }
                    if (price == null) {
                        return null;
                    }
                    return price.map(value -> priceParser.convert(value, grams)).orElse(null);
                });
    }
}
