package com.example.foodscan.config;

import com.example.foodscan.service.classification.DietaryClassifier;
import com.example.foodscan.service.label.IngredientFormatter;
import com.example.foodscan.service.label.SectionSegmenter;
import com.example.foodscan.service.nutrition.CaloriesExtractor;
import com.example.foodscan.service.price.NoOpPriceSource;
import com.example.foodscan.service.price.PriceParser;
import com.example.foodscan.service.price.PriceSource;
import com.example.foodscan.service.product.ProductInfoExtractor;
import com.example.foodscan.service.text.LanguageFilter;
import com.example.foodscan.service.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the label pipeline stages. The stages are plain, stateless classes; their tunables come
 * from {@link FoodScanProperties}.
 */
@Configuration
public class LabelPipelineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LabelPipelineConfiguration.class);

    @Bean
    public TextNormalizer textNormalizer(FoodScanProperties properties) {
        return new TextNormalizer(properties.ocr().lineTolerance());
    }

    @Bean
    public LanguageFilter languageFilter() {
        return new LanguageFilter();
    }

    @Bean
    public IngredientFormatter ingredientFormatter() {
        return new IngredientFormatter();
    }

    @Bean
    public SectionSegmenter sectionSegmenter(FoodScanProperties properties, IngredientFormatter formatter) {
        return new SectionSegmenter(properties.sections().toHeaders(), formatter);
    }

    @Bean
    public DietaryClassifier dietaryClassifier(FoodScanProperties properties) {
        return new DietaryClassifier(properties.classifier().toKeywords());
    }

    @Bean
    public CaloriesExtractor caloriesExtractor() {
        return new CaloriesExtractor();
    }

    @Bean
    public ProductInfoExtractor productInfoExtractor() {
        return new ProductInfoExtractor();
    }

    @Bean
    public PriceParser priceParser(FoodScanProperties properties) {
        log.info("Converting Vietnamese Dong to Indian Rupee at a fixed rate of {}", properties.price().dongToRupeeRate());
        return new PriceParser(properties.price().dongToRupeeRate());
    }

    /**
     * Projects with an online price search can replace this bean with their own {@link PriceSource}.
     */
    @Bean
    public PriceSource priceSource() {
        log.info("No online price source configured; prices are only parsed when supplied by the caller.");
        return new NoOpPriceSource();
    }

    @Bean(name = "labelScanExecutor")
    public ThreadPoolTaskExecutor labelScanExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("label-scan-");
        executor.initialize();
        return executor;
    }
}
