package com.example.foodscan.service;

import com.example.foodscan.config.FoodScanProperties;
import com.example.foodscan.model.CaloriesValue;
import com.example.foodscan.model.ClassificationResult;
import com.example.foodscan.model.LabelAnalysis;
import com.example.foodscan.model.LabelSections;
import com.example.foodscan.model.NormalizedText;
import com.example.foodscan.model.RawFragment;
import com.example.foodscan.service.classification.DietaryClassifier;
import com.example.foodscan.service.label.SectionSegmenter;
import com.example.foodscan.service.nutrition.CaloriesExtractor;
import com.example.foodscan.service.text.LanguageFilter;
import com.example.foodscan.service.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Runs the ingredient-label pipeline: normalize, keep English lines, split into sections, then
 * classify the ingredients and read the calories. Each call resolves its future exactly once.
 */
@Service
public class LabelScanService {

    private static final Logger log = LoggerFactory.getLogger(LabelScanService.class);

    static final String NO_TEXT_MESSAGE = "No text could be read from the label. Please scan again.";

    private final TextNormalizer normalizer;
    private final LanguageFilter languageFilter;
    private final SectionSegmenter segmenter;
    private final DietaryClassifier classifier;
    private final CaloriesExtractor caloriesExtractor;
    private final FoodScanProperties properties;
    private final Executor executor;

    public LabelScanService(TextNormalizer normalizer,
                            LanguageFilter languageFilter,
                            SectionSegmenter segmenter,
                            DietaryClassifier classifier,
                            CaloriesExtractor caloriesExtractor,
                            FoodScanProperties properties,
                            @Qualifier("labelScanExecutor") Executor executor) {
        this.normalizer = normalizer;
        this.languageFilter = languageFilter;
        this.segmenter = segmenter;
        this.classifier = classifier;
        this.caloriesExtractor = caloriesExtractor;
        this.properties = properties;
        this.executor = executor;
    }

    public CompletableFuture<LabelAnalysis> analyze(List<RawFragment> fragments) {
        if (fragments == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Fragments must not be null"));
        }
        double threshold = properties.ocr().labelConfidenceThreshold();
        return submit(() -> normalizer.normalize(fragments, threshold))
                .thenCompose(this::analyzeNormalized);
    }

    public CompletableFuture<LabelAnalysis> analyzeText(String text) {
        if (text == null || text.isBlank()) {
            return CompletableFuture.failedFuture(new NoLabelTextException(NO_TEXT_MESSAGE));
        }
        List<String> lines = text.lines()
                .map(TextNormalizer::cleanLine)
                .filter(line -> !line.isEmpty())
                .toList();
        return submit(() -> new NormalizedText(lines))
                .thenCompose(this::analyzeNormalized);
    }

    private CompletableFuture<NormalizedText> submit(Supplier<NormalizedText> task) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException ex) {
            log.warn("Label scan rejected, executor is saturated: {}", ex.getMessage());
            return CompletableFuture.failedFuture(ex);
        }
    }

    private CompletableFuture<LabelAnalysis> analyzeNormalized(NormalizedText normalized) {
        if (normalized.isEmpty()) {
            log.debug("Label capture produced no text");
            return CompletableFuture.failedFuture(new NoLabelTextException(NO_TEXT_MESSAGE));
        }
        return CompletableFuture.completedFuture(runPipeline(normalized.text()));
    }

    LabelAnalysis runPipeline(String originalText) {
        String translated = languageFilter.translateToEnglish(originalText);
        String language = languageFilter.detectLanguage(originalText);
        LabelSections sections = segmenter.segment(translated);
        ClassificationResult classification = classifier.classify(sections.ingredientsText());
        CaloriesValue calories = caloriesExtractor.extract(sections.ingredientsText());
        log.debug("Label analysed: language={}, category={}, calories={}",
                language, classification.category(), calories);
        return new LabelAnalysis(originalText, translated, language, sections, classification, calories);
    }
}
