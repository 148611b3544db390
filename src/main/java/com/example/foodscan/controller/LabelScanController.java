package com.example.foodscan.controller;

import com.example.foodscan.model.api.CaloriesResponse;
import com.example.foodscan.model.api.ClassificationResponse;
import com.example.foodscan.model.api.ErrorResponse;
import com.example.foodscan.model.api.LabelScanRequest;
import com.example.foodscan.model.api.LabelScanResponse;
import com.example.foodscan.model.api.TextRequest;
import com.example.foodscan.service.LabelScanService;
import com.example.foodscan.service.classification.DietaryClassifier;
import com.example.foodscan.service.nutrition.CaloriesExtractor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping(path = "/api/v1/labels", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Ingredient labels")
@Validated
public class LabelScanController {

    private final LabelScanService labelScanService;
    private final DietaryClassifier classifier;
    private final CaloriesExtractor caloriesExtractor;

    public LabelScanController(LabelScanService labelScanService,
                               DietaryClassifier classifier,
                               CaloriesExtractor caloriesExtractor) {
        this.labelScanService = labelScanService;
        this.classifier = classifier;
        this.caloriesExtractor = caloriesExtractor;
    }

    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Analyze an ingredient label",
            description = "Groups recognized fragments into lines, keeps the English text, splits it into sections, "
                    + "classifies the ingredients and reads the declared calories",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Label analysis",
                            content = @Content(schema = @Schema(implementation = LabelScanResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid payload",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "422", description = "No readable text on the label",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public CompletableFuture<LabelScanResponse> analyze(@Valid @RequestBody LabelScanRequest request) {
        return labelScanService.analyze(request.fragments()).thenApply(LabelScanResponse::from);
    }

    @PostMapping(value = "/classify", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Classify ingredient text as vegan, vegetarian or not",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Dietary classification",
                            content = @Content(schema = @Schema(implementation = ClassificationResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid payload",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public ClassificationResponse classify(@Valid @RequestBody TextRequest request) {
        return ClassificationResponse.from(classifier.classify(request.text()));
    }

    @PostMapping(value = "/calories", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Read the declared calories from label text",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Calories or the not-listed sentinel",
                            content = @Content(schema = @Schema(implementation = CaloriesResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid payload",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public CaloriesResponse calories(@Valid @RequestBody TextRequest request) {
        return new CaloriesResponse(caloriesExtractor.extract(request.text()).toString());
    }
}
