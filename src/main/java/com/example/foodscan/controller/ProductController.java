package com.example.foodscan.controller;

import com.example.foodscan.model.api.ErrorResponse;
import com.example.foodscan.model.api.FrontOfPackRequest;
import com.example.foodscan.model.api.ProductScanResponse;
import com.example.foodscan.service.ProductScanService;
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
@RequestMapping(path = "/api/v1/products", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Front of pack")
@Validated
public class ProductController {

    private final ProductScanService productScanService;

    public ProductController(ProductScanService productScanService) {
        this.productScanService = productScanService;
    }

    @PostMapping(value = "/front", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Read product name, weight and price from the front of a pack",
            description = "Uses the supplied price when present, otherwise asks the configured price source",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Product details",
                            content = @Content(schema = @Schema(implementation = ProductScanResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid payload",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public CompletableFuture<ProductScanResponse> scanFront(@Valid @RequestBody FrontOfPackRequest request) {
        return productScanService.scan(request.fragments(), request.priceText(), request.weightInGrams())
                .thenApply(ProductScanResponse::from);
    }
}
