package com.example.foodscan.controller;

import com.example.foodscan.model.PriceInfo;
import com.example.foodscan.model.api.ErrorResponse;
import com.example.foodscan.model.api.PriceConversionRequest;
import com.example.foodscan.service.price.PriceParser;
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

@RestController
@RequestMapping(path = "/api/v1/prices", produces = MediaType.APPLICATION_JSON_VALUE)
@Tag(name = "Prices")
@Validated
public class PriceController {

    private final PriceParser priceParser;

    public PriceController(PriceParser priceParser) {
        this.priceParser = priceParser;
    }

    @PostMapping(value = "/convert", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Convert a Dong or Rupee price and normalize it per kilogram",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Converted price",
                            content = @Content(schema = @Schema(implementation = PriceInfo.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid payload",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    public PriceInfo convert(@Valid @RequestBody PriceConversionRequest request) {
        return priceParser.convert(request.price().trim(), request.weightInGrams());
    }
}
