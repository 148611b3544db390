package com.example.foodscan.controller;

import com.example.foodscan.service.price.PriceParser;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PriceController.class)
@Import(PriceControllerTest.TestConfig.class)
class PriceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void convertReportsDongPrice() throws Exception {
        mockMvc.perform(post("/api/v1/prices/convert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": \"₫50000\", \"weightInGrams\": 500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currency").value("VIETNAMESE_DONG"))
                .andExpect(jsonPath("$.perKilogramText").exists());
    }

    @Test
    void convertReportsUnsupportedCurrency() throws Exception {
        mockMvc.perform(post("/api/v1/prices/convert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": \"$5\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currency").value("UNSUPPORTED"))
                .andExpect(jsonPath("$.convertedAmountText").value("Currency not supported"))
                .andExpect(jsonPath("$.perKilogramText").doesNotExist());
    }

    @Test
    void convertReturnsBadRequestWhenPriceBlank() throws Exception {
        mockMvc.perform(post("/api/v1/prices/convert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void convertReturnsBadRequestForMalformedJson() throws Exception {
        mockMvc.perform(post("/api/v1/prices/convert")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"price\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed request body"));
    }

    @TestConfiguration
    static class TestConfig {

        @Bean
        PriceParser priceParser() {
            return new PriceParser(0.0033);
        }
    }
}
