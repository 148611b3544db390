package com.example.foodscan;

import com.example.foodscan.config.FoodScanProperties;
import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@OpenAPIDefinition(
        info = @Info(
                title = "FoodScan Label Reader API",
                version = "1.0",
                description = "REST API for reading ingredient labels and product fronts: sections, dietary classification, calories and prices.",
                contact = @Contact(name = "FoodScan Label Reader")))
@SpringBootApplication
@EnableConfigurationProperties(FoodScanProperties.class)
public class FoodScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(FoodScanApplication.class, args);
    }
}
