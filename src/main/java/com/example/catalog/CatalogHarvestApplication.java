package com.example.catalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the catalog crawler.
 */
@SpringBootApplication
public class CatalogHarvestApplication {

    public static void main(String[] args) {
        SpringApplication.run(CatalogHarvestApplication.class, args);
    }
}
