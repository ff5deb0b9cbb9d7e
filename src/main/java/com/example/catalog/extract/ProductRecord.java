package com.example.catalog.extract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One product as scraped from its store page.
 *
 * {@code details} is kept in memory for callers that want it but is not part
 * of the written record.
 */
@JsonPropertyOrder({"name", "quantity", "price", "images", "barcode", "labels", "store_url"})
public record ProductRecord(
        String name,
        String quantity,
        double price,
        List<String> images,
        String barcode,
        List<String> labels,
        @JsonProperty("store_url") String storeUrl,
        @JsonIgnore String details
) {

    public ProductRecord {
        if (!(price >= 0) || Double.isInfinite(price)) {
            throw new IllegalArgumentException("price must be a finite non-negative number: " + price);
        }
        images = List.copyOf(images);
        labels = List.copyOf(labels);
    }
}
