package com.example.catalog.extract;

/**
 * A product name with its pack size split off, e.g. "Fresh Milk" / "1L".
 */
public record NameAndQuantity(String name, String quantity) {
}
