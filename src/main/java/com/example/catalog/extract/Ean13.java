package com.example.catalog.extract;

import java.util.Optional;

/**
 * EAN-13 check digit validation.
 *
 * See https://en.wikipedia.org/wiki/International_Article_Number#Calculation_of_checksum_digit
 */
public final class Ean13 {

    private static final int LENGTH = 13;

    private Ean13() {}

    public static boolean isValid(String code) {
        if (code == null || code.length() != LENGTH) {
            return false;
        }
        int sum = 0;
        for (int i = 0; i < LENGTH; i++) {
            char c = code.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
            if (i < LENGTH - 1) {
                sum += (c - '0') * (i % 2 == 0 ? 1 : 3);
            }
        }
        int check = (10 - sum % 10) % 10;
        return check == code.charAt(LENGTH - 1) - '0';
    }

    /**
     * Reads the barcode from sku text like "SKU 8850123456789": the last
     * whitespace-separated token, labelled "EAN-13 ..." when it validates.
     */
    public static Optional<String> fromSku(String skuText) {
        if (skuText == null) {
            return Optional.empty();
        }
        String[] tokens = skuText.trim().split("\\s+");
        String candidate = tokens[tokens.length - 1];
        return isValid(candidate) ? Optional.of("EAN-13 " + candidate) : Optional.empty();
    }
}
