package com.example.catalog.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure text clean-up for product page fields.
 */
public final class ProductTextParser {

    // " 500 G." / " 1L." at the very end of a name
    private static final Pattern QUANTITY_SUFFIX = Pattern.compile("\\s(\\d+ ?[A-Za-z]{1,2}\\.)$");
    private static final Pattern LEADING_QUALIFIER = Pattern.compile("^\\([^)]*\\)\\s*");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Za-z0-9]");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");
    private static final Pattern DECIMAL = Pattern.compile("\\d+(\\.\\d+)?|\\.\\d+");

    private ProductTextParser() {}

    public static NameAndQuantity splitNameAndQuantity(String rawName) {
        Matcher m = QUANTITY_SUFFIX.matcher(rawName);
        if (!m.find()) {
            return new NameAndQuantity(rawName, null);
        }

        String quantity = NON_ALPHANUMERIC.matcher(m.group(1)).replaceAll("");
        String rest = rawName.substring(0, m.start()).trim();
        String name = rest.isEmpty() ? "" : String.join(" ", rest.split("\\s+"));
        name = LEADING_QUALIFIER.matcher(name).replaceFirst("");
        return new NameAndQuantity(name, quantity);
    }

    /**
     * Collapses runs of spaces and tabs and trims. Line breaks are kept.
     */
    public static String collapseWhitespace(String text) {
        return HORIZONTAL_WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Parses a displayed price such as "45.00". Anything else, including signs,
     * currency symbols and exponents, is rejected.
     */
    public static OptionalDouble parsePrice(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        String trimmed = text.strip();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(trimmed));
    }

    public static List<String> cleanLabels(List<String> raw) {
        List<String> labels = new ArrayList<>();
        for (String label : raw) {
            if (label == null) {
                continue;
            }
            String trimmed = label.strip();
            if (!trimmed.isEmpty()) {
                labels.add(trimmed);
            }
        }
        return labels;
    }
}
