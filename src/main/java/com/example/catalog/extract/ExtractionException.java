package com.example.catalog.extract;

import java.util.List;

/**
 * A mandatory product field could not be extracted.
 */
public class ExtractionException extends RuntimeException {

    private final String url;
    private final List<FieldResult<?>> failures;

    public ExtractionException(String url, List<FieldResult<?>> failures) {
        super("Could not extract " + url + ": " + failures);
        this.url = url;
        this.failures = List.copyOf(failures);
    }

    public String getUrl() {
        return url;
    }

    public List<FieldResult<?>> getFailures() {
        return failures;
    }
}
