package com.example.catalog.browser;

/**
 * A navigation or content query failed inside a page session.
 */
public class PageSessionException extends RuntimeException {

    public PageSessionException(String message) {
        super(message);
    }

    public PageSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
