package com.example.catalog.browser;

/**
 * Opens fresh page sessions. Whoever calls {@link #open()} owns the session and
 * must close it.
 */
@FunctionalInterface
public interface PageSessionFactory {

    PageSession open();
}
