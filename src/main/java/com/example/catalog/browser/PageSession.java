package com.example.catalog.browser;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * One isolated browser page. Implementations are confined to the thread that
 * opened them.
 *
 * Every method except {@link #close()} may block on the network or the page.
 * Failures surface as {@link PageSessionException}.
 */
public interface PageSession extends AutoCloseable {

    void navigate(String url);

    /**
     * Blocks until at least one element matches the selector.
     */
    void waitForSelector(String selector);

    void waitFor(Duration duration);

    int count(String selector);

    /**
     * Reads an attribute from every element matching the selector, in document
     * order. Elements without the attribute yield {@code null} entries.
     */
    List<String> attributes(String selector, String attribute);

    /**
     * Text content of the first match, waiting up to the session's default
     * timeout for it to appear.
     */
    String text(String selector);

    /**
     * Text content of the first match, or empty if nothing matches within the
     * timeout.
     */
    Optional<String> text(String selector, Duration timeout);

    /**
     * Mouse-wheel scroll by the given vertical delta.
     */
    void scroll(int deltaY);

    String currentUrl();

    @Override
    void close();
}
