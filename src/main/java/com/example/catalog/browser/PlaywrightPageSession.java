package com.example.catalog.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Page session backed by its own Playwright driver, Chromium instance and page.
 *
 * Playwright objects are not thread-safe, so each session carries the whole
 * stack and is closed as a unit.
 */
public class PlaywrightPageSession implements PageSession {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    PlaywrightPageSession(Playwright playwright, Browser browser, BrowserContext context, Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    @Override
    public void navigate(String url) {
        try {
            page.navigate(url);
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
        } catch (PlaywrightException e) {
            throw new PageSessionException("Navigation failed: " + url, e);
        }
    }

    @Override
    public void waitForSelector(String selector) {
        try {
            page.waitForSelector(selector);
        } catch (PlaywrightException e) {
            throw new PageSessionException("Selector never appeared: " + selector + " on " + page.url(), e);
        }
    }

    @Override
    public void waitFor(Duration duration) {
        try {
            page.waitForTimeout(duration.toMillis());
        } catch (PlaywrightException e) {
            throw new PageSessionException("Wait failed on " + page.url(), e);
        }
    }

    @Override
    public int count(String selector) {
        try {
            return page.locator(selector).count();
        } catch (PlaywrightException e) {
            throw new PageSessionException("Count failed: " + selector, e);
        }
    }

    @Override
    public List<String> attributes(String selector, String attribute) {
        try {
            List<String> values = new ArrayList<>();
            for (Locator element : page.locator(selector).all()) {
                values.add(element.getAttribute(attribute));
            }
            return values;
        } catch (PlaywrightException e) {
            throw new PageSessionException("Reading @" + attribute + " of " + selector + " failed", e);
        }
    }

    @Override
    public String text(String selector) {
        try {
            String text = page.locator(selector).first().textContent();
            if (text == null) {
                throw new PageSessionException("No text content for " + selector + " on " + page.url());
            }
            return text;
        } catch (PlaywrightException e) {
            throw new PageSessionException("Reading text of " + selector + " failed on " + page.url(), e);
        }
    }

    @Override
    public Optional<String> text(String selector, Duration timeout) {
        try {
            String text = page.locator(selector).first()
                    .textContent(new Locator.TextContentOptions().setTimeout(timeout.toMillis()));
            return Optional.ofNullable(text);
        } catch (TimeoutError e) {
            return Optional.empty();
        } catch (PlaywrightException e) {
            throw new PageSessionException("Reading text of " + selector + " failed on " + page.url(), e);
        }
    }

    @Override
    public void scroll(int deltaY) {
        try {
            page.mouse().wheel(0, deltaY);
        } catch (PlaywrightException e) {
            throw new PageSessionException("Scroll failed on " + page.url(), e);
        }
    }

    @Override
    public String currentUrl() {
        return page.url();
    }

    @Override
    public void close() {
        // playwright.close() tears down anything the earlier calls left behind
        try {
            page.close();
            context.close();
            browser.close();
        } finally {
            playwright.close();
        }
    }
}
