package com.example.catalog.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;

import java.time.Duration;

/**
 * Launches a dedicated headless (by default) Chromium for every session.
 */
public class PlaywrightSessionFactory implements PageSessionFactory {

    private final boolean headless;
    private final Duration defaultTimeout;
    private final String locale;

    public PlaywrightSessionFactory(boolean headless, Duration defaultTimeout, String locale) {
        this.headless = headless;
        this.defaultTimeout = defaultTimeout;
        this.locale = locale;
    }

    @Override
    public PageSession open() {
        Playwright playwright = Playwright.create();
        try {
            Browser browser = playwright.chromium().launch(
                    new BrowserType.LaunchOptions().setHeadless(headless)
            );

            BrowserContext context = browser.newContext(
                    new Browser.NewContextOptions()
                            .setLocale(locale)
                            .setViewportSize(1400, 900)
            );

            Page page = context.newPage();
            page.setDefaultTimeout(defaultTimeout.toMillis());

            return new PlaywrightPageSession(playwright, browser, context, page);
        } catch (PlaywrightException e) {
            playwright.close();
            throw new PageSessionException("Could not launch browser", e);
        }
    }
}
