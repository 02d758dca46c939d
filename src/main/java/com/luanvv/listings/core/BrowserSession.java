package com.luanvv.listings.core;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One browser page owned by exactly one worker. Playwright objects are not thread safe, and
 * the currency menu state lives in the page, so a session is never shared between workers.
 */
@Slf4j
@RequiredArgsConstructor
public class BrowserSession implements AutoCloseable {
    private final Config config;
    @Getter private final String name;
    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    @Getter private Page page;
    @Getter private boolean currencySwitched;

    public void start() {
        if (page != null) {
            throw new IllegalStateException("Browser session '" + name + "' is already started");
        }
        long timeoutMs = config.getFetch().getTimeoutMs();
        playwright = Playwright.create();
        browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(config.isHeadless()));
        context = browser.newContext();
        context.setDefaultTimeout(timeoutMs);
        context.setDefaultNavigationTimeout(timeoutMs);
        page = context.newPage();
        log.info("Browser session '{}' started (headless={}, timeout={} ms)", name, config.isHeadless(), timeoutMs);
    }

    /** The currency menu drops its extra entry once any option was picked in this page. */
    public void markCurrencySwitched() {
        currencySwitched = true;
    }

    @Override
    public void close() {
        if (playwright == null) {
            return;
        }
        try {
            if (context != null) context.close();
            if (browser != null) browser.close();
        } finally {
            playwright.close();
            playwright = null;
            browser = null;
            context = null;
            page = null;
            log.info("Browser session '{}' closed", name);
        }
    }
}
