package com.luanvv.listings.core;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class PlaywrightPageFetcher implements PageFetcher {
    private final Config config;
    private final RateLimiter limiter;

    @Override
    public RenderedPage fetchRendered(String url, BrowserSession session, InteractionScript script) {
        Page page = session.getPage();
        if (page == null) {
            throw new IllegalStateException("Browser session '" + session.getName() + "' is not started");
        }
        double timeout = config.getFetch().getTimeoutMs();
        try {
            limiter.acquire();
            log.debug("Navigate: {}", url);
            page.navigate(url, new Page.NavigateOptions().setTimeout(timeout));
            page.waitForLoadState();
            if (script != null) {
                for (InteractionScript.Step step : script.getSteps()) {
                    Locator locator = page.locator(step.getSelector()).nth(step.getNth());
                    if (step.getAction() == InteractionScript.Action.CLICK) {
                        locator.click(new Locator.ClickOptions().setTimeout(timeout));
                    }
                }
                page.waitForLoadState();
            }
            return new RenderedPage(url, page.url(), page.content());
        } catch (PlaywrightException e) {
            throw new FetchException("Fetch failed for " + url
                + (script != null ? " with [" + script + "]" : "") + ": " + e.getMessage(), e);
        }
    }
}
