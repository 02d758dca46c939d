package com.luanvv.listings.crawl;

import com.luanvv.listings.core.BrowserSession;
import com.luanvv.listings.core.Config;
import com.luanvv.listings.core.FetchException;
import com.luanvv.listings.core.PageFetcher;
import com.luanvv.listings.core.RenderedPage;
import com.luanvv.listings.core.Retryer;
import com.luanvv.listings.core.Selectors;
import com.luanvv.listings.core.UrlUtils;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Walks the listing pages of one target in order and crawls every detail link found on them.
 * Listing pages must load: failing to read one aborts the target. Detail links may fail on
 * their own without affecting the rest.
 */
@Slf4j
@RequiredArgsConstructor
public class PageWalker {
    private final Config config;
    private final PageFetcher fetcher;
    private final DetailCrawler detailCrawler;
    private final Retryer retryer;

    public TargetOutcome walk(BrowserSession session, Config.Target target) {
        String baseUrl = config.targetUrl(target);
        TargetOutcome outcome = new TargetOutcome(target.getId(), target.getPropertyType());
        var startTime = System.currentTimeMillis();

        int pageCount = retrying("page count of " + target.getId(), () -> discoverPageCount(session, baseUrl));
        outcome.setPages(pageCount);
        log.info("Target {}: {} listing pages at {}", target.getId(), pageCount, baseUrl);

        for (int page = 1; page <= pageCount; page++) {
            final int pageNumber = page;
            String pageUrl = UrlUtils.withPage(baseUrl, pageNumber);
            List<String> links = retrying("links of " + pageUrl, () -> discoverLinks(session, pageUrl, pageNumber));
            log.info("Page {}/{} of {}: {} links", pageNumber, pageCount, target.getId(), links.size());
            outcome.setLinks(outcome.getLinks() + links.size());

            for (String link : links) {
                detailCrawler.crawl(session, link, target.getPropertyType())
                    .ifPresentOrElse(outcome.getResults()::add, () -> outcome.getFailedLinks().add(link));
            }
        }

        var duration = System.currentTimeMillis() - startTime;
        log.info("Target {} done in {} ms: {} recorded, {} failed, {} degraded fields", target.getId(), duration,
            outcome.getResults().size(), outcome.getFailedLinks().size(), outcome.degradedFields());
        return outcome;
    }

    int discoverPageCount(BrowserSession session, String url) {
        RenderedPage rendered = fetcher.fetchRendered(url, session);
        return pageCount(Jsoup.parse(rendered.getHtml(), url));
    }

    List<String> discoverLinks(BrowserSession session, String pageUrl, int pageNumber) {
        RenderedPage rendered = fetcher.fetchRendered(pageUrl, session);
        List<String> links = links(Jsoup.parse(rendered.getHtml(), pageUrl));
        // the first page of a live target always lists something; an empty one did not render
        if (links.isEmpty() && pageNumber == 1) {
            throw new FetchException("No listings on " + pageUrl, null);
        }
        return links;
    }

    /** The pagination ends with a "next" item; the item before it holds the last page number. */
    static int pageCount(Document doc) {
        Elements items = doc.select(Selectors.PAGINATION_ITEM);
        if (items.size() < 2) {
            return 1;
        }
        String text = items.get(items.size() - 2).text().trim();
        try {
            return Math.max(1, Integer.parseInt(text));
        } catch (NumberFormatException e) {
            log.warn("Unreadable last page number '{}', crawling the first page only", text);
            return 1;
        }
    }

    static List<String> links(Document doc) {
        Set<String> links = new LinkedHashSet<>();
        for (Element item : doc.select(Selectors.LISTING_ITEM)) {
            Element anchor = item.selectFirst(Selectors.LISTING_LINK);
            if (anchor == null) continue;
            String href = anchor.absUrl("href");
            if (href.isEmpty()) {
                href = anchor.attr("href");
            }
            if (!href.isBlank()) {
                links.add(href);
            }
        }
        return new ArrayList<>(links);
    }

    private <T> T retrying(String opName, Callable<T> callable) {
        try {
            return retryer.runWithRetry(opName, callable);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlAbortedException("Interrupted during " + opName, e);
        } catch (Exception e) {
            throw new CrawlAbortedException(opName + " failed: " + e.getMessage(), e);
        }
    }
}
