package com.luanvv.listings.crawl;

import com.luanvv.listings.core.BrowserSession;
import com.luanvv.listings.core.Config;
import com.luanvv.listings.core.InteractionScript;
import com.luanvv.listings.core.PageFetcher;
import com.luanvv.listings.core.RenderedPage;
import com.luanvv.listings.core.Retryer;
import com.luanvv.listings.extract.DetailView;
import com.luanvv.listings.extract.ExtractionResult;
import com.luanvv.listings.extract.FieldExtractor;
import com.luanvv.listings.model.PropertyType;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Crawls one detail link: renders it in USD, then in the local currency, then extracts the
 * listing. The whole attempt is retried; once the budget is spent the link is given up and
 * nothing is recorded for it.
 */
@Slf4j
@RequiredArgsConstructor
public class DetailCrawler {
    private final Config config;
    private final PageFetcher fetcher;
    private final FieldExtractor extractor;
    private final Retryer retryer;

    public Optional<ExtractionResult> crawl(BrowserSession session, String link, PropertyType type) {
        try {
            ExtractionResult result = retryer.runWithRetry("detail " + link, () -> attempt(session, link, type));
            log.debug("{} -> {}", link, ListingStage.RECORDED);
            log.info("{}: PASS{}", link, result.isDegraded()
                ? " (" + result.getDiagnostics().size() + " fields degraded)" : "");
            return Optional.of(result);
        } catch (ListingWithdrawnException e) {
            log.info("{}: FAIL, listing withdrawn: {}", link, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlAbortedException("Interrupted while crawling " + link, e);
        } catch (Exception e) {
            log.debug("{} -> {}", link, ListingStage.FAILED);
            log.warn("{}: FAIL after {} attempts: {}", link, config.getRetries().getMaxAttempts(), e.toString());
            return Optional.empty();
        }
    }

    ExtractionResult attempt(BrowserSession session, String link, PropertyType type) {
        ListingStage stage = ListingStage.PENDING;
        try {
            RenderedPage usd = fetcher.fetchRendered(link, session, usdScript(session));
            session.markCurrencySwitched();
            checkNotWithdrawn(link, usd);
            stage = ListingStage.USD_FETCHED;

            RenderedPage local = fetcher.fetchRendered(link, session, localScript());
            checkNotWithdrawn(link, local);
            stage = ListingStage.LOCAL_FETCHED;

            stage = ListingStage.EXTRACTING;
            ExtractionResult result = extractor.extract(
                DetailView.parse(local.getHtml(), link),
                DetailView.parse(usd.getHtml(), link),
                type);
            if (!result.getRecord().hasCode()) {
                throw new IncompleteListingException(link + " rendered without a listing code");
            }
            stage = ListingStage.RECORDED;
            return result;
        } finally {
            if (stage != ListingStage.RECORDED) {
                log.debug("{} attempt failed after stage {}", link, stage);
            }
        }
    }

    private InteractionScript usdScript(BrowserSession session) {
        Config.Currency currency = config.getCurrency();
        int position = session.isCurrencySwitched() ? currency.getUsdOptionIndex() : currency.getUsdFirstOptionIndex();
        return InteractionScript.currencySelection(currency.getToggleSelector(), currency.getUsdCode(), position);
    }

    private InteractionScript localScript() {
        Config.Currency currency = config.getCurrency();
        return InteractionScript.currencySelection(currency.getToggleSelector(), currency.getLocalCode(),
            currency.getLocalOptionIndex());
    }

    private static void checkNotWithdrawn(String link, RenderedPage page) {
        if (page.isRedirected()) {
            throw new ListingWithdrawnException(link, page.getFinalUrl());
        }
    }
}
