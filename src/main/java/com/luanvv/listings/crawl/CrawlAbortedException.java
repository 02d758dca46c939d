package com.luanvv.listings.crawl;

/**
 * A target could not be enumerated. Reconciling a batch missing a whole target would unlist
 * every listing of that type, so the run stops instead.
 */
public class CrawlAbortedException extends RuntimeException {
    public CrawlAbortedException(String message) {
        super(message);
    }

    public CrawlAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
