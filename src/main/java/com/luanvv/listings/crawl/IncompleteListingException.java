package com.luanvv.listings.crawl;

/** The page rendered without a listing code, usually because it was captured before loading fully. */
public class IncompleteListingException extends RuntimeException {
    public IncompleteListingException(String message) {
        super(message);
    }
}
