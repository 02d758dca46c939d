package com.luanvv.listings.crawl;

import com.luanvv.listings.core.NonRetryableException;

/** The detail URL redirects elsewhere: the site took the listing down. */
public class ListingWithdrawnException extends NonRetryableException {
    public ListingWithdrawnException(String link, String finalUrl) {
        super(link + " redirects to " + finalUrl);
    }
}
