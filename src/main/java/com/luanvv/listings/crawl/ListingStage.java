package com.luanvv.listings.crawl;

/** Progress of one detail link through an attempt. */
public enum ListingStage {
    PENDING,
    USD_FETCHED,
    LOCAL_FETCHED,
    EXTRACTING,
    RECORDED,
    FAILED
}
