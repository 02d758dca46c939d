package com.luanvv.listings.core;

/** Fetches the rendered HTML of a URL within a browser session. */
public interface PageFetcher {

    /**
     * @param script UI interaction replayed before capture, or {@code null}
     * @throws FetchException when navigation or an interaction step fails
     */
    RenderedPage fetchRendered(String url, BrowserSession session, InteractionScript script);

    default RenderedPage fetchRendered(String url, BrowserSession session) {
        return fetchRendered(url, session, null);
    }
}
