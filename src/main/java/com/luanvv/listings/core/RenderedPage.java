package com.luanvv.listings.core;

import lombok.Value;

@Value
public class RenderedPage {
    String requestedUrl;
    String finalUrl;
    String html;

    public boolean isRedirected() {
        return finalUrl != null && !UrlUtils.sameLocation(requestedUrl, finalUrl);
    }
}
