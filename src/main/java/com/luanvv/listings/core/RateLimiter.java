package com.luanvv.listings.core;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Spaces page navigations so a crawl does not hammer the listing site. One token is refilled
 * every {@code 1 / permitsPerSecond} seconds; {@code burst} tokens may be spent at once.
 */
@Slf4j
public class RateLimiter {
    private static final double MIN_PERMITS_PER_SECOND = 0.01;

    private final Bucket bucket;

    public RateLimiter(Config.RateLimit cfg) {
        double permitsPerSecond = Math.max(MIN_PERMITS_PER_SECOND, cfg.getPermitsPerSecond());
        Duration refillPeriod = Duration.ofNanos(Math.round(1_000_000_000L / permitsPerSecond));
        bucket = Bucket.builder()
            .addLimit(Bandwidth.builder()
                .capacity(Math.max(1, cfg.getBurst()))
                .refillGreedy(1, refillPeriod)
                .build())
            .build();
        log.debug("Navigation rate limit: 1 per {} ms, burst {}", refillPeriod.toMillis(), cfg.getBurst());
    }

    public void acquire() {
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while waiting for a navigation permit", e);
        }
    }
}
