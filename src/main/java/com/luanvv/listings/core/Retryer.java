package com.luanvv.listings.core;

import java.util.concurrent.Callable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs an operation up to {@code maxAttempts} times, sleeping between attempts. The delay is
 * fixed unless {@code multiplier} is above 1, in which case it grows up to {@code maxBackoffMs}.
 * {@link NonRetryableException} and interruption end the loop at once.
 */
@Slf4j
@RequiredArgsConstructor
public class Retryer {
    private final Config.Retries cfg;

    public <T> T runWithRetry(String opName, Callable<T> callable) throws Exception {
        int maxAttempts = Math.max(1, cfg.getMaxAttempts());
        long delay = Math.max(0, cfg.getBackoffMs());
        for (int attempt = 1; ; attempt++) {
            try {
                return callable.call();
            } catch (NonRetryableException e) {
                log.warn("{} failed on attempt {}/{}, not retrying: {}", opName, attempt, maxAttempts, e.getMessage());
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} failed on attempt {}/{}, giving up: {}", opName, attempt, maxAttempts, e.toString());
                    throw e;
                }
                log.warn("{} failed on attempt {}/{}, retrying in {} ms: {}",
                    opName, attempt, maxAttempts, delay, e.toString());
                if (delay > 0) {
                    Thread.sleep(delay);
                }
                delay = nextDelay(delay);
            }
        }
    }

    private long nextDelay(long delay) {
        if (cfg.getMultiplier() <= 1.0) {
            return delay;
        }
        long cap = Math.max(cfg.getMaxBackoffMs(), cfg.getBackoffMs());
        return Math.min(cap, Math.round(delay * cfg.getMultiplier()));
    }
}
