package com.luanvv.listings.crawl;

import com.luanvv.listings.core.BrowserSession;
import com.luanvv.listings.core.Config;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Crawls every configured target into one batch. With {@code parallelism} 1 all targets share
 * a single session; otherwise each target runs on its own worker with its own session. The
 * batch is only returned once every target has finished.
 */
@Slf4j
@RequiredArgsConstructor
public class CrawlCoordinator {
    private final Config config;
    private final SessionFactory sessions;
    private final PageWalker walker;

    public CrawlBatch crawl() {
        List<Config.Target> targets = config.getTargets();
        int workers = Math.min(Math.max(1, config.getParallelism()), targets.size());
        List<TargetOutcome> outcomes = workers <= 1 ? crawlSequentially(targets) : crawlInParallel(targets, workers);
        CrawlBatch batch = new CrawlBatch(outcomes);
        log.info("Crawl batch: {} listings, {} failed links, {} degraded fields",
            batch.records().size(), batch.failedLinks().size(), batch.degradedFields());
        return batch;
    }

    private List<TargetOutcome> crawlSequentially(List<Config.Target> targets) {
        List<TargetOutcome> outcomes = new ArrayList<>();
        try (BrowserSession session = sessions.open("crawl")) {
            for (Config.Target target : targets) {
                log.info("Starting target: {} ({})", target.getId(), target.getPropertyType().label());
                outcomes.add(walker.walk(session, target));
            }
        }
        return outcomes;
    }

    private List<TargetOutcome> crawlInParallel(List<Config.Target> targets, int workers) {
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<TargetOutcome>> futures = new ArrayList<>();
            for (Config.Target target : targets) {
                futures.add(executor.submit(() -> {
                    log.info("Starting target: {} ({})", target.getId(), target.getPropertyType().label());
                    try (BrowserSession session = sessions.open("crawl-" + target.getId())) {
                        return walker.walk(session, target);
                    }
                }));
            }
            List<TargetOutcome> outcomes = new ArrayList<>();
            for (Future<TargetOutcome> future : futures) {
                outcomes.add(await(future));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static TargetOutcome await(Future<TargetOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CrawlAbortedException("Interrupted while waiting for crawl workers", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CrawlAbortedException("Crawl worker failed: " + cause, cause);
        }
    }
}
