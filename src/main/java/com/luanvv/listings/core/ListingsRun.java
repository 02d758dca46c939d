package com.luanvv.listings.core;

import com.luanvv.listings.crawl.CrawlBatch;
import com.luanvv.listings.crawl.CrawlCoordinator;
import com.luanvv.listings.crawl.DetailCrawler;
import com.luanvv.listings.crawl.PageWalker;
import com.luanvv.listings.crawl.SessionFactory;
import com.luanvv.listings.extract.FieldExtractor;
import com.luanvv.listings.model.Dataset;
import com.luanvv.listings.reconcile.ReconciliationResult;
import com.luanvv.listings.reconcile.Reconciler;
import com.luanvv.listings.report.RunReport;
import com.luanvv.listings.report.RunReportWriter;
import com.luanvv.listings.store.CsvDatasetStore;
import com.luanvv.listings.store.DatasetStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * One complete run: read the stored dataset, crawl every target, reconcile, write back.
 * Nothing is written unless the crawl of every target completed.
 */
@Slf4j
@RequiredArgsConstructor
public class ListingsRun {
    private final DatasetStore store;
    private final CrawlCoordinator coordinator;
    private final Reconciler reconciler;
    private final RunReportWriter reportWriter;
    private final Clock clock;

    public static ListingsRun create(Config config) {
        RateLimiter limiter = new RateLimiter(config.getRateLimit());
        PageFetcher fetcher = new PlaywrightPageFetcher(config, limiter);
        Retryer retryer = new Retryer(config.getRetries());
        DetailCrawler detailCrawler = new DetailCrawler(config, fetcher, new FieldExtractor(), retryer);
        PageWalker walker = new PageWalker(config, fetcher, detailCrawler, retryer);
        CrawlCoordinator coordinator = new CrawlCoordinator(config, SessionFactory.playwright(config), walker);
        Clock clock = Clock.systemDefaultZone();
        return new ListingsRun(
            store(config),
            coordinator,
            new Reconciler(clock),
            config.getOutput().isReport() ? new RunReportWriter(Path.of(config.getOutput().getDir())) : null,
            clock);
    }

    public static CsvDatasetStore store(Config config) {
        String archiveDir = config.getDataset().getArchiveDir();
        return new CsvDatasetStore(Path.of(config.getDataset().getPath()),
            archiveDir == null || archiveDir.isBlank() ? null : Path.of(archiveDir));
    }

    public ReconciliationResult execute() {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        Dataset prior = store.read();
        log.info("Prior dataset: {} records", prior.size());

        CrawlBatch batch = coordinator.crawl();
        ReconciliationResult result = reconciler.reconcile(prior, batch.records());
        store.write(result.getDataset());

        if (reportWriter != null) {
            RunReport report = RunReportWriter.summarize(startedAt, LocalDateTime.now(clock), batch, result);
            reportWriter.write(report, result.getRunTime());
        }
        log.info("Run finished: {} records stored", result.getDataset().size());
        return result;
    }
}
