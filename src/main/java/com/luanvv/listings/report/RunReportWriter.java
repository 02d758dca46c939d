package com.luanvv.listings.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.luanvv.listings.crawl.CrawlBatch;
import com.luanvv.listings.crawl.TargetOutcome;
import com.luanvv.listings.reconcile.ReconciliationResult;
import com.luanvv.listings.reconcile.ReconciliationStats;
import com.luanvv.listings.store.DatasetColumns;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class RunReportWriter {
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final Path baseDir;
    private final ObjectMapper objectMapper;

    public RunReportWriter(Path outputDir) {
        this.baseDir = outputDir.resolve("reports");
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static RunReport summarize(LocalDateTime startedAt, LocalDateTime finishedAt, CrawlBatch batch,
                                      ReconciliationResult result) {
        RunReport report = new RunReport();
        report.setStartedAt(DatasetColumns.timestamp(startedAt));
        report.setFinishedAt(DatasetColumns.timestamp(finishedAt));
        report.setDatasetSize(result.getDataset().size());
        report.setDegradedFields(batch.degradedFields());
        report.setFailedLinks(batch.failedLinks());
        for (TargetOutcome outcome : batch.getOutcomes()) {
            RunReport.Target target = new RunReport.Target();
            target.setId(outcome.getTargetId());
            target.setPropertyType(outcome.getPropertyType().label());
            target.setPages(outcome.getPages());
            target.setLinks(outcome.getLinks());
            target.setRecorded(outcome.getResults().size());
            target.setFailed(outcome.getFailedLinks().size());
            target.setDegradedFields(outcome.degradedFields());
            report.getTargets().add(target);
        }
        ReconciliationStats stats = result.getStats();
        RunReport.Reconciliation reconciliation = report.getReconciliation();
        reconciliation.setCreated(stats.getCreated());
        reconciliation.setUpdated(stats.getUpdated());
        reconciliation.setRelisted(stats.getRelisted());
        reconciliation.setUnlisted(stats.getUnlisted());
        reconciliation.setDropped(stats.getDropped());
        reconciliation.setDuplicates(stats.getDuplicates());
        return report;
    }

    /** @return the written file, or {@code null} when writing failed */
    public Path write(RunReport report, LocalDateTime runTime) {
        Path path = baseDir.resolve("run_" + FILE_STAMP.format(runTime) + ".json");
        try {
            Files.createDirectories(baseDir);
            objectMapper.writeValue(path.toFile(), report);
            log.info("Wrote run report {}", path);
            return path;
        } catch (IOException e) {
            log.error("Failed to write run report {}", path, e);
            return null;
        }
    }
}
