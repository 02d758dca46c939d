package com.luanvv.listings;

import com.luanvv.listings.core.Config;
import com.luanvv.listings.core.ListingsRun;
import com.luanvv.listings.core.Retryer;
import java.nio.file.Path;
import java.time.LocalDate;
import lombok.extern.slf4j.Slf4j;

/**
 * Usage: {@code App [config.yaml]} runs a crawl; {@code App backup [config.yaml]} copies the
 * stored dataset into the archive directory.
 */
@Slf4j
public class App {
    public static void main(String[] args) {
        try {
            boolean backup = args.length > 0 && "backup".equalsIgnoreCase(args[0]);
            String configPath = backup ? (args.length > 1 ? args[1] : null) : (args.length > 0 ? args[0] : null);
            Config config = Config.resolve(configPath, System.getenv());
            if (backup) {
                backup(config);
            } else {
                Retryer runRetryer = new Retryer(config.getRunRetries());
                runRetryer.runWithRetry("listings run", () -> ListingsRun.create(config).execute());
            }
        } catch (Exception e) {
            log.error("Listings crawler failed", e);
            System.exit(1);
        }
    }

    private static void backup(Config config) {
        String archiveDir = config.getDataset().getArchiveDir();
        Path dir = Path.of(archiveDir == null || archiveDir.isBlank() ? "archive" : archiveDir);
        ListingsRun.store(config).backup(dir, LocalDate.now());
    }
}
