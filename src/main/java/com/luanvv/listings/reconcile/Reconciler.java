package com.luanvv.listings.reconcile;

import com.luanvv.listings.model.Dataset;
import com.luanvv.listings.model.ListedState;
import com.luanvv.listings.model.ListingRecord;
import com.luanvv.listings.model.ReconciledRecord;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Merges one crawl batch into the prior dataset.
 *
 * <ul>
 *   <li>A code seen for the first time becomes a new record, first and last seen now, its
 *       current prices captured as the original prices.</li>
 *   <li>A known code takes every listing field from the batch and a new last-seen time; its
 *       first-seen time and original prices stay as they were. It is listed again.</li>
 *   <li>A known code missing from the batch is carried forward unchanged but unlisted.</li>
 *   <li>Records without a code are dropped. When a code repeats within the batch the first
 *       occurrence wins.</li>
 * </ul>
 *
 * Holds no state between calls; the caller owns the only copy of the dataset during a run.
 */
@Slf4j
@RequiredArgsConstructor
public class Reconciler {
    private final Clock clock;

    public Reconciler() {
        this(Clock.systemDefaultZone());
    }

    public ReconciliationResult reconcile(Dataset prior, List<ListingRecord> batch) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        ReconciliationStats stats = new ReconciliationStats();
        if (prior.isEmpty()) {
            log.info("No prior dataset, every listing in the batch is new");
        }

        Map<String, ReconciledRecord> merged = new LinkedHashMap<>();
        for (ListingRecord fresh : batch) {
            if (fresh == null || !fresh.hasCode()) {
                log.warn("Dropping listing without code: {}", fresh == null ? null : fresh.getUrl());
                stats.recordDropped();
                continue;
            }
            String code = fresh.getCode();
            if (merged.containsKey(code)) {
                log.warn("Duplicate code {} in batch, keeping the first occurrence ({}), ignoring {}",
                    code, merged.get(code).getListing().getUrl(), fresh.getUrl());
                stats.recordDuplicate();
                continue;
            }
            Optional<ReconciledRecord> existing = prior.find(code);
            if (existing.isEmpty()) {
                merged.put(code, ReconciledRecord.firstSeen(fresh, now));
                stats.recordCreated();
            } else {
                ReconciledRecord previous = existing.get();
                if (previous.getListedState() == ListedState.UNLISTED) {
                    log.info("Listing {} is listed again", code);
                    stats.recordRelisted();
                }
                merged.put(code, previous.toBuilder()
                    .listing(fresh)
                    .lastSeenAt(now)
                    .listedState(ListedState.LISTED)
                    .build());
                stats.recordUpdated();
            }
        }

        for (ReconciledRecord previous : prior.records()) {
            if (merged.containsKey(previous.getCode())) continue;
            if (previous.getListedState() != ListedState.UNLISTED) {
                log.info("Listing {} no longer listed", previous.getCode());
            }
            merged.put(previous.getCode(), previous.toBuilder().listedState(ListedState.UNLISTED).build());
            stats.recordUnlisted();
        }

        Dataset dataset = Dataset.of(new ArrayList<>(merged.values()));
        log.info("Reconciled {} listings into {} records: {}", batch.size(), dataset.size(), stats);
        return new ReconciliationResult(dataset, stats, now);
    }
}
