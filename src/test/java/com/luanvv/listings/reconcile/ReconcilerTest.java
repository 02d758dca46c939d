package com.luanvv.listings.reconcile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.luanvv.listings.model.Dataset;
import com.luanvv.listings.model.ListedState;
import com.luanvv.listings.model.ListingRecord;
import com.luanvv.listings.model.PropertyType;
import com.luanvv.listings.model.ReconciledRecord;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ReconcilerTest {
    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 1, 0, 0);
    private static final LocalDateTime T1 = LocalDateTime.of(2024, 2, 1, 0, 0);

    private static Reconciler at(LocalDateTime time) {
        return new Reconciler(Clock.fixed(time.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    private static ListingRecord listing(String code, long usd) {
        return ListingRecord.builder()
            .code(code)
            .title("Villa " + code)
            .propertyType(PropertyType.VILLA_SALE)
            .url("https://www.example.com/villa/" + code)
            .priceUsd(BigDecimal.valueOf(usd))
            .build();
    }

    private static ReconciledRecord record(Dataset dataset, String code) {
        return dataset.find(code).orElseThrow();
    }

    @Test
    void firstRunCreatesEveryListing() {
        ReconciliationResult result = at(T0).reconcile(Dataset.empty(), List.of(listing("V100", 200000)));

        ReconciledRecord v100 = record(result.getDataset(), "V100");
        assertEquals(T0, v100.getFirstSeenAt());
        assertEquals(T0, v100.getLastSeenAt());
        assertEquals(new BigDecimal("200000"), v100.getOriginalPriceUsd());
        assertEquals(ListedState.LISTED, v100.getListedState());
        assertEquals(1, result.getStats().getCreated());
        assertEquals(T0, result.getRunTime());
    }

    @Test
    void keepsProvenanceAndUnlistsMissingCodes() {
        Dataset prior = at(T0).reconcile(Dataset.empty(),
            List.of(listing("V100", 200000), listing("V200", 150000))).getDataset();

        ReconciliationResult result = at(T1).reconcile(prior, List.of(listing("V100", 180000)));
        Dataset next = result.getDataset();

        ReconciledRecord v100 = record(next, "V100");
        assertEquals(T0, v100.getFirstSeenAt());
        assertEquals(T1, v100.getLastSeenAt());
        assertEquals(new BigDecimal("200000"), v100.getOriginalPriceUsd());
        assertEquals(new BigDecimal("180000"), v100.getListing().getPriceUsd());
        assertEquals(ListedState.LISTED, v100.getListedState());

        ReconciledRecord v200 = record(next, "V200");
        assertEquals(ListedState.UNLISTED, v200.getListedState());
        assertEquals(T0, v200.getLastSeenAt());
        assertSame(record(prior, "V200").getListing(), v200.getListing());

        assertEquals(1, result.getStats().getUpdated());
        assertEquals(1, result.getStats().getUnlisted());
    }

    @Test
    void unlistedRecordReturnsAsListed() {
        Dataset prior = at(T0).reconcile(Dataset.empty(), List.of(listing("V200", 150000))).getDataset();
        Dataset gone = at(T1).reconcile(prior, List.of()).getDataset();

        ReconciliationResult back = at(T1.plusDays(1)).reconcile(gone, List.of(listing("V200", 140000)));

        ReconciledRecord v200 = record(back.getDataset(), "V200");
        assertEquals(ListedState.LISTED, v200.getListedState());
        assertEquals(T0, v200.getFirstSeenAt());
        assertEquals(new BigDecimal("150000"), v200.getOriginalPriceUsd());
        assertEquals(1, back.getStats().getRelisted());
    }

    @Test
    void unlistedRecordStaysUnlistedWhileAbsent() {
        Dataset prior = at(T0).reconcile(Dataset.empty(), List.of(listing("V200", 150000))).getDataset();
        Dataset once = at(T1).reconcile(prior, List.of()).getDataset();
        Dataset twice = at(T1.plusDays(1)).reconcile(once, List.of()).getDataset();

        assertEquals(record(once, "V200"), record(twice, "V200"));
    }

    @Test
    void firstOccurrenceOfRepeatedCodeWins() {
        ReconciliationResult result = at(T0).reconcile(Dataset.empty(),
            List.of(listing("V100", 200000), listing("V100", 1)));

        assertEquals(1, result.getDataset().size());
        assertEquals(new BigDecimal("200000"), record(result.getDataset(), "V100").getListing().getPriceUsd());
        assertEquals(1, result.getStats().getDuplicates());
    }

    @Test
    void listingsWithoutCodeAreDropped() {
        ListingRecord blank = listing("  ", 1);
        ListingRecord none = listing(null, 1);

        ReconciliationResult result = at(T0).reconcile(Dataset.empty(), List.of(blank, listing("V100", 5), none));

        assertEquals(List.of("V100"), codes(result.getDataset()));
        assertEquals(2, result.getStats().getDropped());
    }

    @Test
    void newestFirstSeenComesFirst() {
        Dataset prior = at(T0).reconcile(Dataset.empty(),
            List.of(listing("OLD1", 1), listing("OLD2", 2))).getDataset();

        Dataset next = at(T1).reconcile(prior,
            List.of(listing("OLD2", 2), listing("NEW1", 3), listing("NEW2", 4))).getDataset();

        assertEquals(List.of("NEW1", "NEW2", "OLD1", "OLD2"), codes(next));
    }

    @Test
    void reconcilingTheSameBatchTwiceIsStable() {
        List<ListingRecord> batch = List.of(listing("V100", 1), listing("V200", 2));
        Reconciler reconciler = at(T1);
        Dataset prior = at(T0).reconcile(Dataset.empty(), List.of(listing("V300", 3))).getDataset();

        Dataset once = reconciler.reconcile(prior, batch).getDataset();
        Dataset twice = reconciler.reconcile(once, batch).getDataset();

        assertEquals(once, twice);
    }

    @Test
    void everyPriorCodeSurvives() {
        Dataset prior = at(T0).reconcile(Dataset.empty(),
            List.of(listing("A", 1), listing("B", 2), listing("C", 3))).getDataset();

        Dataset next = at(T1).reconcile(prior, List.of(listing("B", 2), listing("D", 4))).getDataset();

        assertTrue(next.records().stream().map(ReconciledRecord::getCode).collect(Collectors.toSet())
            .containsAll(List.of("A", "B", "C", "D")));
        assertEquals(4, next.size());
    }

    @Test
    void runTimeIsTruncatedToSeconds() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:15:30.987Z"), ZoneOffset.UTC);

        ReconciliationResult result = new Reconciler(clock).reconcile(Dataset.empty(), List.of(listing("V1", 1)));

        assertEquals(LocalDateTime.of(2024, 3, 1, 10, 15, 30), result.getRunTime());
    }

    private static List<String> codes(Dataset dataset) {
        return dataset.records().stream().map(ReconciledRecord::getCode).toList();
    }
}
