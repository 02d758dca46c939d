package com.luanvv.listings.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical listing dataset: unique by code, ordered by first-seen time, newest first.
 * Records sharing a first-seen time keep the order they were given in.
 */
public final class Dataset {

    public static final Comparator<ReconciledRecord> NEWEST_FIRST =
        Comparator.comparing(ReconciledRecord::getFirstSeenAt,
            Comparator.nullsLast(Comparator.reverseOrder()));

    private static final Dataset EMPTY = new Dataset(List.of(), Map.of());

    private final List<ReconciledRecord> records;
    private final Map<String, ReconciledRecord> byCode;

    private Dataset(List<ReconciledRecord> records, Map<String, ReconciledRecord> byCode) {
        this.records = records;
        this.byCode = byCode;
    }

    public static Dataset empty() {
        return EMPTY;
    }

    /**
     * @throws IllegalArgumentException if two records share a code or a record has none
     */
    public static Dataset of(List<ReconciledRecord> records) {
        Map<String, ReconciledRecord> index = new LinkedHashMap<>();
        for (ReconciledRecord record : records) {
            String code = record.getCode();
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("Dataset record without code: " + record);
            }
            if (index.putIfAbsent(code, record) != null) {
                throw new IllegalArgumentException("Duplicate code in dataset: " + code);
            }
        }
        List<ReconciledRecord> sorted = new ArrayList<>(records);
        sorted.sort(NEWEST_FIRST);
        return new Dataset(Collections.unmodifiableList(sorted), Collections.unmodifiableMap(index));
    }

    public List<ReconciledRecord> records() {
        return records;
    }

    public Optional<ReconciledRecord> find(String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Dataset other && records.equals(other.records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "Dataset[" + records.size() + " records]";
    }
}
