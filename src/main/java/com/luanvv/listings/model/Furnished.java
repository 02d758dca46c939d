package com.luanvv.listings.model;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Furnishing level in four canonical buckets. Listing agents type this field freely,
 * so {@link #normalize(String)} folds the spellings seen on the site into a bucket.
 */
public enum Furnished {
    UNFURNISHED("unfurnished"),
    SEMI_FURNISHED("semi-furnished"),
    FURNISHED("furnished"),
    FULLY_FURNISHED("fully-furnished"),
    UNKNOWN("unknown");

    private static final Map<Furnished, Set<String>> VOCABULARY = Map.of(
        FURNISHED, Set.of("yes", "furnish", "furnished"),
        FULLY_FURNISHED, Set.of("full", "fully", "full furnish", "full furnished", "fully furnished",
            "fully-furnished", "full-furnished"),
        UNFURNISHED, Set.of("no", "no furnish", "not furnished", "un-furnish", "unfurnish", "unfurnished",
            "un-furnished"),
        SEMI_FURNISHED, Set.of("semi", "semi furnish", "semi furnished", "semi-furnish", "semi-furnished",
            "semi frunished")
    );

    private final String label;

    Furnished(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Furnished normalize(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String key = raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if (key.isEmpty()) {
            return UNKNOWN;
        }
        for (Map.Entry<Furnished, Set<String>> entry : VOCABULARY.entrySet()) {
            if (entry.getValue().contains(key)) {
                return entry.getKey();
            }
        }
        for (Furnished value : values()) {
            if (value.label.equals(key) || value.name().equalsIgnoreCase(key.replace(' ', '_'))) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
