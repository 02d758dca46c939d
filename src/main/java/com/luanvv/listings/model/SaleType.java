package com.luanvv.listings.model;

import java.util.Locale;

public enum SaleType {
    FREEHOLD("freehold"),
    LEASEHOLD("leasehold"),
    UNKNOWN("unknown");

    private final String label;

    SaleType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Maps keyword tokens such as {@code lease}, {@code free} or {@code leasehold}. */
    public static SaleType fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return UNKNOWN;
        }
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        if (!normalized.endsWith("hold")) {
            normalized = normalized + "hold";
        }
        for (SaleType type : values()) {
            if (type.label.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
