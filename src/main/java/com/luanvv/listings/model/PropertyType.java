package com.luanvv.listings.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum PropertyType {
    VILLA_SALE("villa-sale", "villas-for-sale"),
    VILLA_RENT("villa-rent", "villas-for-rent"),
    LAND("land", "land");

    private final String label;
    private final String urlToken;

    PropertyType(String label, String urlToken) {
        this.label = label;
        this.urlToken = urlToken;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isVilla() {
        return this != LAND;
    }

    @JsonCreator
    public static PropertyType fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Property type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (PropertyType type : values()) {
            if (type.label.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown property type: " + value);
    }

    /**
     * Derives the type from a listing URL path, e.g. {@code /search/villas-for-rent}.
     * Villa tokens are checked first since they are more specific than {@code land}.
     */
    public static PropertyType fromUrl(String url) {
        if (url == null) {
            throw new IllegalArgumentException("URL is required");
        }
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.contains(VILLA_SALE.urlToken)) return VILLA_SALE;
        if (lower.contains(VILLA_RENT.urlToken)) return VILLA_RENT;
        if (lower.contains(LAND.urlToken)) return LAND;
        throw new IllegalArgumentException("Cannot derive property type from URL: " + url);
    }
}
