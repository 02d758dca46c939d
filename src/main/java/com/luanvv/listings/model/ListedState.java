package com.luanvv.listings.model;

public enum ListedState {
    LISTED("Listed"),
    UNLISTED("Unlisted");

    private final String label;

    ListedState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static ListedState fromLabel(String value) {
        return value != null && value.trim().equalsIgnoreCase(UNLISTED.label) ? UNLISTED : LISTED;
    }
}
