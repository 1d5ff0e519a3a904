package com.storewatch.tracker.crawl.model;

/**
 * Fields compared between snapshots, declared in summary priority order.
 */
public enum SnapshotField {
    PRICE("Price"),
    LANGUAGES("Languages"),
    DESCRIPTION("Description"),
    IMAGES("Images"),
    TITLE("Title"),
    GENRES("Genres"),
    PLATFORMS("Platforms"),
    RELEASE("Release");

    private final String label;

    SnapshotField(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
