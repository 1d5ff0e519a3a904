package com.storewatch.tracker.crawl.model;

import java.time.Instant;

public record CrawlRunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    int orderingSize,
    int newArrivalsChecked,
    int pendingChecked,
    int windowChecked,
    int newEventsEmitted,
    int changeEventsEmitted,
    int failures,
    int pendingSize,
    int cursor,
    int slowModeActivations
) {
    public int totalChecked() {
        return newArrivalsChecked + pendingChecked + windowChecked;
    }
}
