package com.storewatch.tracker.crawl.model;

import java.time.Instant;

public record RunStats(
    Instant finishedAt,
    String status,
    int orderingSize,
    int newEventsEmitted,
    int changeEventsEmitted,
    int pendingSize
) {
}
