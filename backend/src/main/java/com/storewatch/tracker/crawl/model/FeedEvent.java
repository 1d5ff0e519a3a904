package com.storewatch.tracker.crawl.model;

import java.time.Instant;
import java.util.List;

public record FeedEvent(
    long appId,
    EventKind kind,
    String title,
    String summary,
    String link,
    String imageUrl,
    Instant timestamp,
    List<FieldChange> changes
) {
    public FeedEvent {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    /**
     * Stable identity used by feed readers. New events are keyed by item only; change
     * events also carry the emission instant.
     */
    public String identityKey() {
        if (kind == EventKind.NEW) {
            return "new:app:" + appId;
        }
        long epochMillis = timestamp == null ? 0L : timestamp.toEpochMilli();
        return "change:app:" + appId + ":" + epochMillis;
    }
}
