package com.storewatch.tracker.crawl.model;

import java.time.Instant;

public record SeenEntry(boolean everDetected, Instant detectedAt) {

    public static SeenEntry unresolved() {
        return new SeenEntry(false, null);
    }

    public static SeenEntry detected(Instant detectedAt) {
        return new SeenEntry(true, detectedAt);
    }
}
