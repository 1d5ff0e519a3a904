package com.storewatch.tracker.crawl.feed;

import com.storewatch.tracker.crawl.model.FeedEvent;

import java.time.Instant;
import java.util.List;

/**
 * Serializes an ordered event list into a feed document. Events arrive most recent first.
 */
public interface FeedRenderer {
    String render(FeedChannel channel, List<FeedEvent> events, Instant builtAt);
}
