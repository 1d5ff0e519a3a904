package com.storewatch.tracker.crawl.events;

import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.model.CrawlState;
import com.storewatch.tracker.crawl.model.FeedEvent;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Bounded, most-recent-first event history. Inserts prepend and then drop the oldest
 * entries beyond the configured cap.
 */
@Service
public class FeedEventStore {
    private final CrawlerProperties properties;

    public FeedEventStore(CrawlerProperties properties) {
        this.properties = properties;
    }

    /**
     * @return false when a new event for the same item is already in the history
     */
    public boolean recordNew(CrawlState state, FeedEvent event) {
        List<FeedEvent> events = state.getNewEvents();
        for (FeedEvent existing : events) {
            if (existing.appId() == event.appId()
                || (event.link() != null && Objects.equals(existing.link(), event.link()))) {
                return false;
            }
        }
        prependBounded(events, event, properties.getEvents().getMaxNewEvents());
        return true;
    }

    public void recordChange(CrawlState state, FeedEvent event) {
        prependBounded(state.getChangeEvents(), event, properties.getEvents().getMaxChangeEvents());
    }

    static void prependBounded(List<FeedEvent> events, FeedEvent event, int maxSize) {
        events.add(0, event);
        while (events.size() > maxSize) {
            events.remove(events.size() - 1);
        }
    }
}
