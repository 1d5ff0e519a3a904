package com.storewatch.tracker.crawl.events;

import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.model.CrawlState;
import com.storewatch.tracker.crawl.model.EventKind;
import com.storewatch.tracker.crawl.model.FeedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FeedEventStoreTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private FeedEventStore store;

    @BeforeEach
    void setUp() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getEvents().setMaxNewEvents(3);
        properties.getEvents().setMaxChangeEvents(2);
        store = new FeedEventStore(properties);
    }

    @Test
    void newEventsAreDedupedByItem() {
        CrawlState state = CrawlState.empty();

        assertThat(store.recordNew(state, newEvent(1L, "https://store.example/app/1/"))).isTrue();
        assertThat(store.recordNew(state, newEvent(1L, "https://store.example/app/1/"))).isFalse();
        assertThat(store.recordNew(state, newEvent(2L, "https://store.example/app/1/"))).isFalse();

        assertThat(state.getNewEvents()).hasSize(1);
    }

    @Test
    void eventsWithoutLinkAreDedupedByIdOnly() {
        CrawlState state = CrawlState.empty();

        assertThat(store.recordNew(state, newEvent(1L, null))).isTrue();
        assertThat(store.recordNew(state, newEvent(2L, null))).isTrue();
    }

    @Test
    void historyIsBoundedNewestFirst() {
        CrawlState state = CrawlState.empty();
        for (long id = 1; id <= 4; id++) {
            store.recordNew(state, newEvent(id, null));
        }

        assertThat(state.getNewEvents()).extracting(FeedEvent::appId).containsExactly(4L, 3L, 2L);
    }

    @Test
    void changeEventsRepeatPerItemButStayBounded() {
        CrawlState state = CrawlState.empty();
        store.recordChange(state, changeEvent(5L, NOW));
        store.recordChange(state, changeEvent(5L, NOW.plusSeconds(60)));
        store.recordChange(state, changeEvent(6L, NOW.plusSeconds(120)));

        assertThat(state.getChangeEvents()).extracting(FeedEvent::identityKey).containsExactly(
            "change:app:6:" + NOW.plusSeconds(120).toEpochMilli(),
            "change:app:5:" + NOW.plusSeconds(60).toEpochMilli()
        );
    }

    private static FeedEvent newEvent(long appId, String link) {
        return new FeedEvent(appId, EventKind.NEW, "Game " + appId, "", link, null, NOW, List.of());
    }

    private static FeedEvent changeEvent(long appId, Instant at) {
        return new FeedEvent(appId, EventKind.CHANGED, "Game " + appId, "Price: 1 USD -> 2 USD", null, null, at, List.of());
    }
}
