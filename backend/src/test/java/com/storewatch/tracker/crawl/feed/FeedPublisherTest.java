package com.storewatch.tracker.crawl.feed;

import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.model.CrawlState;
import com.storewatch.tracker.crawl.model.EventKind;
import com.storewatch.tracker.crawl.model.FeedEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FeedPublisherTest {
    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void writesBothFeeds() throws Exception {
        CrawlerProperties properties = properties(true);
        CrawlState state = CrawlState.empty();
        state.getNewEvents().add(new FeedEvent(10L, EventKind.NEW, "Portal", "", null, null, NOW, List.of()));

        int written = new FeedPublisher(new RssFeedRenderer(), properties).publish(state, NOW);

        assertThat(written).isEqualTo(2);
        String newFeed = Files.readString(tempDir.resolve("out/new.xml"), StandardCharsets.UTF_8);
        assertThat(newFeed).contains("new:app:10");
        assertThat(Files.readString(tempDir.resolve("out/updates.xml"), StandardCharsets.UTF_8)).doesNotContain("<item>");
    }

    @Test
    void disabledFeedsWriteNothing() {
        int written = new FeedPublisher(new RssFeedRenderer(), properties(false)).publish(CrawlState.empty(), NOW);

        assertThat(written).isZero();
        assertThat(tempDir.resolve("out")).doesNotExist();
    }

    private CrawlerProperties properties(boolean enabled) {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getFeed().setEnabled(enabled);
        properties.getFeed().setNewFeedPath(tempDir.resolve("out/new.xml").toString());
        properties.getFeed().setChangeFeedPath(tempDir.resolve("out/updates.xml").toString());
        return properties;
    }
}
