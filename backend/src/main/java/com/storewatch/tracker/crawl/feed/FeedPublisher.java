package com.storewatch.tracker.crawl.feed;

import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.model.CrawlState;
import com.storewatch.tracker.crawl.model.FeedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.List;

/**
 * Writes the new-item and change feeds from the persisted event history.
 */
@Service
public class FeedPublisher {
    private static final Logger log = LoggerFactory.getLogger(FeedPublisher.class);

    static final FeedChannel NEW_CHANNEL_TEMPLATE = new FeedChannel(
        "Steam: Newly Published Store Pages",
        null,
        "Newly published Steam store pages detected by crawler."
    );
    static final FeedChannel CHANGE_CHANNEL_TEMPLATE = new FeedChannel(
        "Steam: Store Page Updates",
        null,
        "Steam store updates: price, language, description and artwork changes."
    );

    private final FeedRenderer renderer;
    private final CrawlerProperties properties;

    public FeedPublisher(FeedRenderer renderer, CrawlerProperties properties) {
        this.renderer = renderer;
        this.properties = properties;
    }

    /**
     * @return number of feed files written
     */
    public int publish(CrawlState state, Instant builtAt) {
        if (!properties.getFeed().isEnabled()) {
            return 0;
        }
        String link = properties.getFeed().getChannelLink();
        int written = 0;
        if (write(Paths.get(properties.getFeed().getNewFeedPath()), withLink(NEW_CHANNEL_TEMPLATE, link),
            state.getNewEvents(), builtAt)) {
            written++;
        }
        if (write(Paths.get(properties.getFeed().getChangeFeedPath()), withLink(CHANGE_CHANNEL_TEMPLATE, link),
            state.getChangeEvents(), builtAt)) {
            written++;
        }
        return written;
    }

    private boolean write(Path target, FeedChannel channel, List<FeedEvent> events, Instant builtAt) {
        try {
            String document = renderer.render(channel, events, builtAt);
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, document, StandardCharsets.UTF_8);
            log.info("Wrote {} events to {}", events.size(), target);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to write feed {}", target, e);
            return false;
        }
    }

    private static FeedChannel withLink(FeedChannel template, String link) {
        return new FeedChannel(template.title(), link, template.description());
    }
}
