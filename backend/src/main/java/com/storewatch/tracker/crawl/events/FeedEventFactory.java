package com.storewatch.tracker.crawl.events;

import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.diff.ChangeSummaryFormatter;
import com.storewatch.tracker.crawl.model.EventKind;
import com.storewatch.tracker.crawl.model.FeedEvent;
import com.storewatch.tracker.crawl.model.FieldChange;
import com.storewatch.tracker.crawl.model.ItemRecord;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class FeedEventFactory {
    private static final int MAX_DESCRIPTION_CHARS = 300;

    private final CrawlerProperties properties;

    public FeedEventFactory(CrawlerProperties properties) {
        this.properties = properties;
    }

    public FeedEvent newArrival(ItemRecord record, Instant detectedAt) {
        return new FeedEvent(
            record.appId(),
            EventKind.NEW,
            record.displayName(),
            newSummary(record),
            appPageUrl(record.appId()),
            record.headerImage(),
            detectedAt,
            List.of()
        );
    }

    public FeedEvent changed(ItemRecord record, List<FieldChange> changes, Instant detectedAt) {
        return new FeedEvent(
            record.appId(),
            EventKind.CHANGED,
            record.displayName(),
            ChangeSummaryFormatter.summarize(changes),
            appPageUrl(record.appId()),
            record.headerImage(),
            detectedAt,
            changes
        );
    }

    String appPageUrl(long appId) {
        String template = properties.getStore().getAppPageUrlTemplate();
        if (template == null || template.isBlank()) {
            return null;
        }
        return String.format(Locale.ROOT, template, appId);
    }

    static String newSummary(ItemRecord record) {
        List<String> parts = new ArrayList<>();
        if (record.shortDescription() != null) {
            String plain = Jsoup.parse(record.shortDescription()).text().trim();
            if (plain.length() > MAX_DESCRIPTION_CHARS) {
                plain = plain.substring(0, MAX_DESCRIPTION_CHARS).trim() + "...";
            }
            if (!plain.isEmpty()) {
                parts.add(plain);
            }
        }
        String price = formatPrice(record);
        if (price != null) {
            parts.add("Price: " + price);
        }
        if (record.releaseDate() != null || record.comingSoon()) {
            String date = record.releaseDate() == null ? "TBA" : record.releaseDate();
            parts.add("Release: " + (record.comingSoon() ? date + " (coming soon)" : date));
        }
        return String.join(" / ", parts);
    }

    static String formatPrice(ItemRecord record) {
        if (record.finalPrice() == null) {
            return record.free() ? "Free" : null;
        }
        String amount = String.format(Locale.ROOT, "%d.%02d", record.finalPrice() / 100, record.finalPrice() % 100);
        return record.currency() == null ? amount : amount + " " + record.currency().toUpperCase(Locale.ROOT);
    }
}
