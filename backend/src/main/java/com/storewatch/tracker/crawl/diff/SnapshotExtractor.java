package com.storewatch.tracker.crawl.diff;

import com.storewatch.tracker.crawl.model.ItemRecord;
import com.storewatch.tracker.crawl.model.ItemSnapshot;
import com.storewatch.tracker.crawl.model.StoreLocale;
import com.storewatch.tracker.crawl.util.HashUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Pure projection of an {@link ItemRecord} onto the fields that count as a change.
 */
@Component
public class SnapshotExtractor {
    private static final Set<String> VOLATILE_QUERY_PARAMS = Set.of("t", "ts", "v");

    public ItemSnapshot extract(ItemRecord record) {
        return extract(record, null);
    }

    public ItemSnapshot extract(ItemRecord record, StoreLocale locale) {
        Integer price = record.finalPrice();
        if (price == null && record.free()) {
            price = 0;
        }
        String currency = price == null || record.currency() == null
            ? null
            : record.currency().trim().toUpperCase(Locale.ROOT);

        String description = record.shortDescription() != null
            ? record.shortDescription()
            : record.detailedDescription();

        List<String> images = new ArrayList<>();
        addImage(images, record.headerImage());
        for (String screenshot : record.screenshotUrls()) {
            addImage(images, screenshot);
        }

        List<String> genres = new ArrayList<>();
        for (String genre : record.genres()) {
            if (genre != null && !genre.isBlank()) {
                genres.add(genre.trim());
            }
        }
        List<String> platforms = new ArrayList<>();
        for (String platform : record.platforms()) {
            if (platform != null && !platform.isBlank()) {
                platforms.add(platform.trim().toLowerCase(Locale.ROOT));
            }
        }

        return new ItemSnapshot(
            HashUtils.shortDigest(record.name()),
            HashUtils.shortDigest(description),
            price,
            currency,
            LanguageListNormalizer.normalize(record.supportedLanguages()),
            genres,
            platforms,
            record.releaseDate() == null ? null : record.releaseDate().trim(),
            record.comingSoon(),
            images,
            locale == null ? null : locale.toString()
        );
    }

    private static void addImage(List<String> images, String url) {
        String stripped = stripVolatileQuery(url);
        if (stripped != null) {
            images.add(stripped);
        }
    }

    /**
     * Drops cache-busting parameters such as {@code ?t=1700000000} and any fragment.
     */
    static String stripVolatileQuery(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String value = url.trim();
        int hash = value.indexOf('#');
        if (hash >= 0) {
            value = value.substring(0, hash);
        }
        int question = value.indexOf('?');
        if (question < 0) {
            return value;
        }
        String base = value.substring(0, question);
        StringBuilder kept = new StringBuilder();
        for (String param : value.substring(question + 1).split("&")) {
            if (param.isEmpty()) {
                continue;
            }
            int eq = param.indexOf('=');
            String key = eq < 0 ? param : param.substring(0, eq);
            if (VOLATILE_QUERY_PARAMS.contains(key.toLowerCase(Locale.ROOT))) {
                continue;
            }
            kept.append(kept.length() == 0 ? '?' : '&').append(param);
        }
        return base + kept;
    }
}
