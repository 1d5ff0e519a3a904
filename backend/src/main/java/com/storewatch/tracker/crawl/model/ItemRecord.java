package com.storewatch.tracker.crawl.model;

import java.util.List;

/**
 * Raw attributes of one catalog item as returned by the detail source. Never persisted.
 */
public record ItemRecord(
    long appId,
    String name,
    String type,
    boolean free,
    Integer finalPrice,
    String currency,
    String supportedLanguages,
    String shortDescription,
    String detailedDescription,
    String headerImage,
    List<String> screenshotUrls,
    String releaseDate,
    boolean comingSoon,
    List<String> genres,
    List<String> platforms
) {
    public ItemRecord {
        screenshotUrls = screenshotUrls == null ? List.of() : List.copyOf(screenshotUrls);
        genres = genres == null ? List.of() : List.copyOf(genres);
        platforms = platforms == null ? List.of() : List.copyOf(platforms);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "AppID " + appId : name.trim();
    }
}
