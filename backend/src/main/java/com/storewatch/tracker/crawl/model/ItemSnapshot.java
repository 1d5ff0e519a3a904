package com.storewatch.tracker.crawl.model;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Comparable projection of an {@link ItemRecord}. Collection fields are kept sorted and
 * distinct so that record equality is set equality. {@code priceRegion} names the store
 * locale the price was read from; prices from different regions are not comparable.
 */
public record ItemSnapshot(
    String nameDigest,
    String descriptionDigest,
    Integer price,
    String currency,
    List<String> languages,
    List<String> genres,
    List<String> platforms,
    String releaseDate,
    boolean comingSoon,
    List<String> imageUrls,
    String priceRegion
) {
    public ItemSnapshot {
        languages = sortedDistinct(languages);
        genres = sortedDistinct(genres);
        platforms = sortedDistinct(platforms);
        imageUrls = sortedDistinct(imageUrls);
    }

    /**
     * Copy of this snapshot carrying the price of {@code other}.
     */
    public ItemSnapshot withPriceOf(ItemSnapshot other) {
        return new ItemSnapshot(
            nameDigest,
            descriptionDigest,
            other.price(),
            other.currency(),
            languages,
            genres,
            platforms,
            releaseDate,
            comingSoon,
            imageUrls,
            other.priceRegion()
        );
    }

    public ItemSnapshot withPriceRegion(String region) {
        return new ItemSnapshot(
            nameDigest,
            descriptionDigest,
            price,
            currency,
            languages,
            genres,
            platforms,
            releaseDate,
            comingSoon,
            imageUrls,
            region
        );
    }

    private static List<String> sortedDistinct(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                sorted.add(value);
            }
        }
        return List.copyOf(sorted);
    }
}
