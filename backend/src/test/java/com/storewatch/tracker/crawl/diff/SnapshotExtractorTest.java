package com.storewatch.tracker.crawl.diff;

import com.storewatch.tracker.crawl.model.ItemRecord;
import com.storewatch.tracker.crawl.model.ItemSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotExtractorTest {
    private final SnapshotExtractor extractor = new SnapshotExtractor();

    @Test
    void cacheBustingParametersDoNotChangeSnapshot() {
        ItemSnapshot first = extractor.extract(record("https://cdn.example/h.jpg?t=1700000000", List.of("b.jpg", "a.jpg")));
        ItemSnapshot second = extractor.extract(record("https://cdn.example/h.jpg?t=1800000000", List.of("a.jpg", "b.jpg")));

        assertThat(second).isEqualTo(first);
        assertThat(first.imageUrls()).containsExactly("a.jpg", "b.jpg", "https://cdn.example/h.jpg");
    }

    @Test
    void stripVolatileQueryKeepsMeaningfulParameters() {
        assertThat(SnapshotExtractor.stripVolatileQuery("https://cdn.example/x.jpg?t=1&size=2#top"))
            .isEqualTo("https://cdn.example/x.jpg?size=2");
        assertThat(SnapshotExtractor.stripVolatileQuery("https://cdn.example/x.jpg?v=3&ts=4"))
            .isEqualTo("https://cdn.example/x.jpg");
        assertThat(SnapshotExtractor.stripVolatileQuery(" ")).isNull();
    }

    @Test
    void freeItemWithoutPriceHasZeroPrice() {
        ItemRecord free = new ItemRecord(1L, "Free Game", "game", true, null, "usd", null, null, null,
            null, List.of(), null, false, List.of(), List.of());

        ItemSnapshot snapshot = extractor.extract(free);

        assertThat(snapshot.price()).isZero();
        assertThat(snapshot.currency()).isEqualTo("USD");
        assertThat(snapshot.descriptionDigest()).isNull();
    }

    @Test
    void descriptionFallsBackToDetailedText() {
        ItemRecord withoutShort = new ItemRecord(1L, "Game", "game", false, 500, "EUR", "English", null,
            "Detailed", null, List.of(), null, false, List.of(), List.of());

        assertThat(extractor.extract(withoutShort).descriptionDigest()).hasSize(16);
    }

    @Test
    void platformsAndGenresAreNormalized() {
        ItemRecord record = new ItemRecord(1L, "Game", "game", false, 500, "EUR", "English", "d", null, null,
            List.of(), null, false, List.of(" Action ", "Indie", "Action"), List.of("Windows", "linux"));

        ItemSnapshot snapshot = extractor.extract(record);

        assertThat(snapshot.genres()).containsExactly("Action", "Indie");
        assertThat(snapshot.platforms()).containsExactly("linux", "windows");
    }

    private static ItemRecord record(String header, List<String> screenshots) {
        return new ItemRecord(10L, "Game", "game", false, 1999, "USD", "English", "Short", null,
            header, screenshots, "1 Jan, 2026", false, List.of("Action"), List.of("windows"));
    }
}
