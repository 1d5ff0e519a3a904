package com.storewatch.tracker.crawl.diff;

import com.storewatch.tracker.crawl.model.FieldChange;
import com.storewatch.tracker.crawl.model.ItemSnapshot;
import com.storewatch.tracker.crawl.model.SnapshotField;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotDifferTest {
    private final SnapshotDiffer differ = new SnapshotDiffer();

    @Test
    void identicalSnapshotsHaveNoChanges() {
        ItemSnapshot snapshot = snapshot("aaaa", 1999, List.of("english"), List.of("h.jpg"));

        assertThat(differ.diff(snapshot, snapshot)).isEmpty();
        assertThat(differ.diff(snapshot, snapshot("aaaa", 1999, List.of("english"), List.of("h.jpg")))).isEmpty();
    }

    @Test
    void addedLanguageIsTheOnlyChange() {
        ItemSnapshot before = snapshot("aaaa", 1999, List.of("english"), List.of("h.jpg"));
        ItemSnapshot after = snapshot("aaaa", 1999, List.of("japanese", "english"), List.of("h.jpg"));

        List<FieldChange> changes = differ.diff(before, after);

        assertThat(changes).extracting(FieldChange::field).containsExactly(SnapshotField.LANGUAGES);
        assertThat(ChangeSummaryFormatter.summarize(changes)).isEqualTo("Languages: +japanese");
    }

    @Test
    void changesFollowFieldPriority() {
        ItemSnapshot before = snapshot("aaaa", 1999, List.of("english"), List.of("h.jpg"));
        ItemSnapshot after = snapshot("bbbb", 999, List.of("english"), List.of("h2.jpg"));

        List<FieldChange> changes = differ.diff(before, after);

        assertThat(changes).extracting(FieldChange::field)
            .containsExactly(SnapshotField.PRICE, SnapshotField.IMAGES, SnapshotField.TITLE);
        assertThat(changes.get(0).oldValue()).isEqualTo("1999 USD");
        assertThat(changes.get(0).newValue()).isEqualTo("999 USD");
    }

    @Test
    void priceFromAnotherRegionIsNotCompared() {
        ItemSnapshot before = snapshot("Game", 1999, List.of("english"), List.of("h.jpg"));
        ItemSnapshot after = new ItemSnapshot(before.nameDigest(), "desc", 148000, "JPY", List.of("english"),
            List.of("Action"), List.of("windows"), "1 Jan, 2026", false, List.of("h.jpg"), "english:JP");

        assertThat(differ.diff(before, after)).isEmpty();
    }

    @Test
    void comingSoonFlagAffectsRelease() {
        ItemSnapshot before = new ItemSnapshot("n", "d", 0, "USD", List.of(), List.of(), List.of(), null, true, List.of(), null);
        ItemSnapshot after = new ItemSnapshot("n", "d", 0, "USD", List.of(), List.of(), List.of(), "5 May, 2026", false, List.of(), null);

        List<FieldChange> changes = differ.diff(before, after);

        assertThat(changes).hasSize(1);
        assertThat(ChangeSummaryFormatter.describe(changes.get(0)))
            .isEqualTo("Release: TBA (coming soon) -> 5 May, 2026");
    }

    private static ItemSnapshot snapshot(String name, int price, List<String> languages, List<String> images) {
        return new ItemSnapshot(name, "desc", price, "USD", languages, List.of("Action"), List.of("windows"),
            "1 Jan, 2026", false, images, "english:US");
    }
}
