package com.storewatch.tracker.crawl.diff;

import com.storewatch.tracker.crawl.model.FieldChange;
import com.storewatch.tracker.crawl.model.ItemSnapshot;
import com.storewatch.tracker.crawl.model.SnapshotField;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Field-by-field comparison of two snapshots. The result is ordered by
 * {@link SnapshotField} priority. Prices read from different store regions are not
 * compared, so the result can be empty for snapshots that differ only in price.
 */
@Component
public class SnapshotDiffer {

    public List<FieldChange> diff(ItemSnapshot previous, ItemSnapshot current) {
        List<FieldChange> changes = new ArrayList<>();
        boolean sameRegion = Objects.equals(previous.priceRegion(), current.priceRegion());
        for (SnapshotField field : SnapshotField.values()) {
            if (field == SnapshotField.PRICE && !sameRegion) {
                continue;
            }
            String before = valueOf(field, previous);
            String after = valueOf(field, current);
            if (!Objects.equals(before, after)) {
                changes.add(new FieldChange(field, before, after));
            }
        }
        return changes;
    }

    static String valueOf(SnapshotField field, ItemSnapshot snapshot) {
        if (snapshot == null) {
            return null;
        }
        return switch (field) {
            case PRICE -> snapshot.price() == null
                ? null
                : snapshot.price() + (snapshot.currency() == null ? "" : " " + snapshot.currency());
            case LANGUAGES -> joined(snapshot.languages());
            case DESCRIPTION -> snapshot.descriptionDigest();
            case IMAGES -> joined(snapshot.imageUrls());
            case TITLE -> snapshot.nameDigest();
            case GENRES -> joined(snapshot.genres());
            case PLATFORMS -> joined(snapshot.platforms());
            case RELEASE -> release(snapshot);
        };
    }

    private static String joined(List<String> values) {
        return values.isEmpty() ? null : String.join(", ", values);
    }

    private static String release(ItemSnapshot snapshot) {
        if (snapshot.releaseDate() == null && !snapshot.comingSoon()) {
            return null;
        }
        String date = snapshot.releaseDate() == null ? "TBA" : snapshot.releaseDate();
        return snapshot.comingSoon() ? date + " (coming soon)" : date;
    }
}
