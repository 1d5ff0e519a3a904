package com.storewatch.tracker.crawl.diff;

import com.storewatch.tracker.crawl.model.FieldChange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ChangeSummaryFormatter {
    public static final int MAX_SUMMARY_CHANGES = 3;

    private ChangeSummaryFormatter() {
    }

    /**
     * Short label of at most {@value #MAX_SUMMARY_CHANGES} changes, highest priority first.
     */
    public static String summarize(List<FieldChange> changes) {
        if (changes == null || changes.isEmpty()) {
            return "";
        }
        List<FieldChange> ordered = new ArrayList<>(changes);
        ordered.sort(Comparator.comparingInt(change -> change.field().ordinal()));
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < ordered.size() && i < MAX_SUMMARY_CHANGES; i++) {
            parts.add(describe(ordered.get(i)));
        }
        String label = String.join(" / ", parts);
        int hidden = ordered.size() - parts.size();
        return hidden > 0 ? label + " (+" + hidden + " more)" : label;
    }

    public static String describe(FieldChange change) {
        String label = change.field().label();
        return switch (change.field()) {
            case DESCRIPTION, IMAGES -> label + " updated";
            case TITLE -> label + " changed";
            case LANGUAGES, GENRES, PLATFORMS -> label + ": " + setDelta(change.oldValue(), change.newValue());
            case PRICE, RELEASE -> label + ": " + orNone(change.oldValue()) + " -> " + orNone(change.newValue());
        };
    }

    private static String setDelta(String before, String after) {
        Set<String> oldValues = split(before);
        Set<String> newValues = split(after);
        List<String> parts = new ArrayList<>();
        for (String value : newValues) {
            if (!oldValues.contains(value)) {
                parts.add("+" + value);
            }
        }
        for (String value : oldValues) {
            if (!newValues.contains(value)) {
                parts.add("-" + value);
            }
        }
        return String.join(" ", parts);
    }

    private static Set<String> split(String joined) {
        if (joined == null || joined.isBlank()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(joined.split(", ")));
    }

    private static String orNone(String value) {
        return value == null ? "none" : value;
    }
}
