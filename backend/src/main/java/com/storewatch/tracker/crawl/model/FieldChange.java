package com.storewatch.tracker.crawl.model;

public record FieldChange(SnapshotField field, String oldValue, String newValue) {
}
