package com.storewatch.tracker.crawl.model;

public enum EventKind {
    NEW,
    CHANGED
}
