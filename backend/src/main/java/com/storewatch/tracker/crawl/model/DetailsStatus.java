package com.storewatch.tracker.crawl.model;

public enum DetailsStatus {
    FOUND,
    NOT_FOUND,
    RATE_LIMITED,
    TRANSIENT
}
