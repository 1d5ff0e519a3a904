package com.storewatch.tracker.crawl.model;

/**
 * Result of a single detail request against one locale.
 */
public record DetailsResponse(DetailsStatus status, ItemRecord record, String reasonCode) {

    public static DetailsResponse found(ItemRecord record) {
        return new DetailsResponse(DetailsStatus.FOUND, record, null);
    }

    public static DetailsResponse notFound(String reasonCode) {
        return new DetailsResponse(DetailsStatus.NOT_FOUND, null, reasonCode);
    }

    public static DetailsResponse rateLimited(String reasonCode) {
        return new DetailsResponse(DetailsStatus.RATE_LIMITED, null, reasonCode);
    }

    public static DetailsResponse transientFailure(String reasonCode) {
        return new DetailsResponse(DetailsStatus.TRANSIENT, null, reasonCode);
    }

    public boolean isRetryable() {
        return status == DetailsStatus.RATE_LIMITED || status == DetailsStatus.TRANSIENT;
    }
}
