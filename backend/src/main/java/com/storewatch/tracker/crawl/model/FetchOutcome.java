package com.storewatch.tracker.crawl.model;

/**
 * Logical result of resolving one identifier: either a record or not found. Retry
 * exhaustion is folded into not found; {@code reasonCode} keeps the last failure seen.
 * {@code locale} is the store region that answered, set only when found.
 */
public record FetchOutcome(long appId, ItemRecord record, StoreLocale locale, String reasonCode, int requestCount) {

    public static FetchOutcome found(long appId, ItemRecord record, StoreLocale locale, int requestCount) {
        return new FetchOutcome(appId, record, locale, null, requestCount);
    }

    public static FetchOutcome notFound(long appId, String reasonCode, int requestCount) {
        return new FetchOutcome(appId, null, null, reasonCode, requestCount);
    }

    public boolean isFound() {
        return record != null;
    }
}
