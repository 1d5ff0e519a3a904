package com.storewatch.tracker.crawl.store;

public class ListingUnavailableException extends RuntimeException {
    public ListingUnavailableException(String message) {
        super(message);
    }

    public ListingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
