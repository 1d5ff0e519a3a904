package com.storewatch.tracker.crawl.persistence;

public class StateCorruptException extends RuntimeException {
    public StateCorruptException(String message) {
        super(message);
    }

    public StateCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
