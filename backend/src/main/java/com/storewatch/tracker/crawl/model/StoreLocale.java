package com.storewatch.tracker.crawl.model;

import java.util.Locale;

/**
 * Language and country pair sent with a detail request, e.g. {@code english:US}.
 */
public record StoreLocale(String language, String countryCode) {

    public StoreLocale {
        language = language == null || language.isBlank() ? "english" : language.trim().toLowerCase(Locale.ROOT);
        countryCode = countryCode == null || countryCode.isBlank() ? "US" : countryCode.trim().toUpperCase(Locale.ROOT);
    }

    public static StoreLocale parse(String value) {
        if (value == null || value.isBlank()) {
            return new StoreLocale(null, null);
        }
        String[] parts = value.split(":", 2);
        if (parts.length == 1) {
            return new StoreLocale(parts[0], null);
        }
        return new StoreLocale(parts[0], parts[1]);
    }

    @Override
    public String toString() {
        return language + ":" + countryCode;
    }
}
