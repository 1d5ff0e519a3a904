package com.storewatch.tracker.crawl.feed;

public record FeedChannel(String title, String link, String description) {
}
