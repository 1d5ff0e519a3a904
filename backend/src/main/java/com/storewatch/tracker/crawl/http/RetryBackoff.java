package com.storewatch.tracker.crawl.http;

import java.util.Random;

/**
 * Exponential backoff with jitter: the delay for attempt {@code n} is drawn from
 * {@code [d/2, d)} where {@code d = base * 2^(n-1)} capped at {@code max}.
 */
public final class RetryBackoff {
    private final int baseDelayMs;
    private final int maxDelayMs;
    private final Random random;

    public RetryBackoff(int baseDelayMs, int maxDelayMs, Random random) {
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxDelayMs = Math.max(0, maxDelayMs);
        this.random = random;
    }

    public long delayForAttempt(int attempt) {
        if (baseDelayMs <= 0) {
            return 0L;
        }
        int shift = Math.min(30, Math.max(0, attempt - 1));
        long delay = (long) baseDelayMs * (1L << shift);
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 1) {
            return delay;
        }
        long half = delay / 2;
        return half + random.nextLong(Math.max(1L, delay - half));
    }
}
