package com.storewatch.tracker.crawl.http;

import com.storewatch.tracker.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Request pacing shared by every outbound call of one run: the time of the last request
 * and the slow-mode window entered after a rate-limit signal. Built fresh per run and
 * only touched from the crawl thread.
 */
public class FetchPacingContext {
    private static final Logger log = LoggerFactory.getLogger(FetchPacingContext.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final long minSpacingMs;
    private final long slowModeSpacingMs;
    private final Duration slowModeCooldown;
    private final Clock clock;
    private final Sleeper sleeper;

    private Instant lastRequestAt;
    private Instant slowModeUntil;
    private int slowModeActivations;
    private int requestCount;

    public FetchPacingContext(
        long minSpacingMs,
        long slowModeSpacingMs,
        Duration slowModeCooldown,
        Clock clock,
        Sleeper sleeper
    ) {
        this.minSpacingMs = Math.max(0, minSpacingMs);
        this.slowModeSpacingMs = Math.max(this.minSpacingMs, slowModeSpacingMs);
        this.slowModeCooldown = slowModeCooldown == null ? Duration.ZERO : slowModeCooldown;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public static FetchPacingContext fromProperties(CrawlerProperties properties, Clock clock) {
        return new FetchPacingContext(
            properties.getMinRequestSpacingMs(),
            properties.getSlowModeSpacingMs(),
            Duration.ofSeconds(properties.getSlowModeCooldownSeconds()),
            clock,
            Thread::sleep
        );
    }

    /**
     * Blocks until the current spacing has elapsed since the previous request, then
     * records the new request start.
     */
    public void awaitTurn() throws InterruptedException {
        long spacing = currentSpacingMs();
        if (lastRequestAt != null && spacing > 0) {
            Instant now = clock.instant();
            Instant allowedAt = lastRequestAt.plusMillis(spacing);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    sleeper.sleep(sleepMs);
                }
            }
        }
        lastRequestAt = clock.instant();
        requestCount++;
    }

    public void enterSlowMode() {
        Instant now = clock.instant();
        if (!isSlowMode()) {
            slowModeActivations++;
            log.warn("Rate limit signal received, spacing requests {} ms apart for {}s",
                slowModeSpacingMs, slowModeCooldown.toSeconds());
        }
        Instant candidate = now.plus(slowModeCooldown);
        if (slowModeUntil == null || candidate.isAfter(slowModeUntil)) {
            slowModeUntil = candidate;
        }
    }

    public boolean isSlowMode() {
        return slowModeUntil != null && slowModeUntil.isAfter(clock.instant());
    }

    public long currentSpacingMs() {
        return isSlowMode() ? slowModeSpacingMs : minSpacingMs;
    }

    public void pause(long millis) throws InterruptedException {
        if (millis > 0) {
            sleeper.sleep(millis);
        }
    }

    public int slowModeActivations() {
        return slowModeActivations;
    }

    public int requestCount() {
        return requestCount;
    }
}
