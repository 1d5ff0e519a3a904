package com.storewatch.tracker.crawl.store;

import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.http.FetchPacingContext;
import com.storewatch.tracker.crawl.http.RetryBackoff;
import com.storewatch.tracker.crawl.model.DetailsResponse;
import com.storewatch.tracker.crawl.model.DetailsStatus;
import com.storewatch.tracker.crawl.model.FetchOutcome;
import com.storewatch.tracker.crawl.model.StoreLocale;
import com.storewatch.tracker.crawl.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Resolves one identifier against the primary locale and then each fallback locale in
 * order. Throttling and transient failures are retried in-call with backoff; retry
 * exhaustion is reported as not found and left to the pending queue. An interrupt or a
 * malformed request URL ends the lookup at once.
 */
@Service
public class ResilientFetchClient {
    private static final Logger log = LoggerFactory.getLogger(ResilientFetchClient.class);

    private final StoreDetailsClient detailsClient;
    private final CrawlerProperties properties;
    private final RetryBackoff backoff;
    private final List<StoreLocale> locales;

    public ResilientFetchClient(StoreDetailsClient detailsClient, CrawlerProperties properties, Random crawlRandom) {
        this.detailsClient = detailsClient;
        this.properties = properties;
        this.backoff = new RetryBackoff(
            properties.getRequestRetryBaseDelayMs(),
            properties.getRequestRetryMaxDelayMs(),
            crawlRandom
        );
        this.locales = resolveLocales(properties.getStore());
    }

    public FetchOutcome fetch(long appId, FetchPacingContext pacing) {
        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        int requests = 0;
        String lastReason = null;
        for (StoreLocale locale : locales) {
            DetailsResponse last = null;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                last = detailsClient.fetchDetails(appId, locale, pacing);
                requests++;
                if (last.status() == DetailsStatus.FOUND) {
                    return FetchOutcome.found(appId, last.record(), locale, requests);
                }
                lastReason = last.reasonCode();
                if (ReasonCodeClassifier.isTerminal(lastReason) || Thread.currentThread().isInterrupted()) {
                    log.debug("App {} abandoned on {}: {}", appId, locale, lastReason);
                    return FetchOutcome.notFound(appId, lastReason, requests);
                }
                if (!last.isRetryable()) {
                    break;
                }
                if (last.status() == DetailsStatus.RATE_LIMITED) {
                    pacing.enterSlowMode();
                }
                if (attempt < maxAttempts && !sleepBackoff(attempt, pacing)) {
                    return FetchOutcome.notFound(appId, lastReason, requests);
                }
            }
            if (last != null && last.status() == DetailsStatus.RATE_LIMITED) {
                // other locales hit the same throttle
                log.debug("App {} still rate limited after {} attempts on {}", appId, maxAttempts, locale);
                return FetchOutcome.notFound(appId, lastReason, requests);
            }
        }
        return FetchOutcome.notFound(appId, lastReason, requests);
    }

    List<StoreLocale> locales() {
        return locales;
    }

    private boolean sleepBackoff(int attempt, FetchPacingContext pacing) {
        try {
            pacing.pause(backoff.delayForAttempt(attempt));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static List<StoreLocale> resolveLocales(CrawlerProperties.Store store) {
        Set<StoreLocale> ordered = new LinkedHashSet<>();
        ordered.add(StoreLocale.parse(store.getPrimaryLocale()));
        for (String fallback : store.getFallbackLocales()) {
            if (fallback != null && !fallback.isBlank()) {
                ordered.add(StoreLocale.parse(fallback));
            }
        }
        return List.copyOf(ordered);
    }
}
