package com.storewatch.tracker.crawl.service;

import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.diff.SnapshotDiffer;
import com.storewatch.tracker.crawl.diff.SnapshotExtractor;
import com.storewatch.tracker.crawl.events.FeedEventFactory;
import com.storewatch.tracker.crawl.events.FeedEventStore;
import com.storewatch.tracker.crawl.http.FetchPacingContext;
import com.storewatch.tracker.crawl.model.CrawlRunSummary;
import com.storewatch.tracker.crawl.model.CrawlState;
import com.storewatch.tracker.crawl.model.FetchOutcome;
import com.storewatch.tracker.crawl.model.FieldChange;
import com.storewatch.tracker.crawl.model.ItemRecord;
import com.storewatch.tracker.crawl.model.ItemSnapshot;
import com.storewatch.tracker.crawl.model.RunStats;
import com.storewatch.tracker.crawl.model.SeenEntry;
import com.storewatch.tracker.crawl.model.StoreLocale;
import com.storewatch.tracker.crawl.persistence.CrawlStateStore;
import com.storewatch.tracker.crawl.scan.PendingRetryQueue;
import com.storewatch.tracker.crawl.scan.RollingScanner;
import com.storewatch.tracker.crawl.store.ResilientFetchClient;
import com.storewatch.tracker.crawl.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One crawl run: new arrivals first, then a sample of the pending queue, then the rolling
 * window. State is loaded once and saved once, including when the run fails part way.
 */
@Service
public class CatalogCrawlService {
    private static final Logger log = LoggerFactory.getLogger(CatalogCrawlService.class);

    static final String STATUS_COMPLETED = "COMPLETED";
    static final String STATUS_DEADLINE_REACHED = "DEADLINE_REACHED";
    static final String STATUS_INTERRUPTED = "INTERRUPTED";
    static final String STATUS_FAILED = "FAILED";

    private final CrawlStateStore stateStore;
    private final RollingScanner scanner;
    private final PendingRetryQueue pendingQueue;
    private final ResilientFetchClient fetchClient;
    private final SnapshotExtractor extractor;
    private final SnapshotDiffer differ;
    private final FeedEventFactory eventFactory;
    private final FeedEventStore eventStore;
    private final CrawlerProperties properties;
    private final Clock clock;

    public CatalogCrawlService(
        CrawlStateStore stateStore,
        RollingScanner scanner,
        PendingRetryQueue pendingQueue,
        ResilientFetchClient fetchClient,
        SnapshotExtractor extractor,
        SnapshotDiffer differ,
        FeedEventFactory eventFactory,
        FeedEventStore eventStore,
        CrawlerProperties properties,
        Clock crawlClock
    ) {
        this.stateStore = stateStore;
        this.scanner = scanner;
        this.pendingQueue = pendingQueue;
        this.fetchClient = fetchClient;
        this.extractor = extractor;
        this.differ = differ;
        this.eventFactory = eventFactory;
        this.eventStore = eventStore;
        this.properties = properties;
        this.clock = crawlClock;
    }

    public CrawlRunSummary runOnce() {
        Instant startedAt = clock.instant();
        CrawlState state = stateStore.load();
        return runOnce(state, startedAt);
    }

    /**
     * Runs against an already loaded state and persists it when done.
     */
    public CrawlRunSummary runOnce(CrawlState state, Instant startedAt) {
        FetchPacingContext pacing = FetchPacingContext.fromProperties(properties, clock);
        CrawlerProperties.Scan scan = properties.getScan();
        Instant deadline = scan.getMaxDurationSeconds() > 0
            ? startedAt.plusSeconds(scan.getMaxDurationSeconds())
            : null;
        RunCounters counters = new RunCounters();
        String status = STATUS_FAILED;
        RuntimeException failure = null;
        try {
            scanner.refreshOrdering(state, pacing);
            Set<Long> processed = new HashSet<>();

            runPhase(state, scanner.selectNewArrivals(state, scan.getNewArrivalCap()), Phase.NEW_ARRIVALS,
                processed, deadline, pacing, counters);
            if (counters.stopStatus == null) {
                runPhase(state, pendingQueue.sample(state, scan.getPendingRetryCap()), Phase.PENDING,
                    processed, deadline, pacing, counters);
            }
            int consumed = 0;
            if (counters.stopStatus == null) {
                consumed = runPhase(state, scanner.nextWindow(state, scan.getBatchSize()), Phase.WINDOW,
                    processed, deadline, pacing, counters);
            }
            scanner.advance(state, consumed);

            if (STATUS_DEADLINE_REACHED.equals(counters.stopStatus)) {
                log.warn("Run deadline of {}s reached after {} identifiers", scan.getMaxDurationSeconds(), processed.size());
            } else if (STATUS_INTERRUPTED.equals(counters.stopStatus)) {
                log.warn("Run interrupted after {} identifiers", processed.size());
            }
            status = counters.stopStatus == null ? STATUS_COMPLETED : counters.stopStatus;
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            state.setLastRun(new RunStats(
                clock.instant(),
                status,
                state.getLastIdentifierOrdering().size(),
                counters.newEvents,
                counters.changeEvents,
                pendingQueue.size(state)
            ));
            try {
                stateStore.save(state);
            } catch (RuntimeException saveFailure) {
                if (failure == null) {
                    throw saveFailure;
                }
                failure.addSuppressed(saveFailure);
                log.error("Failed to save crawl state after a failed run", saveFailure);
            }
        }

        CrawlRunSummary summary = new CrawlRunSummary(
            startedAt,
            state.getLastRun().finishedAt(),
            status,
            state.getLastIdentifierOrdering().size(),
            counters.newArrivalsChecked,
            counters.pendingChecked,
            counters.windowChecked,
            counters.newEvents,
            counters.changeEvents,
            counters.failures,
            pendingQueue.size(state),
            state.getCursor(),
            pacing.slowModeActivations()
        );
        log.info(
            "Crawl run {}: ordering={}, checked={} (new={}, pending={}, window={}), newEvents={}, changeEvents={}, "
                + "failures={}, pending={}, cursor={}, slowMode={}",
            summary.status(),
            summary.orderingSize(),
            summary.totalChecked(),
            summary.newArrivalsChecked(),
            summary.pendingChecked(),
            summary.windowChecked(),
            summary.newEventsEmitted(),
            summary.changeEventsEmitted(),
            summary.failures(),
            summary.pendingSize(),
            summary.cursor(),
            summary.slowModeActivations()
        );
        return summary;
    }

    /**
     * Processes {@code ids} in order until the deadline passes or the thread is interrupted.
     *
     * @return positions consumed; an identifier cut short by an interrupt is not consumed
     */
    private int runPhase(
        CrawlState state,
        List<Long> ids,
        Phase phase,
        Set<Long> processed,
        Instant deadline,
        FetchPacingContext pacing,
        RunCounters counters
    ) {
        int consumed = 0;
        for (Long appId : ids) {
            if (pastDeadline(deadline)) {
                counters.stopStatus = STATUS_DEADLINE_REACHED;
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                counters.stopStatus = STATUS_INTERRUPTED;
                break;
            }
            if (processed.add(appId)) {
                processIdentifier(state, appId, pacing, counters);
                if (Thread.currentThread().isInterrupted()) {
                    counters.stopStatus = STATUS_INTERRUPTED;
                    break;
                }
                counters.checked(phase);
            }
            consumed++;
        }
        return consumed;
    }

    private void processIdentifier(CrawlState state, long appId, FetchPacingContext pacing, RunCounters counters) {
        try {
            FetchOutcome outcome = fetchClient.fetch(appId, pacing);
            if (outcome.isFound()) {
                applyFound(state, outcome, counters);
            } else if (ReasonCodeClassifier.INTERRUPTED.equals(outcome.reasonCode())) {
                log.debug("App {} left unfetched after interrupt", appId);
            } else {
                applyNotFound(state, appId, outcome.reasonCode());
            }
        } catch (RuntimeException e) {
            counters.failures++;
            log.warn("Failed to process app {}", appId, e);
        }
    }

    private void applyFound(CrawlState state, FetchOutcome outcome, RunCounters counters) {
        ItemRecord record = outcome.record();
        long appId = record.appId();
        Instant now = clock.instant();
        ItemSnapshot current = extractor.extract(record, outcome.locale());
        SeenEntry seen = state.getSeenEntries().get(appId);

        if (seen == null || !seen.everDetected()) {
            state.getSeenEntries().put(appId, SeenEntry.detected(now));
            if (eventStore.recordNew(state, eventFactory.newArrival(record, now))) {
                counters.newEvents++;
                log.info("New item detected: {} ({})", record.displayName(), appId);
            }
        } else {
            ItemSnapshot previous = state.getSnapshots().get(appId);
            if (previous != null) {
                current = keepPrimaryPrice(previous, current);
                List<FieldChange> changes = differ.diff(withRegion(previous), current);
                if (!changes.isEmpty()) {
                    eventStore.recordChange(state, eventFactory.changed(record, changes, now));
                    counters.changeEvents++;
                    log.info("Item {} ({}) changed: {}", record.displayName(), appId, changes.size());
                }
            }
        }
        state.getSnapshots().put(appId, current);
        pendingQueue.resolve(state, appId);
    }

    /**
     * A fallback region answer keeps the stored price; only the primary region may move it.
     */
    private ItemSnapshot keepPrimaryPrice(ItemSnapshot previous, ItemSnapshot current) {
        String primary = primaryRegion();
        ItemSnapshot stored = withRegion(previous);
        if (current.priceRegion() == null
            || primary.equals(current.priceRegion())
            || current.priceRegion().equals(stored.priceRegion())) {
            return current;
        }
        log.debug("Keeping {} price, lookup was answered by {}", stored.priceRegion(), current.priceRegion());
        return current.withPriceOf(stored);
    }

    // snapshots saved before regions were tracked were read from the primary locale
    private ItemSnapshot withRegion(ItemSnapshot snapshot) {
        return snapshot.priceRegion() == null ? snapshot.withPriceRegion(primaryRegion()) : snapshot;
    }

    private String primaryRegion() {
        return StoreLocale.parse(properties.getStore().getPrimaryLocale()).toString();
    }

    private void applyNotFound(CrawlState state, long appId, String reasonCode) {
        SeenEntry seen = state.getSeenEntries().get(appId);
        if (seen == null) {
            state.getSeenEntries().put(appId, SeenEntry.unresolved());
        }
        if (seen == null || !seen.everDetected()) {
            pendingQueue.enqueue(state, appId);
            log.debug("App {} not resolved ({}), queued for retry", appId, reasonCode);
        }
    }

    private boolean pastDeadline(Instant deadline) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    private enum Phase {
        NEW_ARRIVALS,
        PENDING,
        WINDOW
    }

    private static final class RunCounters {
        private String stopStatus;
        private int newArrivalsChecked;
        private int pendingChecked;
        private int windowChecked;
        private int newEvents;
        private int changeEvents;
        private int failures;

        private void checked(Phase phase) {
            switch (phase) {
                case NEW_ARRIVALS -> newArrivalsChecked++;
                case PENDING -> pendingChecked++;
                case WINDOW -> windowChecked++;
            }
        }
    }
}
