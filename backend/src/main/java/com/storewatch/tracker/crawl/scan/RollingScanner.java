package com.storewatch.tracker.crawl.scan;

import com.storewatch.tracker.crawl.http.FetchPacingContext;
import com.storewatch.tracker.crawl.model.CrawlState;
import com.storewatch.tracker.crawl.store.ListingUnavailableException;
import com.storewatch.tracker.crawl.store.StoreListingClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Owns the cursor into the identifier ordering. Each run reads a contiguous window that
 * wraps past the end of the ordering, and the cursor moves by what was attempted.
 */
@Service
public class RollingScanner {
    private static final Logger log = LoggerFactory.getLogger(RollingScanner.class);

    private final StoreListingClient listingClient;
    private final Random random;

    public RollingScanner(StoreListingClient listingClient, Random crawlRandom) {
        this.listingClient = listingClient;
        this.random = crawlRandom;
    }

    /**
     * Replaces the cached ordering with a fresh listing, keeping the cached one when the
     * listing is unavailable.
     *
     * @return true when a fresh listing was applied
     */
    public boolean refreshOrdering(CrawlState state, FetchPacingContext pacing) {
        boolean refreshed = false;
        try {
            List<Long> ordering = listingClient.listAllIdentifiers(pacing);
            state.setLastIdentifierOrdering(ordering);
            refreshed = true;
        } catch (ListingUnavailableException e) {
            log.warn("Listing unavailable, continuing with cached ordering of {} ids: {}",
                state.getLastIdentifierOrdering().size(), e.getMessage());
        }
        clampCursor(state);
        return refreshed;
    }

    public List<Long> nextWindow(CrawlState state, int batchSize) {
        clampCursor(state);
        return window(state.getLastIdentifierOrdering(), state.getCursor(), batchSize);
    }

    /**
     * Moves the cursor past {@code attempted} identifiers, modulo the ordering length.
     */
    public void advance(CrawlState state, int attempted) {
        int size = state.getLastIdentifierOrdering().size();
        if (size == 0) {
            state.setCursor(0);
            return;
        }
        clampCursor(state);
        long next = ((long) state.getCursor() + Math.max(0, attempted)) % size;
        state.setCursor((int) next);
    }

    /**
     * Identifiers in the ordering that have never been resolved. Above {@code cap} a uniform
     * random subset is returned, in no particular order.
     */
    public List<Long> selectNewArrivals(CrawlState state, int cap) {
        if (cap <= 0) {
            return List.of();
        }
        Map<Long, ?> seen = state.getSeenEntries();
        List<Long> candidates = new ArrayList<>();
        for (Long id : state.getLastIdentifierOrdering()) {
            if (!seen.containsKey(id)) {
                candidates.add(id);
            }
        }
        if (candidates.size() <= cap) {
            return candidates;
        }
        Collections.shuffle(candidates, random);
        return new ArrayList<>(candidates.subList(0, cap));
    }

    static List<Long> window(List<Long> ordering, int cursor, int batchSize) {
        int size = ordering.size();
        if (size == 0 || batchSize <= 0) {
            return List.of();
        }
        int start = cursor >= 0 && cursor < size ? cursor : 0;
        int length = Math.min(batchSize, size);
        List<Long> out = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            out.add(ordering.get((start + i) % size));
        }
        return out;
    }

    private static void clampCursor(CrawlState state) {
        int size = state.getLastIdentifierOrdering().size();
        if (state.getCursor() < 0 || state.getCursor() >= size) {
            state.setCursor(0);
        }
    }
}
