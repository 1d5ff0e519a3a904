package com.storewatch.tracker.crawl.scan;

import com.storewatch.tracker.crawl.model.CrawlState;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Identifiers that exist in the listing but have not yet produced a valid record. Each
 * run retries a random sample so one stuck identifier cannot starve the rest.
 */
@Service
public class PendingRetryQueue {
    private final Random random;

    public PendingRetryQueue(Random crawlRandom) {
        this.random = crawlRandom;
    }

    public void enqueue(CrawlState state, long appId) {
        state.getPendingQueue().add(appId);
    }

    public boolean resolve(CrawlState state, long appId) {
        return state.getPendingQueue().remove(appId);
    }

    public List<Long> sample(CrawlState state, int cap) {
        if (cap <= 0 || state.getPendingQueue().isEmpty()) {
            return List.of();
        }
        List<Long> pending = new ArrayList<>(state.getPendingQueue());
        if (pending.size() <= cap) {
            return pending;
        }
        Collections.shuffle(pending, random);
        return new ArrayList<>(pending.subList(0, cap));
    }

    public int size(CrawlState state) {
        return state.getPendingQueue().size();
    }
}
