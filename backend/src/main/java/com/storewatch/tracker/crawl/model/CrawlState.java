package com.storewatch.tracker.crawl.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Durable aggregate loaded once at run start and written once at run end. Mutated only
 * by the single crawl thread of a run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CrawlState {
    public static final int CURRENT_SCHEMA_VERSION = 2;

    private int schemaVersion = CURRENT_SCHEMA_VERSION;
    private int cursor;
    private Map<Long, SeenEntry> seenEntries = new TreeMap<>();
    private Set<Long> pendingQueue = new LinkedHashSet<>();
    private Map<Long, ItemSnapshot> snapshots = new TreeMap<>();
    private List<FeedEvent> newEvents = new ArrayList<>();
    private List<FeedEvent> changeEvents = new ArrayList<>();
    private List<Long> lastIdentifierOrdering = new ArrayList<>();
    private RunStats lastRun;

    public static CrawlState empty() {
        return new CrawlState();
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(int schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public int getCursor() {
        return cursor;
    }

    public void setCursor(int cursor) {
        this.cursor = cursor;
    }

    public Map<Long, SeenEntry> getSeenEntries() {
        return seenEntries;
    }

    public void setSeenEntries(Map<Long, SeenEntry> seenEntries) {
        this.seenEntries = seenEntries == null ? new TreeMap<>() : new TreeMap<>(seenEntries);
    }

    public Set<Long> getPendingQueue() {
        return pendingQueue;
    }

    @JsonDeserialize(as = LinkedHashSet.class)
    public void setPendingQueue(Set<Long> pendingQueue) {
        this.pendingQueue = pendingQueue == null ? new LinkedHashSet<>() : new LinkedHashSet<>(pendingQueue);
    }

    public Map<Long, ItemSnapshot> getSnapshots() {
        return snapshots;
    }

    public void setSnapshots(Map<Long, ItemSnapshot> snapshots) {
        this.snapshots = snapshots == null ? new TreeMap<>() : new TreeMap<>(snapshots);
    }

    public List<FeedEvent> getNewEvents() {
        return newEvents;
    }

    public void setNewEvents(List<FeedEvent> newEvents) {
        this.newEvents = newEvents == null ? new ArrayList<>() : new ArrayList<>(newEvents);
    }

    public List<FeedEvent> getChangeEvents() {
        return changeEvents;
    }

    public void setChangeEvents(List<FeedEvent> changeEvents) {
        this.changeEvents = changeEvents == null ? new ArrayList<>() : new ArrayList<>(changeEvents);
    }

    public List<Long> getLastIdentifierOrdering() {
        return lastIdentifierOrdering;
    }

    public void setLastIdentifierOrdering(List<Long> lastIdentifierOrdering) {
        this.lastIdentifierOrdering = lastIdentifierOrdering == null
            ? new ArrayList<>()
            : new ArrayList<>(lastIdentifierOrdering);
    }

    public RunStats getLastRun() {
        return lastRun;
    }

    public void setLastRun(RunStats lastRun) {
        this.lastRun = lastRun;
    }
}
