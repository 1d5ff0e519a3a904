package com.storewatch.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {
    private static final String DEFAULT_USER_AGENT = "store-watch-tracker/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 15;
    private int requestMaxRetries = 3;
    private int requestRetryBaseDelayMs = 1000;
    private int requestRetryMaxDelayMs = 16000;
    private int minRequestSpacingMs = 1500;
    private int slowModeSpacingMs = 5000;
    private int slowModeCooldownSeconds = 300;
    private Store store = new Store();
    private Scan scan = new Scan();
    private Events events = new Events();
    private State state = new State();
    private Feed feed = new Feed();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public int getMinRequestSpacingMs() {
        return Math.max(0, minRequestSpacingMs);
    }

    public void setMinRequestSpacingMs(int minRequestSpacingMs) {
        this.minRequestSpacingMs = Math.max(0, minRequestSpacingMs);
    }

    public int getSlowModeSpacingMs() {
        return Math.max(getMinRequestSpacingMs(), slowModeSpacingMs);
    }

    public void setSlowModeSpacingMs(int slowModeSpacingMs) {
        this.slowModeSpacingMs = Math.max(0, slowModeSpacingMs);
    }

    public int getSlowModeCooldownSeconds() {
        return Math.max(0, slowModeCooldownSeconds);
    }

    public void setSlowModeCooldownSeconds(int slowModeCooldownSeconds) {
        this.slowModeCooldownSeconds = Math.max(0, slowModeCooldownSeconds);
    }

    public Store getStore() {
        return store;
    }

    public void setStore(Store store) {
        this.store = store;
    }

    public Scan getScan() {
        return scan;
    }

    public void setScan(Scan scan) {
        this.scan = scan;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Store {
        private String listingUrl = "https://api.steampowered.com/ISteamApps/GetAppList/v2/";
        private String detailsUrl = "https://store.steampowered.com/api/appdetails";
        private String appPageUrlTemplate = "https://store.steampowered.com/app/%d/";
        private String primaryLocale = "english:US";
        private List<String> fallbackLocales = new ArrayList<>(List.of("english:JP"));

        public String getListingUrl() {
            return listingUrl;
        }

        public void setListingUrl(String listingUrl) {
            this.listingUrl = listingUrl;
        }

        public String getDetailsUrl() {
            return detailsUrl;
        }

        public void setDetailsUrl(String detailsUrl) {
            this.detailsUrl = detailsUrl;
        }

        public String getAppPageUrlTemplate() {
            return appPageUrlTemplate;
        }

        public void setAppPageUrlTemplate(String appPageUrlTemplate) {
            this.appPageUrlTemplate = appPageUrlTemplate;
        }

        public String getPrimaryLocale() {
            return primaryLocale;
        }

        public void setPrimaryLocale(String primaryLocale) {
            this.primaryLocale = primaryLocale;
        }

        public List<String> getFallbackLocales() {
            return fallbackLocales;
        }

        public void setFallbackLocales(List<String> fallbackLocales) {
            this.fallbackLocales = fallbackLocales == null ? new ArrayList<>() : fallbackLocales;
        }
    }

    public static class Scan {
        private int batchSize = 300;
        private int newArrivalCap = 200;
        private int pendingRetryCap = 100;
        private int maxDurationSeconds = 540;

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getNewArrivalCap() {
            return Math.max(0, newArrivalCap);
        }

        public void setNewArrivalCap(int newArrivalCap) {
            this.newArrivalCap = Math.max(0, newArrivalCap);
        }

        public int getPendingRetryCap() {
            return Math.max(0, pendingRetryCap);
        }

        public void setPendingRetryCap(int pendingRetryCap) {
            this.pendingRetryCap = Math.max(0, pendingRetryCap);
        }

        public int getMaxDurationSeconds() {
            return Math.max(0, maxDurationSeconds);
        }

        public void setMaxDurationSeconds(int maxDurationSeconds) {
            this.maxDurationSeconds = Math.max(0, maxDurationSeconds);
        }
    }

    public static class Events {
        private int maxNewEvents = 300;
        private int maxChangeEvents = 300;

        public int getMaxNewEvents() {
            return Math.max(1, maxNewEvents);
        }

        public void setMaxNewEvents(int maxNewEvents) {
            this.maxNewEvents = Math.max(1, maxNewEvents);
        }

        public int getMaxChangeEvents() {
            return Math.max(1, maxChangeEvents);
        }

        public void setMaxChangeEvents(int maxChangeEvents) {
            this.maxChangeEvents = Math.max(1, maxChangeEvents);
        }
    }

    public static class State {
        private String path = "state/state.json.gz";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Feed {
        private boolean enabled = true;
        private String newFeedPath = "feed_new.xml";
        private String changeFeedPath = "feed_updates.xml";
        private String channelLink = "https://store.steampowered.com/";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNewFeedPath() {
            return newFeedPath;
        }

        public void setNewFeedPath(String newFeedPath) {
            this.newFeedPath = newFeedPath;
        }

        public String getChangeFeedPath() {
            return changeFeedPath;
        }

        public void setChangeFeedPath(String changeFeedPath) {
            this.changeFeedPath = changeFeedPath;
        }

        public String getChannelLink() {
            return channelLink;
        }

        public void setChannelLink(String channelLink) {
            this.channelLink = channelLink;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
