package com.storewatch.tracker.crawl.service;

import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.feed.FeedPublisher;
import com.storewatch.tracker.crawl.model.CrawlRunSummary;
import com.storewatch.tracker.crawl.model.CrawlState;
import com.storewatch.tracker.crawl.persistence.CrawlStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
public class CrawlCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CrawlCliRunner.class);

    private final CrawlerProperties properties;
    private final CrawlStateStore stateStore;
    private final CatalogCrawlService crawlService;
    private final FeedPublisher feedPublisher;
    private final Clock clock;
    private final ConfigurableApplicationContext applicationContext;

    public CrawlCliRunner(
        CrawlerProperties properties,
        CrawlStateStore stateStore,
        CatalogCrawlService crawlService,
        FeedPublisher feedPublisher,
        Clock crawlClock,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.stateStore = stateStore;
        this.crawlService = crawlService;
        this.feedPublisher = feedPublisher;
        this.clock = crawlClock;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CrawlState state = stateStore.load();
        CrawlRunSummary summary = crawlService.runOnce(state, clock.instant());
        int feeds = feedPublisher.publish(state, summary.finishedAt());
        log.info(
            "Crawl finished with status {} in {} ms, {} feed file(s) written",
            summary.status(),
            summary.finishedAt().toEpochMilli() - summary.startedAt().toEpochMilli(),
            feeds
        );

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
