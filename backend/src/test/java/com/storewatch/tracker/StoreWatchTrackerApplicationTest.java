package com.storewatch.tracker;

import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.persistence.CrawlStateStore;
import com.storewatch.tracker.crawl.service.CatalogCrawlService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class StoreWatchTrackerApplicationTest {

    @Autowired
    private CrawlerProperties properties;
    @Autowired
    private CrawlStateStore stateStore;
    @Autowired
    private CatalogCrawlService crawlService;

    @Test
    void contextLoadsWithTestProfile() {
        assertThat(crawlService).isNotNull();
        assertThat(properties.getCli().isRun()).isFalse();
        assertThat(properties.getFeed().isEnabled()).isFalse();
        assertThat(properties.getStore().getFallbackLocales()).containsExactly("english:JP");
        assertThat(stateStore.path().toString()).endsWith("state.json");
    }
}
