package com.storewatch.tracker.crawl;

import com.storewatch.tracker.config.CrawlerProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("store-watch-tracker/0.1"));
    }

    @Test
    void scanLimitsAreClamped() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.getScan().setBatchSize(0);
        properties.getScan().setNewArrivalCap(-5);
        properties.getEvents().setMaxNewEvents(0);
        assertEquals(1, properties.getScan().getBatchSize());
        assertEquals(0, properties.getScan().getNewArrivalCap());
        assertEquals(1, properties.getEvents().getMaxNewEvents());
    }

    @Test
    void slowModeSpacingNeverDropsBelowNormalSpacing() {
        CrawlerProperties properties = new CrawlerProperties();
        properties.setMinRequestSpacingMs(2000);
        properties.setSlowModeSpacingMs(500);
        assertEquals(2000, properties.getSlowModeSpacingMs());
    }
}
