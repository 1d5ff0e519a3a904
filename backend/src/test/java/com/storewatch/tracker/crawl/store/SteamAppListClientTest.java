package com.storewatch.tracker.crawl.store;

import com.storewatch.tracker.config.CrawlConfig;
import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.http.FetchPacingContext;
import com.storewatch.tracker.crawl.http.PoliteHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SteamAppListClientTest {
    private MockWebServer server;
    private ExecutorService executor;
    private SteamAppListClient listClient;
    private FetchPacingContext pacing;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(0);
        properties.getStore().setListingUrl(server.url("/ISteamApps/GetAppList/v2/").toString());

        executor = Executors.newFixedThreadPool(1);
        PoliteHttpClient httpClient = new PoliteHttpClient(properties, executor, new Random(1));
        listClient = new SteamAppListClient(httpClient, properties, new CrawlConfig().objectMapper());
        pacing = new FetchPacingContext(0, 0, Duration.ZERO, Clock.systemUTC(), millis -> { });
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void returnsDistinctPositiveIdsInListingOrder() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(
            "{\"applist\":{\"apps\":["
                + "{\"appid\":730,\"name\":\"A\"},"
                + "{\"appid\":10,\"name\":\"B\"},"
                + "{\"appid\":730,\"name\":\"A again\"},"
                + "{\"appid\":0,\"name\":\"\"}"
                + "]}}"
        ));

        List<Long> ids = listClient.listAllIdentifiers(pacing);

        assertThat(ids).containsExactly(730L, 10L);
    }

    @Test
    void serverErrorMakesListingUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> listClient.listAllIdentifiers(pacing))
            .isInstanceOf(ListingUnavailableException.class)
            .hasMessageContaining("HTTP_5XX");
    }

    @Test
    void emptyListingIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"applist\":{\"apps\":[]}}"));

        assertThatThrownBy(() -> listClient.listAllIdentifiers(pacing))
            .isInstanceOf(ListingUnavailableException.class);
    }

    @Test
    void unexpectedShapeIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"response\":{}}"));

        assertThatThrownBy(() -> listClient.listAllIdentifiers(pacing))
            .isInstanceOf(ListingUnavailableException.class)
            .hasMessageContaining("applist.apps");
    }
}
