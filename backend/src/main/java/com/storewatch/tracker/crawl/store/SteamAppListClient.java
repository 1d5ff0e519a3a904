package com.storewatch.tracker.crawl.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.http.FetchPacingContext;
import com.storewatch.tracker.crawl.http.PoliteHttpClient;
import com.storewatch.tracker.crawl.model.HttpFetchResult;
import com.storewatch.tracker.crawl.util.ReasonCodeClassifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class SteamAppListClient implements StoreListingClient {
    private final PoliteHttpClient httpClient;
    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public SteamAppListClient(PoliteHttpClient httpClient, CrawlerProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<Long> listAllIdentifiers(FetchPacingContext pacing) {
        HttpFetchResult result = httpClient.get(properties.getStore().getListingUrl(), "application/json", pacing);
        if (!result.isSuccessful()) {
            throw new ListingUnavailableException(
                "listing fetch failed: " + ReasonCodeClassifier.fromResult(result)
                    + " status=" + result.statusCode()
            );
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(result.body() == null ? "" : result.body());
        } catch (JsonProcessingException e) {
            throw new ListingUnavailableException("listing payload is not valid JSON", e);
        }
        JsonNode apps = root == null ? null : root.path("applist").path("apps");
        if (apps == null || !apps.isArray()) {
            throw new ListingUnavailableException("listing payload has no applist.apps array");
        }
        Set<Long> ids = new LinkedHashSet<>();
        for (JsonNode app : apps) {
            long appId = app.path("appid").asLong(0L);
            if (appId > 0) {
                ids.add(appId);
            }
        }
        if (ids.isEmpty()) {
            throw new ListingUnavailableException("listing returned no identifiers");
        }
        return new ArrayList<>(ids);
    }
}
