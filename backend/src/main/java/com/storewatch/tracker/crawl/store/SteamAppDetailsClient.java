package com.storewatch.tracker.crawl.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.http.FetchPacingContext;
import com.storewatch.tracker.crawl.http.PoliteHttpClient;
import com.storewatch.tracker.crawl.model.DetailsResponse;
import com.storewatch.tracker.crawl.model.HttpFetchResult;
import com.storewatch.tracker.crawl.model.ItemRecord;
import com.storewatch.tracker.crawl.model.StoreLocale;
import com.storewatch.tracker.crawl.util.ReasonCodeClassifier;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

@Service
public class SteamAppDetailsClient implements StoreDetailsClient {
    private final PoliteHttpClient httpClient;
    private final CrawlerProperties properties;
    private final ObjectMapper objectMapper;

    public SteamAppDetailsClient(PoliteHttpClient httpClient, CrawlerProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public DetailsResponse fetchDetails(long appId, StoreLocale locale, FetchPacingContext pacing) {
        HttpFetchResult result = httpClient.getOnce(detailsUrl(appId, locale), "application/json", pacing);
        String reason = ReasonCodeClassifier.fromResult(result);
        if (ReasonCodeClassifier.isTerminal(reason)) {
            return DetailsResponse.notFound(reason);
        }
        if (result.errorCode() != null) {
            return DetailsResponse.transientFailure(reason);
        }
        if (ReasonCodeClassifier.isRateLimit(reason)) {
            return DetailsResponse.rateLimited(reason);
        }
        if (ReasonCodeClassifier.isTransient(reason)) {
            return DetailsResponse.transientFailure(reason);
        }
        if (!result.isSuccessful()) {
            return DetailsResponse.notFound(reason);
        }
        return parse(appId, result.body());
    }

    DetailsResponse parse(long appId, String body) {
        if (body == null || body.isBlank()) {
            return DetailsResponse.transientFailure(ReasonCodeClassifier.PARSING_FAILED);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return DetailsResponse.transientFailure(ReasonCodeClassifier.PARSING_FAILED);
        }
        // a literal null body is the store's way of throttling without a 429
        if (root == null || root.isNull()) {
            return DetailsResponse.rateLimited(ReasonCodeClassifier.HTTP_429_RATE_LIMIT);
        }
        JsonNode node = root.path(String.valueOf(appId));
        if (!node.path("success").asBoolean(false)) {
            return DetailsResponse.notFound(ReasonCodeClassifier.NOT_LISTED);
        }
        JsonNode data = node.path("data");
        if (!data.isObject() || data.isEmpty()) {
            return DetailsResponse.notFound(ReasonCodeClassifier.EMPTY_RECORD);
        }
        String name = text(data, "name");
        if (name == null || name.isBlank()) {
            return DetailsResponse.notFound(ReasonCodeClassifier.EMPTY_RECORD);
        }
        return DetailsResponse.found(toRecord(appId, data));
    }

    private ItemRecord toRecord(long appId, JsonNode data) {
        JsonNode price = data.path("price_overview");
        Integer finalPrice = price.hasNonNull("final") ? price.get("final").asInt() : null;
        String currency = text(price, "currency");
        JsonNode release = data.path("release_date");

        List<String> screenshots = new ArrayList<>();
        for (JsonNode screenshot : data.path("screenshots")) {
            String path = text(screenshot, "path_full");
            if (path != null) {
                screenshots.add(path);
            }
        }
        List<String> genres = new ArrayList<>();
        for (JsonNode genre : data.path("genres")) {
            String description = text(genre, "description");
            if (description != null) {
                genres.add(description);
            }
        }
        List<String> platforms = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.path("platforms").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().asBoolean(false)) {
                platforms.add(entry.getKey());
            }
        }

        return new ItemRecord(
            appId,
            text(data, "name"),
            text(data, "type"),
            data.path("is_free").asBoolean(false),
            finalPrice,
            currency,
            text(data, "supported_languages"),
            text(data, "short_description"),
            text(data, "detailed_description"),
            text(data, "header_image"),
            screenshots,
            text(release, "date"),
            release.path("coming_soon").asBoolean(false),
            genres,
            platforms
        );
    }

    private String detailsUrl(long appId, StoreLocale locale) {
        return properties.getStore().getDetailsUrl()
            + "?appids=" + appId
            + "&l=" + URLEncoder.encode(locale.language(), StandardCharsets.UTF_8)
            + "&cc=" + URLEncoder.encode(locale.countryCode(), StandardCharsets.UTF_8);
    }

    private static String text(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        String value = node.get(field).asText();
        return value == null || value.isBlank() ? null : value;
    }
}
