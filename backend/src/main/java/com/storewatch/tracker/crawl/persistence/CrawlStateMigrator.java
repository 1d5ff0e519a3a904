package com.storewatch.tracker.crawl.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storewatch.tracker.crawl.model.CrawlState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Brings a raw state document up to {@link CrawlState#CURRENT_SCHEMA_VERSION} before it is
 * bound. Version 1 documents stored the seen-set either as a flat {@code seen} mapping of
 * id to boolean, as a {@code seen_ids} array, or as {@code seenEntries} with boolean values.
 */
@Component
public class CrawlStateMigrator {
    private static final Logger log = LoggerFactory.getLogger(CrawlStateMigrator.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    public ObjectNode migrate(ObjectNode root) {
        int version = root.path("schemaVersion").asInt(1);
        if (version > CrawlState.CURRENT_SCHEMA_VERSION) {
            throw new StateCorruptException("State schema version " + version + " is newer than supported "
                + CrawlState.CURRENT_SCHEMA_VERSION);
        }
        if (version < 2) {
            migrateSeenSet(root);
            log.info("Migrated crawl state from schema version {} to {}", version, CrawlState.CURRENT_SCHEMA_VERSION);
        }
        root.put("schemaVersion", CrawlState.CURRENT_SCHEMA_VERSION);
        return root;
    }

    private void migrateSeenSet(ObjectNode root) {
        ObjectNode entries = NODES.objectNode();
        JsonNode existing = root.get("seenEntries");
        if (existing != null && existing.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = existing.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isObject()) {
                    entries.set(field.getKey(), value);
                } else if (isIdentifier(field.getKey())) {
                    entries.set(field.getKey(), seenEntry(value.asBoolean(true)));
                }
            }
        }

        JsonNode legacySeen = root.remove("seen");
        if (legacySeen != null && legacySeen.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = legacySeen.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (isIdentifier(field.getKey()) && !entries.has(field.getKey())) {
                    entries.set(field.getKey(), seenEntry(field.getValue().asBoolean(true)));
                }
            }
        }

        JsonNode legacyIds = root.remove("seen_ids");
        if (legacyIds != null && legacyIds.isArray()) {
            for (JsonNode id : legacyIds) {
                String key = id.asText();
                if (isIdentifier(key) && !entries.has(key)) {
                    entries.set(key, seenEntry(true));
                }
            }
        }
        root.set("seenEntries", entries);

        List<String> dropped = new ArrayList<>();
        for (String legacyField : List.of("stats", "recent_emitted", "last_run")) {
            if (root.remove(legacyField) != null) {
                dropped.add(legacyField);
            }
        }
        if (!dropped.isEmpty()) {
            log.debug("Dropped legacy state fields {}", dropped);
        }
    }

    private static ObjectNode seenEntry(boolean detected) {
        ObjectNode node = NODES.objectNode();
        node.put("everDetected", detected);
        node.putNull("detectedAt");
        return node;
    }

    private static boolean isIdentifier(String key) {
        if (key == null || key.isBlank()) {
            return false;
        }
        try {
            return Long.parseLong(key.trim()) > 0;
        } catch (NumberFormatException e) {
            log.warn("Skipping non-numeric identifier {} in legacy state", key);
            return false;
        }
    }
}
