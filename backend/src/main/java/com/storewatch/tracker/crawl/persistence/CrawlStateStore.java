package com.storewatch.tracker.crawl.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storewatch.tracker.config.CrawlerProperties;
import com.storewatch.tracker.crawl.model.CrawlState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Single-file JSON store for {@link CrawlState}. Writes go to a temporary file in the same
 * directory which is then renamed over the canonical path, so a crash mid-write leaves the
 * last committed state in place. Paths ending in {@code .gz} are gzip-compressed.
 */
@Service
public class CrawlStateStore {
    private static final Logger log = LoggerFactory.getLogger(CrawlStateStore.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final CrawlStateMigrator migrator;

    public CrawlStateStore(CrawlerProperties properties, ObjectMapper objectMapper, CrawlStateMigrator migrator) {
        this.path = Paths.get(properties.getState().getPath());
        this.objectMapper = objectMapper;
        this.migrator = migrator;
    }

    public Path path() {
        return path;
    }

    public CrawlState load() {
        if (!Files.exists(path)) {
            log.info("No crawl state at {}, starting from an empty state", path);
            return CrawlState.empty();
        }
        JsonNode root;
        try (InputStream in = openForRead(path)) {
            root = objectMapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new StateCorruptException("Crawl state at " + path + " is not valid JSON", e);
        } catch (IOException e) {
            throw new StateCorruptException("Crawl state at " + path + " could not be read", e);
        }
        if (root == null || !root.isObject()) {
            throw new StateCorruptException("Crawl state at " + path + " is not a JSON object");
        }
        ObjectNode migrated = migrator.migrate((ObjectNode) root);
        try {
            return objectMapper.treeToValue(migrated, CrawlState.class);
        } catch (JsonProcessingException e) {
            throw new StateCorruptException("Crawl state at " + path + " does not match the expected shape", e);
        }
    }

    public void save(CrawlState state) {
        state.setSchemaVersion(CrawlState.CURRENT_SCHEMA_VERSION);
        Path tmp = null;
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            tmp = Files.createTempFile(parent, path.getFileName().toString() + ".", ".tmp");
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
                 OutputStream out = openForWrite(channel)) {
                objectMapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, state);
                if (out instanceof GZIPOutputStream gzip) {
                    gzip.finish();
                }
                out.flush();
                sync(channel);
            }
            commit(tmp, path);
            log.debug("Saved crawl state to {}", path);
        } catch (IOException e) {
            deleteTemp(tmp);
            throw new UncheckedIOException("Failed to save crawl state to " + path, e);
        } catch (RuntimeException e) {
            deleteTemp(tmp);
            throw e;
        }
    }

    /**
     * Forces the written bytes to the device before the file is renamed into place.
     */
    protected void sync(FileChannel channel) throws IOException {
        channel.force(true);
    }

    /**
     * Replaces {@code target} with the fully written {@code tmp} file.
     */
    protected void commit(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private InputStream openForRead(Path source) throws IOException {
        InputStream in = Files.newInputStream(source);
        return isGzip() ? new GZIPInputStream(in) : in;
    }

    private OutputStream openForWrite(FileChannel channel) throws IOException {
        OutputStream out = new BufferedOutputStream(Channels.newOutputStream(channel));
        return isGzip() ? new GZIPOutputStream(out) : out;
    }

    private boolean isGzip() {
        return path.getFileName().toString().endsWith(".gz");
    }

    private void deleteTemp(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary state file {}", tmp, e);
        }
    }
}
