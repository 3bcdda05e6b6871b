package com.llmsentinel.core.baseline;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads and writes {@link BaselineSnapshot}s as JSON files.
 *
 * <pre>
 * {
 *   "createdAt" : "2024-05-01T12:00:00Z",
 *   "windowCapacity" : 100,
 *   "minPoints" : 10,
 *   "ewmaAlpha" : 0.1,
 *   "metrics" : {
 *     "llm.latency.ms" : { "count" : 1500, "ewmaBaseline" : 251.3, "values" : [ ... ] }
 *   }
 * }
 * </pre>
 */
public class BaselineSnapshotStore {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineSnapshotStore.class);

    private final ObjectMapper mapper;

    public BaselineSnapshotStore() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Write {@code snapshot} to {@code path}, creating parent directories and
     * replacing any existing file.
     *
     * @throws IllegalStateException if the file cannot be written
     */
    public void save(BaselineSnapshot snapshot, Path path) {
        Objects.requireNonNull(snapshot, "BaselineSnapshot must not be null");
        Objects.requireNonNull(path, "Path must not be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(path.toFile(), snapshot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write baseline snapshot to " + path, e);
        }
        LOG.info("Saved baseline for {} metric(s) to {}", snapshot.getMetrics().size(), path);
    }

    /**
     * @return the snapshot stored at {@code path}, or empty if there is no such file
     * @throws IllegalStateException if the file exists but cannot be read or parsed
     */
    public Optional<BaselineSnapshot> load(Path path) {
        Objects.requireNonNull(path, "Path must not be null");
        if (!Files.exists(path)) {
            LOG.info("No baseline snapshot at {}", path);
            return Optional.empty();
        }
        try {
            BaselineSnapshot snapshot = mapper.readValue(path.toFile(), BaselineSnapshot.class);
            LOG.info("Loaded baseline for {} metric(s) from {}", snapshot.getMetrics().size(), path);
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read baseline snapshot from " + path, e);
        }
    }
}
