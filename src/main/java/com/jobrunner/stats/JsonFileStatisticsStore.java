package com.jobrunner.stats;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobrunner.analysis.JobStatistics;
import com.jobrunner.exception.JobRunnerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Store backed by a JSON file so learned statistics survive restarts.
 *
 * <p>The whole map is held in memory and rewritten on every change through a
 * temporary file that is moved over the target. Writes are serialized on this
 * instance; separate processes sharing one file are not coordinated.
 */
public class JsonFileStatisticsStore implements StatisticsStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStatisticsStore.class);
    private static final TypeReference<Map<String, StoredEntry>> ENTRIES_TYPE = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;
    private final Map<String, StoredEntry> entries;

    public JsonFileStatisticsStore(Path file) {
        this.file = file;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.entries = load();
        log.info("Statistics store opened at {} ({} entries)", file, entries.size());
    }

    @Override
    public synchronized Optional<JobStatistics> get(String key) {
        StoredEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAtMs() <= System.currentTimeMillis()) {
            // dropped from memory only; the next write or load leaves it out of the file
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.stats());
    }

    @Override
    public synchronized void put(String key, JobStatistics value, Duration ttl) {
        if (key == null || value == null) {
            throw new NullPointerException("Key and value cannot be null");
        }
        entries.put(key, new StoredEntry(value, System.currentTimeMillis() + ttl.toMillis()));
        flush();
    }

    @Override
    public synchronized void forget(String key) {
        if (entries.remove(key) != null) {
            flush();
        }
    }

    public Path getFile() {
        return file;
    }

    private Map<String, StoredEntry> load() {
        if (!Files.exists(file)) {
            return new HashMap<>();
        }
        try {
            Map<String, StoredEntry> loaded = mapper.readValue(file.toFile(), ENTRIES_TYPE);
            long now = System.currentTimeMillis();
            Map<String, StoredEntry> live = new HashMap<>();
            loaded.forEach((key, entry) -> {
                if (entry != null && entry.stats() != null && entry.expiresAtMs() > now) {
                    live.put(key, entry);
                }
            });
            return live;
        } catch (IOException e) {
            throw new JobRunnerException("Failed to read statistics file: " + file, e);
        }
    }

    private void flush() {
        Path tmp = null;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            tmp = Files.createTempFile(parent, "stats", ".json.tmp");
            mapper.writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            tmp = null;
        } catch (IOException e) {
            throw new JobRunnerException("Failed to write statistics file: " + file, e);
        } finally {
            if (tmp != null) {
                deleteQuietly(tmp);
            }
        }
    }

    private void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary statistics file {}: {}", tmp, e.getMessage());
        }
    }

    /**
     * On-disk form of one entry.
     */
    public record StoredEntry(JobStatistics stats, long expiresAtMs) {}
}
