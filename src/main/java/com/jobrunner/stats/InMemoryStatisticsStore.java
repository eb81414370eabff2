package com.jobrunner.stats;

import com.jobrunner.analysis.JobStatistics;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Expired entries are dropped when read.
 */
public class InMemoryStatisticsStore implements StatisticsStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<JobStatistics> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAtMs() <= System.currentTimeMillis()) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void put(String key, JobStatistics value, Duration ttl) {
        if (key == null || value == null) {
            throw new NullPointerException("Key and value cannot be null");
        }
        entries.put(key, new Entry(value, System.currentTimeMillis() + ttl.toMillis()));
    }

    @Override
    public void forget(String key) {
        entries.remove(key);
    }

    /**
     * Number of entries held, expired ones included until they are next read.
     */
    public int size() {
        return entries.size();
    }

    private record Entry(JobStatistics value, long expiresAtMs) {}
}
