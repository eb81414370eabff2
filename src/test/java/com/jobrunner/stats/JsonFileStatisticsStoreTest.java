package com.jobrunner.stats;

import com.jobrunner.analysis.JobStatistics;
import com.jobrunner.exception.JobRunnerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JsonFileStatisticsStore.
 */
class JsonFileStatisticsStoreTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should persist entries across instances")
    void shouldPersistAcrossInstances() {
        Path file = dir.resolve("stats/job-stats.json");
        JobStatistics stats = JobStatistics.empty().record(1.5, true).record(2.5, false);

        new JsonFileStatisticsStore(file).put("jobrunner_job_stats:Reports", stats, Duration.ofHours(1));
        assertTrue(Files.exists(file));

        JsonFileStatisticsStore reopened = new JsonFileStatisticsStore(file);
        JobStatistics loaded = reopened.get("jobrunner_job_stats:Reports").orElseThrow();

        assertEquals(2, loaded.executions());
        assertEquals(4.0, loaded.totalDurationSeconds(), 0.0001);
        assertEquals(1, loaded.failures());
        assertEquals(0.5, loaded.failureRate(), 0.0001);
    }

    @Test
    @DisplayName("Should skip expired entries when loading")
    void shouldSkipExpiredOnLoad() throws InterruptedException {
        Path file = dir.resolve("stats.json");
        JsonFileStatisticsStore store = new JsonFileStatisticsStore(file);
        store.put("stale", JobStatistics.empty(), Duration.ofMillis(30));
        store.put("fresh", JobStatistics.empty(), Duration.ofHours(1));

        Thread.sleep(80);

        JsonFileStatisticsStore reopened = new JsonFileStatisticsStore(file);
        assertTrue(reopened.get("stale").isEmpty());
        assertTrue(reopened.get("fresh").isPresent());
    }

    @Test
    @DisplayName("Should persist removals")
    void shouldPersistForget() {
        Path file = dir.resolve("stats.json");
        JsonFileStatisticsStore store = new JsonFileStatisticsStore(file);
        store.put("gone", JobStatistics.empty(), Duration.ofHours(1));
        store.forget("gone");

        assertTrue(new JsonFileStatisticsStore(file).get("gone").isEmpty());
    }

    @Test
    @DisplayName("Reading an expired entry should not rewrite the file")
    void expiredReadDoesNotWrite() throws Exception {
        Path file = dir.resolve("stats.json");
        JsonFileStatisticsStore store = new JsonFileStatisticsStore(file);
        store.put("stale", JobStatistics.empty(), Duration.ofMillis(30));
        Thread.sleep(80);

        // the target can no longer be replaced, so any write would fail
        Files.delete(file);
        Files.createDirectories(file.resolve("blocker"));

        assertTrue(store.get("stale").isEmpty());
        assertTrue(Files.isDirectory(file));
    }

    @Test
    @DisplayName("A failed write should not leave a temporary file behind")
    void failedWriteRemovesTempFile() throws Exception {
        Path file = dir.resolve("stats.json");
        JsonFileStatisticsStore store = new JsonFileStatisticsStore(file);
        Files.createDirectories(file.resolve("blocker"));

        assertThrows(JobRunnerException.class,
                () -> store.put("jobrunner_job_stats:Reports", JobStatistics.empty(), Duration.ofHours(1)));

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(file), files.collect(Collectors.toList()));
        }
    }

    @Test
    @DisplayName("Should fail on a corrupt file")
    void shouldFailOnCorruptFile() throws Exception {
        Path file = dir.resolve("corrupt.json");
        Files.writeString(file, "{ not json");

        assertThrows(JobRunnerException.class, () -> new JsonFileStatisticsStore(file));
    }
}
