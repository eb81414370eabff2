package com.jobrunner.runtime;

import com.jobrunner.analysis.JobAnalyzer;
import com.jobrunner.analysis.SourceLocator;
import com.jobrunner.config.AnalyzerConfig;
import com.jobrunner.config.HealthConfig;
import com.jobrunner.config.RunnerConfig;
import com.jobrunner.config.SecurityLimits;
import com.jobrunner.config.ShutdownConfig;
import com.jobrunner.core.ExecutionTier;
import com.jobrunner.core.IsolationHint;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.exception.ConcurrencyLimitExceededException;
import com.jobrunner.exception.JobExecutionException;
import com.jobrunner.exception.JobRejectedException;
import com.jobrunner.exception.JobTimeoutException;
import com.jobrunner.exception.JobValidationException;
import com.jobrunner.exception.RateLimitExceededException;
import com.jobrunner.fixtures.CountingJob;
import com.jobrunner.fixtures.FailingJob;
import com.jobrunner.fixtures.ManualStrategy;
import com.jobrunner.fixtures.SendEmailJob;
import com.jobrunner.stats.InMemoryStatisticsStore;
import com.jobrunner.strategy.FirstMatchStrategySelector;
import com.jobrunner.strategy.InlineStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JobRuntime.
 */
class JobRuntimeTest {

    private ManualStrategy manual;
    private StubProbe probe;
    private ShutdownSignal signal;
    private JobRuntime runtime;

    @BeforeEach
    void setUp() {
        manual = new ManualStrategy();
        probe = new StubProbe();
        signal = new ShutdownSignal();
        runtime = runtime(RunnerConfig.defaults());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runtime.shutdownNow();
        runtime.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Inline job should settle before executeJob returns")
    void inlineJobSettlesSynchronously() {
        List<String> executed = new CopyOnWriteArrayList<>();
        CountingJob job = CountingJob.into(executed);

        CompletableFuture<Void> result = runtime.executeJob(job);

        assertTrue(result.isDone());
        assertFalse(result.isCompletedExceptionally());
        assertEquals(List.of(job.getId()), executed);

        RuntimeStats stats = runtime.getStats();
        assertEquals(1, stats.processedJobs());
        assertEquals(0, stats.runningJobs());
        assertEquals(1L, stats.selections().get(ExecutionTier.INLINE));
        assertEquals(1, runtime.getAnalyzer().getStats(job.getType()).orElseThrow().executions());
    }

    @Test
    @DisplayName("Invalid job should be rejected synchronously and never dispatched")
    void invalidJobRejected() {
        SendEmailJob job = new SendEmailJob();
        job.setTimeoutSeconds(10_000);

        assertThrows(JobValidationException.class, () -> runtime.executeJob(job));

        assertTrue(manual.getStarted().isEmpty());
        assertEquals(1, runtime.getStats().rejectedJobs());
        assertTrue(runtime.getRunningJobs().isEmpty());
    }

    @Test
    @DisplayName("Job over the concurrency ceiling should be rejected until a slot frees")
    void concurrencyCeilingRejectsNextJob() throws Exception {
        restart(RunnerConfig.defaults().withHealth(health(2, 5_000, 30_000, 512)));

        SendEmailJob first = new SendEmailJob();
        CompletableFuture<Void> firstResult = runtime.executeJob(first);
        runtime.executeJob(new SendEmailJob());

        ConcurrencyLimitExceededException e = assertThrows(ConcurrencyLimitExceededException.class,
                () -> runtime.executeJob(new SendEmailJob()));
        assertEquals(2, e.getCeiling());

        manual.complete(first.getId());
        firstResult.get(5, TimeUnit.SECONDS);

        assertDoesNotThrow(() -> runtime.executeJob(new SendEmailJob()));
        assertEquals(2, runtime.getRunningJobs().size());
    }

    @Test
    @DisplayName("Concurrency ceiling should never exceed the configured maximum")
    void ceilingCappedByLimits() {
        SecurityLimits d = SecurityLimits.defaults();
        restart(RunnerConfig.defaults().withLimits(new SecurityLimits(d.maxTimeoutSeconds(),
                d.maxMemoryMb(), 1, d.maxJobsPerMinute(), List.of(), true, false)));

        runtime.executeJob(new SendEmailJob());

        assertThrows(ConcurrencyLimitExceededException.class, () -> runtime.executeJob(new SendEmailJob()));
    }

    @Test
    @DisplayName("Should enforce jobs per minute")
    void shouldEnforceRateLimit() {
        SecurityLimits d = SecurityLimits.defaults();
        restart(RunnerConfig.defaults().withLimits(new SecurityLimits(d.maxTimeoutSeconds(),
                d.maxMemoryMb(), d.maxConcurrentJobs(), 3, List.of(), true, false)));

        for (int i = 0; i < 3; i++) {
            runtime.executeJob(new CountingJob());
        }

        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
                () -> runtime.executeJob(new CountingJob()));
        assertEquals(3, e.getMaxJobsPerMinute());
        assertEquals(3, runtime.getStats().processedJobs());
        assertEquals(1, runtime.getStats().rejectedJobs());
    }

    @Test
    @DisplayName("Should reject a job whose id is already running")
    void shouldRejectDuplicateId() {
        SendEmailJob job = new SendEmailJob();
        runtime.executeJob(job);

        JobRejectedException e = assertThrows(JobRejectedException.class, () -> runtime.executeJob(job));
        assertTrue(e.getMessage().contains("already running"));
        assertEquals(1, manual.getStarted().size());
    }

    @Test
    @DisplayName("Execution failures should arrive through the future")
    void failureThroughFuture() {
        FailingJob job = new FailingJob("cannot reach /srv/data/input.csv");
        job.setIsolation(IsolationHint.INLINE);
        List<String> reasons = new CopyOnWriteArrayList<>();
        runtime.addListener(new RuntimeListener() {
            @Override
            public void onFailed(JobDescriptor failed, String reason) {
                reasons.add(reason);
            }
        });

        CompletableFuture<Void> result = runtime.executeJob(job);

        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertInstanceOf(JobExecutionException.class, e.getCause());
        assertEquals(List.of("cannot reach [PATH_REDACTED]"), reasons);
        assertEquals(1, runtime.getStats().failedJobs());
        assertEquals(1.0, runtime.getAnalyzer().getStats(job.getType()).orElseThrow().failureRate());
    }

    @Test
    @DisplayName("Timeouts should be reported to listeners as timeouts")
    void timeoutNotifiesListener() throws Exception {
        AtomicInteger timedOut = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();
        runtime.addListener(new RuntimeListener() {
            @Override
            public void onTimedOut(JobDescriptor job) {
                timedOut.incrementAndGet();
            }

            @Override
            public void onFailed(JobDescriptor job, String reason) {
                failed.incrementAndGet();
            }
        });
        SendEmailJob job = new SendEmailJob();
        CompletableFuture<Void> result = runtime.executeJob(job);

        manual.fail(job.getId(), new JobTimeoutException(job.getId(), 30));

        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(JobTimeoutException.class, e.getCause());
        assertEquals(1, timedOut.get());
        assertEquals(0, failed.get());
    }

    @Test
    @DisplayName("Inline jobs queued ahead of a due timer should all run first")
    void inlineJobsRunBeforeDueTimer() throws Exception {
        List<String> executed = new CopyOnWriteArrayList<>();
        CompletableFuture<Integer> seenByTimer = new CompletableFuture<>();

        runtime.getLoop().call(() -> {
            runtime.getLoop().schedule(() -> seenByTimer.complete(executed.size()), 0);
            for (int i = 0; i < 20; i++) {
                runtime.executeJob(CountingJob.into(executed));
            }
            return null;
        });

        assertEquals(20, seenByTimer.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should list running jobs with their strategy and tier")
    void shouldListRunningJobs() {
        SendEmailJob job = new SendEmailJob();
        runtime.executeJob(job);

        List<ExecutionRecord> running = runtime.getRunningJobs();

        assertEquals(1, running.size());
        assertSame(job, running.get(0).job());
        assertEquals("manual", running.get(0).strategy());
        assertEquals(ExecutionTier.POOLED, running.get(0).tier());
        assertEquals(1, runtime.getStats().runningJobs());
    }

    @Test
    @DisplayName("Graceful shutdown should wait for running jobs and then reject new ones")
    void gracefulShutdownDrains() throws Exception {
        SendEmailJob job = new SendEmailJob();
        CompletableFuture<Void> result = runtime.executeJob(job);
        List<Integer> initiated = new CopyOnWriteArrayList<>();
        runtime.addListener(new RuntimeListener() {
            @Override
            public void onShutdownInitiated(int runningJobs) {
                initiated.add(runningJobs);
            }
        });

        CompletableFuture<Void> terminated = runtime.shutdown();
        Thread.sleep(100);

        assertTrue(runtime.isShuttingDown());
        assertFalse(terminated.isDone());
        assertEquals(List.of(1), initiated);
        assertThrows(JobRejectedException.class, () -> runtime.executeJob(new SendEmailJob()));

        manual.complete(job.getId());
        result.get(5, TimeUnit.SECONDS);
        terminated.get(5, TimeUnit.SECONDS);

        assertTrue(runtime.isTerminated());
        assertTrue(manual.isClosed());
        assertEquals(1, runtime.getStats().processedJobs());
        assertTrue(runtime.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("awaitTermination should not wait longer than the given timeout")
    void awaitTerminationHonoursSingleTimeout() throws Exception {
        EventLoop loop = runtime.getLoop();
        loop.execute(pause(400));
        runtime.shutdownNow();
        // still queued when the loop is shut down, so it runs after the runtime has stopped
        loop.execute(pause(1_500));

        long start = System.nanoTime();
        boolean stopped = runtime.awaitTermination(500, TimeUnit.MILLISECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertFalse(stopped);
        assertTrue(runtime.isTerminated());
        assertTrue(elapsedMs < 800, "waited " + elapsedMs + "ms");
    }

    @Test
    @DisplayName("Shutdown should force a stop once the drain timeout passes")
    void shutdownForcedAfterDrainTimeout() throws Exception {
        restart(RunnerConfig.defaults().withShutdown(new ShutdownConfig(200, 50)));
        runtime.executeJob(new SendEmailJob());

        long start = System.currentTimeMillis();
        runtime.shutdown().get(5, TimeUnit.SECONDS);

        assertTrue(System.currentTimeMillis() - start >= 150);
        assertTrue(manual.isClosed());
        assertTrue(runtime.getRunningJobs().isEmpty());
    }

    @Test
    @DisplayName("Shutdown with nothing running should stop at once")
    void shutdownWhenIdle() throws Exception {
        runtime.shutdown().get(5, TimeUnit.SECONDS);

        assertTrue(runtime.isTerminated());
        assertTrue(runtime.getLoop().isShutdown());
    }

    @Test
    @DisplayName("Memory watchdog should initiate graceful shutdown above the limit")
    void memoryWatchdogTriggersWithoutRequest() throws Exception {
        restart(RunnerConfig.defaults().withHealth(health(10, 50, 60_000, 512)));
        probe.heapBytes = 600L * 1024 * 1024;

        runtime.start();

        assertTrue(runtime.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(runtime.isShuttingDown());
        assertThrows(JobRejectedException.class, () -> runtime.executeJob(new CountingJob()));
    }

    @Test
    @DisplayName("Health sampling should shrink the ceiling under load and keep ten samples")
    void healthSamplingShrinksCeiling() throws InterruptedException {
        restart(RunnerConfig.defaults().withHealth(health(10, 60_000, 20, 512)));
        List<int[]> changes = new CopyOnWriteArrayList<>();
        runtime.addListener(new RuntimeListener() {
            @Override
            public void onConcurrencyChanged(int oldCeiling, int newCeiling) {
                changes.add(new int[] {oldCeiling, newCeiling});
            }
        });
        probe.cpu = 0.95;

        runtime.start();
        Thread.sleep(600);

        assertEquals(1, runtime.getConcurrencyCeiling());
        assertEquals(10, changes.get(0)[0]);
        assertEquals(7, changes.get(0)[1]);
        assertEquals(JobRuntime.HEALTH_HISTORY_SIZE, runtime.getHealthHistory().size());
        assertEquals(0.95, runtime.getStats().lastHealth().cpuLoad());
    }

    @Test
    @DisplayName("Triggering the shutdown signal should shut the runtime down")
    void signalTriggersShutdown() throws InterruptedException {
        signal.trigger("test");

        assertTrue(runtime.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(runtime.isShuttingDown());
    }

    @Test
    @DisplayName("Listeners should see dispatch and completion")
    void listenersSeeLifecycle() {
        List<String> events = new CopyOnWriteArrayList<>();
        runtime.addListener(new RuntimeListener() {
            @Override
            public void onDispatched(JobDescriptor job, String strategy, ExecutionTier tier) {
                events.add("dispatched:" + strategy + ":" + tier.key());
            }

            @Override
            public void onCompleted(JobDescriptor job, Duration duration) {
                events.add("completed");
            }
        });
        RuntimeListener failing = new RuntimeListener() {
            @Override
            public void onDispatched(JobDescriptor job, String strategy, ExecutionTier tier) {
                throw new IllegalStateException("listener bug");
            }
        };
        runtime.addListener(failing);

        runtime.executeJob(new CountingJob());
        runtime.removeListener(failing);

        assertEquals(List.of("dispatched:inline:inline", "completed"), events);
    }

    private void restart(RunnerConfig config) {
        runtime.shutdownNow();
        manual = new ManualStrategy();
        runtime = runtime(config);
    }

    private JobRuntime runtime(RunnerConfig config) {
        JobAnalyzer analyzer = new JobAnalyzer(AnalyzerConfig.defaults(), new InMemoryStatisticsStore(),
                SourceLocator.none());
        FirstMatchStrategySelector selector = new FirstMatchStrategySelector()
                .addStrategy(new InlineStrategy(512), ExecutionTier.INLINE)
                .addStrategy(manual, ExecutionTier.POOLED);
        return new JobRuntime(config, selector, analyzer, new EventLoop("runtime-test"), probe, signal);
    }

    private static Runnable pause(long millis) {
        return () -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    private static HealthConfig health(int initial, long memoryCheckMs, long healthCheckMs, int memoryLimitMb) {
        HealthConfig d = HealthConfig.defaults();
        return new HealthConfig(memoryLimitMb, memoryCheckMs, healthCheckMs, d.maxCpuLoad(),
                d.maxMemoryPercent(), initial, 1, 20, d.shrinkFactor(), d.growStep(), true);
    }

    private static class StubProbe implements HealthProbe {
        volatile double cpu = 0.1;
        volatile long heapBytes = 64L * 1024 * 1024;

        @Override
        public double cpuLoad() {
            return cpu;
        }

        @Override
        public long heapUsedBytes() {
            return heapBytes;
        }
    }
}
