package com.jobrunner.worker;

import com.jobrunner.analysis.JobAnalyzer;
import com.jobrunner.analysis.SourceLocator;
import com.jobrunner.config.AnalyzerConfig;
import com.jobrunner.config.RunnerConfig;
import com.jobrunner.config.SecurityLimits;
import com.jobrunner.config.WorkerConfig;
import com.jobrunner.core.ExecutionTier;
import com.jobrunner.core.IsolationHint;
import com.jobrunner.fixtures.CountingJob;
import com.jobrunner.fixtures.FailingJob;
import com.jobrunner.runtime.EventLoop;
import com.jobrunner.runtime.HealthProbe;
import com.jobrunner.runtime.JobRuntime;
import com.jobrunner.runtime.ShutdownSignal;
import com.jobrunner.stats.InMemoryStatisticsStore;
import com.jobrunner.strategy.FirstMatchStrategySelector;
import com.jobrunner.strategy.InlineStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for QueueWorker.
 */
class QueueWorkerTest {

    private JobRuntime runtime;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (runtime != null) {
            runtime.shutdownNow();
            runtime.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    @Test
    @DisplayName("Should process queued jobs and stop after max jobs")
    void shouldStopAfterMaxJobs() throws Exception {
        runtime = runtime(SecurityLimits.defaults());
        List<String> executed = new CopyOnWriteArrayList<>();
        QueueJobSource source = new QueueJobSource();
        for (int i = 0; i < 5; i++) {
            source.add(CountingJob.into(executed));
        }
        QueueWorker worker = new QueueWorker(runtime, source, new WorkerConfig(20, 50, 3, 0));

        worker.start();

        assertTrue(runtime.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(worker.isStopped());
        assertEquals(3, executed.size());
        assertEquals(3, source.getCompleted().size());
        assertEquals(2, source.size());
        assertEquals(3, worker.getStats().jobsProcessed());
    }

    @Test
    @DisplayName("Should hand rate-limited jobs back to the source")
    void shouldHandBackRejectedJobs() throws Exception {
        SecurityLimits d = SecurityLimits.defaults();
        runtime = runtime(new SecurityLimits(d.maxTimeoutSeconds(), d.maxMemoryMb(),
                d.maxConcurrentJobs(), 2, List.of(), true, false));
        QueueJobSource source = new QueueJobSource()
                .add(new CountingJob())
                .add(new CountingJob())
                .add(new CountingJob());
        QueueWorker worker = new QueueWorker(runtime, source, new WorkerConfig(20, 50, 0, 0));

        worker.start();
        Thread.sleep(400);

        assertEquals(2, source.getCompleted().size());
        assertEquals(1, source.size());
        assertTrue(source.getRejections() >= 2);
        assertTrue(worker.getStats().jobsRejected() >= 2);

        worker.stop().get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Should report failed and invalid jobs and keep polling")
    void shouldReportFailures() throws Exception {
        runtime = runtime(SecurityLimits.defaults());
        FailingJob failing = new FailingJob("broken");
        failing.setIsolation(IsolationHint.INLINE);
        CountingJob invalid = new CountingJob();
        invalid.setTimeoutSeconds(100_000);
        List<String> executed = new CopyOnWriteArrayList<>();
        QueueJobSource source = new QueueJobSource()
                .add(failing)
                .add(invalid)
                .add(CountingJob.into(executed));
        QueueWorker worker = new QueueWorker(runtime, source, new WorkerConfig(20, 50, 1, 0));

        worker.start();

        assertTrue(runtime.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(List.of(failing, invalid), source.getFailed());
        assertEquals(1, executed.size());
        assertEquals(2, worker.getStats().jobsFailed());
    }

    @Test
    @DisplayName("Should stop after max time and run stop callbacks")
    void shouldStopAfterMaxTime() throws Exception {
        runtime = runtime(SecurityLimits.defaults());
        AtomicBoolean callbackRan = new AtomicBoolean(false);
        QueueWorker worker = new QueueWorker(runtime, new QueueJobSource(), new WorkerConfig(50, 50, 0, 1));
        worker.onStop(() -> callbackRan.set(true));

        worker.start();

        assertTrue(runtime.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(callbackRan.get());
        assertTrue(worker.getStats().stopped());
        assertTrue(worker.getStats().uptimeSeconds() >= 1.0);
    }

    @Test
    @DisplayName("Stopping should shut the runtime down")
    void stopShutsRuntimeDown() throws Exception {
        runtime = runtime(SecurityLimits.defaults());
        QueueWorker worker = new QueueWorker(runtime, new QueueJobSource(), WorkerConfig.defaults());
        worker.start();

        worker.stop().get(5, TimeUnit.SECONDS);

        assertTrue(runtime.isTerminated());
        assertTrue(worker.isStopped());
    }

    private static JobRuntime runtime(SecurityLimits limits) {
        RunnerConfig config = RunnerConfig.defaults().withLimits(limits);
        JobAnalyzer analyzer = new JobAnalyzer(AnalyzerConfig.defaults(), new InMemoryStatisticsStore(),
                SourceLocator.none());
        FirstMatchStrategySelector selector = new FirstMatchStrategySelector()
                .addStrategy(new InlineStrategy(512), ExecutionTier.INLINE);
        HealthProbe probe = new HealthProbe() {
            @Override
            public double cpuLoad() {
                return 0.1;
            }

            @Override
            public long heapUsedBytes() {
                return 64L * 1024 * 1024;
            }
        };
        return new JobRuntime(config, selector, analyzer, new EventLoop("worker-test"), probe, new ShutdownSignal());
    }
}
