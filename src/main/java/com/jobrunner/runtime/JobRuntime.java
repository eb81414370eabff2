package com.jobrunner.runtime;

import com.jobrunner.analysis.JobAnalyzer;
import com.jobrunner.config.HealthConfig;
import com.jobrunner.config.RunnerConfig;
import com.jobrunner.config.SecurityLimits;
import com.jobrunner.core.ErrorSanitizer;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.core.JobValidator;
import com.jobrunner.exception.ConcurrencyLimitExceededException;
import com.jobrunner.exception.JobRejectedException;
import com.jobrunner.exception.JobRunnerException;
import com.jobrunner.exception.JobTimeoutException;
import com.jobrunner.exception.RateLimitExceededException;
import com.jobrunner.stats.InMemoryStatisticsStore;
import com.jobrunner.stats.StatisticsStore;
import com.jobrunner.strategy.AnalyzingStrategySelector;
import com.jobrunner.strategy.ExecutionStrategy;
import com.jobrunner.strategy.InlineStrategy;
import com.jobrunner.strategy.IsolatedStrategy;
import com.jobrunner.strategy.StrategySelector;
import com.jobrunner.strategy.StrategySelector.Selection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Top-level job orchestrator.
 *
 * <p>Every job goes through validation, admission (shutdown flag, rate window,
 * concurrency ceiling), strategy selection and dispatch, all on the event loop in
 * call order. Validation, security and admission failures are thrown to the caller;
 * execution and timeout failures arrive through the returned future. Settlement
 * updates the counters and feeds the analyzer.
 *
 * <p>Once started, the runtime also watches heap usage (exceeding the memory limit
 * initiates graceful shutdown) and samples system health to move the concurrency
 * ceiling. Graceful shutdown stops admission at once, waits for in-flight jobs up to
 * the drain timeout and then stops the loop, killing whatever still runs.
 */
public class JobRuntime {

    private static final Logger log = LoggerFactory.getLogger(JobRuntime.class);

    static final int HEALTH_HISTORY_SIZE = 10;
    private static final double MB = 1024.0 * 1024.0;

    private final RunnerConfig config;
    private final SecurityLimits limits;
    private final StrategySelector selector;
    private final JobAnalyzer analyzer;
    private final EventLoop loop;
    private final HealthProbe probe;
    private final ShutdownSignal signal;
    private final ConcurrencyGovernor governor;

    // Loop-confined state
    private final DispatchWindow window = new DispatchWindow();
    private final Map<String, Tracked> running = new LinkedHashMap<>();
    private ScheduledFuture<?> memoryWatchdog;
    private ScheduledFuture<?> healthSampler;
    private ScheduledFuture<?> drainCheck;
    private long drainDeadlineNanos;

    // Readable from any thread
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final AtomicInteger runningCount = new AtomicInteger(0);
    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);
    private final AtomicLong rejectedCount = new AtomicLong(0);
    private final ConcurrentLinkedDeque<HealthSample> healthHistory = new ConcurrentLinkedDeque<>();
    private final List<RuntimeListener> listeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    public JobRuntime(RunnerConfig config, StrategySelector selector, JobAnalyzer analyzer, EventLoop loop) {
        this(config, selector, analyzer, loop, new JvmHealthProbe(), new ShutdownSignal());
    }

    public JobRuntime(RunnerConfig config,
                      StrategySelector selector,
                      JobAnalyzer analyzer,
                      EventLoop loop,
                      HealthProbe probe,
                      ShutdownSignal signal) {
        if (config == null || selector == null || analyzer == null || loop == null
                || probe == null || signal == null) {
            throw new NullPointerException("Runtime collaborators cannot be null");
        }
        config.validate();
        this.config = config;
        this.limits = config.limits();
        this.selector = selector;
        this.analyzer = analyzer;
        this.loop = loop;
        this.probe = probe;
        this.signal = signal;
        this.governor = new ConcurrencyGovernor(config.health());

        signal.onTrigger(() -> onLoop(() -> initiateShutdown("shutdown signal")));
    }

    /**
     * Wire a runtime with the standard collaborators and an in-memory statistics store.
     */
    public static JobRuntime create(RunnerConfig config) {
        return create(config, new InMemoryStatisticsStore());
    }

    /**
     * Wire a runtime with the standard collaborators: analyzing selector, inline strategy
     * for INLINE, isolated strategy for POOLED and ISOLATED.
     */
    public static JobRuntime create(RunnerConfig config, StatisticsStore store) {
        EventLoop loop = new EventLoop(config.name());
        JobAnalyzer analyzer = new JobAnalyzer(config.analyzer(), store);
        InlineStrategy inline = new InlineStrategy(config.health().memoryLimitMb());
        IsolatedStrategy isolated = new IsolatedStrategy(loop, config.limits(), config.isolation());
        StrategySelector selector = AnalyzingStrategySelector.standard(analyzer, inline, isolated);
        return new JobRuntime(config, selector, analyzer, loop);
    }

    /**
     * Start the memory watchdog and the health sampler. Jobs are accepted with or without it.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        HealthConfig health = config.health();
        onLoop(() -> {
            if (shuttingDown.get()) {
                return;
            }
            memoryWatchdog = loop.scheduleAtFixedRate(this::checkMemory,
                    health.memoryCheckIntervalMs(), health.memoryCheckIntervalMs());
            healthSampler = loop.scheduleAtFixedRate(this::sampleHealth,
                    health.healthCheckIntervalMs(), health.healthCheckIntervalMs());
        });
        log.info("Job runtime {} started (pid {}, memory limit {}MB, concurrency {} [{}..{}])",
                config.name(), ProcessHandle.current().pid(), health.memoryLimitMb(),
                governor.getCeiling(), governor.getFloor(), governor.getCap());
    }

    /**
     * Validate, admit and dispatch a job.
     *
     * @return future completing when the job settles
     * @throws com.jobrunner.exception.JobValidationException   if the job exceeds server limits
     * @throws com.jobrunner.exception.SecurityViolationException if the job's code is not allowed
     * @throws JobRejectedException                            if admission control refuses it
     */
    public CompletableFuture<Void> executeJob(JobDescriptor job) {
        if (job == null) {
            throw new NullPointerException("Job cannot be null");
        }
        if (shuttingDown.get()) {
            rejectedCount.incrementAndGet();
            throw new JobRejectedException("Runtime is shutting down, job rejected");
        }
        return loop.call(() -> dispatch(job));
    }

    private CompletableFuture<Void> dispatch(JobDescriptor job) {
        String jobId = ErrorSanitizer.sanitizeJobId(job.getId());
        try {
            if (shuttingDown.get()) {
                throw new JobRejectedException("Runtime is shutting down, job " + jobId + " rejected");
            }
            JobValidator.validate(job, limits);

            if (!window.hasCapacity(limits.maxJobsPerMinute())) {
                throw new RateLimitExceededException(limits.maxJobsPerMinute());
            }
            int ceiling = effectiveCeiling();
            if (running.size() >= ceiling) {
                throw new ConcurrencyLimitExceededException(ceiling);
            }
            if (running.containsKey(job.getId())) {
                throw new JobRejectedException("Job " + jobId + " is already running");
            }
        } catch (JobRunnerException e) {
            rejectedCount.incrementAndGet();
            log.warn("Job {} rejected: {}", jobId, e.getMessage());
            throw e;
        }

        Selection selection = selector.select(job);
        ExecutionStrategy strategy = selection.strategy();
        Tracked tracked = new Tracked(
                new ExecutionRecord(job, Instant.now(), strategy.getName(), selection.tier()),
                System.nanoTime());
        running.put(job.getId(), tracked);
        runningCount.set(running.size());

        CompletableFuture<Void> outcome;
        try {
            outcome = strategy.execute(job);
        } catch (RuntimeException e) {
            running.remove(job.getId(), tracked);
            runningCount.set(running.size());
            rejectedCount.incrementAndGet();
            log.warn("Job {} refused by {} strategy: {}", jobId, strategy.getName(), e.getMessage());
            throw e;
        }
        window.record();

        log.debug("Dispatched job {} via {} (running: {}/{})",
                jobId, strategy.getName(), running.size(), effectiveCeiling());
        notifyListeners(l -> l.onDispatched(job, strategy.getName(), selection.tier()));

        if (!outcome.isDone()) {
            int timeoutSeconds = Math.min(job.getTimeoutSeconds(), limits.maxTimeoutSeconds());
            tracked.timer = loop.schedule(() -> bookkeepingTimeout(tracked, timeoutSeconds),
                    TimeUnit.SECONDS.toMillis(timeoutSeconds));
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        outcome.whenComplete((ignored, error) -> onLoop(() -> {
            Throwable cause = unwrap(error);
            settle(tracked, cause);
            if (cause == null) {
                result.complete(null);
            } else {
                result.completeExceptionally(cause);
            }
        }));
        return result;
    }

    private void settle(Tracked tracked, Throwable error) {
        JobDescriptor job = tracked.record.job();
        String jobId = ErrorSanitizer.sanitizeJobId(job.getId());
        if (tracked.timer != null) {
            tracked.timer.cancel(false);
        }
        running.remove(job.getId(), tracked);
        runningCount.set(running.size());

        double seconds = (System.nanoTime() - tracked.startedNanos) / 1_000_000_000.0;
        if (error == null) {
            processedCount.incrementAndGet();
            log.debug("Job {} completed in {}s", jobId, String.format("%.3f", seconds));
            notifyListeners(l -> l.onCompleted(job, Duration.ofNanos(System.nanoTime() - tracked.startedNanos)));
        } else {
            failedCount.incrementAndGet();
            String reason = ErrorSanitizer.describe(error);
            log.warn("Job {} failed: {}", jobId, reason);
            if (error instanceof JobTimeoutException) {
                notifyListeners(l -> l.onTimedOut(job));
            } else {
                notifyListeners(l -> l.onFailed(job, reason));
            }
        }

        try {
            analyzer.recordExecution(job.getType(), seconds, error == null);
        } catch (RuntimeException e) {
            log.warn("Could not record statistics for {}: {}", job.getType(), e.getMessage());
        }

        if (shuttingDown.get()) {
            checkDrained();
        }
    }

    private void bookkeepingTimeout(Tracked tracked, int timeoutSeconds) {
        JobDescriptor job = tracked.record.job();
        if (running.remove(job.getId(), tracked)) {
            runningCount.set(running.size());
            log.warn("Job {} still running after its {}s timeout, no longer tracked",
                    ErrorSanitizer.sanitizeJobId(job.getId()), timeoutSeconds);
            if (shuttingDown.get()) {
                checkDrained();
            }
        }
    }

    private void checkMemory() {
        double heapMb = probe.heapUsedBytes() / MB;
        int limitMb = config.health().memoryLimitMb();
        log.debug("Memory: {}MB / {}MB, running jobs: {}", Math.round(heapMb), limitMb, running.size());
        if (heapMb > limitMb) {
            log.error("Memory limit exceeded ({}MB > {}MB), initiating graceful shutdown",
                    Math.round(heapMb), limitMb);
            initiateShutdown("memory limit exceeded");
        }
    }

    private void sampleHealth() {
        double heapMb = probe.heapUsedBytes() / MB;
        HealthSample sample = new HealthSample(
                System.currentTimeMillis(),
                probe.cpuLoad(),
                heapMb / config.health().memoryLimitMb(),
                heapMb,
                running.size());

        healthHistory.addLast(sample);
        while (healthHistory.size() > HEALTH_HISTORY_SIZE) {
            healthHistory.pollFirst();
        }

        int before = governor.getCeiling();
        int after = governor.adjust(sample);
        if (after != before) {
            notifyListeners(l -> l.onConcurrencyChanged(before, after));
        }
    }

    /**
     * Begin graceful shutdown.
     *
     * @return future completing once the runtime has stopped
     */
    public CompletableFuture<Void> shutdown() {
        onLoop(() -> initiateShutdown("requested"));
        return terminated;
    }

    /**
     * Stop at once, killing whatever still runs.
     */
    public CompletableFuture<Void> shutdownNow() {
        onLoop(() -> {
            shuttingDown.set(true);
            stop(true);
        });
        return terminated;
    }

    /**
     * Wait for the runtime to stop.
     *
     * @return true if it stopped within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        try {
            terminated.get(timeout, unit);
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return true;
        }
        long remaining = Math.max(0, deadline - System.nanoTime());
        return loop.awaitTermination(remaining, TimeUnit.NANOSECONDS);
    }

    /**
     * Register a JVM shutdown hook that requests graceful shutdown and waits for it.
     */
    public Thread installShutdownHook() {
        long waitMs = config.shutdown().drainTimeoutMs() + 2_000;
        Thread hook = new Thread(() -> {
            signal.trigger("JVM shutdown");
            try {
                awaitTermination(waitMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, config.name() + "-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private void initiateShutdown(String reason) {
        if (!shuttingDown.compareAndSet(false, true)) {
            return;
        }
        int inFlight = running.size();
        log.info("Graceful shutdown initiated ({}), waiting for {} running jobs", reason, inFlight);
        notifyListeners(l -> l.onShutdownInitiated(inFlight));

        cancel(memoryWatchdog);
        cancel(healthSampler);

        if (running.isEmpty()) {
            stop(false);
            return;
        }
        drainDeadlineNanos = System.nanoTime()
                + TimeUnit.MILLISECONDS.toNanos(config.shutdown().drainTimeoutMs());
        long interval = config.shutdown().drainCheckIntervalMs();
        drainCheck = loop.scheduleAtFixedRate(this::checkDrained, interval, interval);
    }

    private void checkDrained() {
        if (terminated.isDone()) {
            return;
        }
        if (running.isEmpty()) {
            log.info("All jobs completed, shutting down");
            stop(false);
        } else if (drainCheck != null && System.nanoTime() >= drainDeadlineNanos) {
            log.warn("Shutdown timeout reached with {} jobs still running, forcing stop", running.size());
            stop(true);
        }
    }

    private void stop(boolean forced) {
        if (terminated.isDone()) {
            return;
        }
        cancel(memoryWatchdog);
        cancel(healthSampler);
        cancel(drainCheck);
        for (Tracked tracked : running.values()) {
            cancel(tracked.timer);
        }

        for (ExecutionStrategy strategy : selector.getStrategies()) {
            try {
                strategy.close();
            } catch (RuntimeException e) {
                log.error("Failed to close {} strategy: {}", strategy.getName(), e.getMessage());
            }
        }

        loop.shutdown();
        if (forced) {
            log.warn("Job runtime {} force-stopped ({} processed, {} failed, {} abandoned)",
                    config.name(), processedCount.get(), failedCount.get(), running.size());
        } else {
            log.info("Job runtime {} stopped ({} processed, {} failed)",
                    config.name(), processedCount.get(), failedCount.get());
        }
        terminated.complete(null);
    }

    public RuntimeStats getStats() {
        return new RuntimeStats(
                processedCount.get(),
                failedCount.get(),
                rejectedCount.get(),
                runningCount.get(),
                governor.getCeiling(),
                Math.round(probe.heapUsedBytes() / MB * 100.0) / 100.0,
                selector.getSelectionCounts(),
                healthHistory.peekLast(),
                shuttingDown.get());
    }

    /**
     * Up to the last ten health samples, oldest first.
     */
    public List<HealthSample> getHealthHistory() {
        return new ArrayList<>(healthHistory);
    }

    /**
     * Jobs currently tracked, in dispatch order. Empty once the loop has stopped.
     */
    public List<ExecutionRecord> getRunningJobs() {
        try {
            return loop.call(() -> running.values().stream().map(t -> t.record).toList());
        } catch (JobRejectedException e) {
            return List.of();
        }
    }

    public void addListener(RuntimeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RuntimeListener listener) {
        listeners.remove(listener);
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public boolean isTerminated() {
        return terminated.isDone();
    }

    public int getConcurrencyCeiling() {
        return governor.getCeiling();
    }

    public EventLoop getLoop() {
        return loop;
    }

    public JobAnalyzer getAnalyzer() {
        return analyzer;
    }

    public RunnerConfig getConfig() {
        return config;
    }

    private int effectiveCeiling() {
        return Math.min(governor.getCeiling(), limits.maxConcurrentJobs());
    }

    private void onLoop(Runnable task) {
        if (loop.inLoop()) {
            task.run();
            return;
        }
        try {
            loop.execute(task);
        } catch (JobRejectedException e) {
            // loop already stopped: run in place so futures still complete
            task.run();
        }
    }

    private void notifyListeners(Consumer<RuntimeListener> event) {
        for (RuntimeListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Runtime listener failed: {}", e.getMessage());
            }
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static final class Tracked {
        private final ExecutionRecord record;
        private final long startedNanos;
        private ScheduledFuture<?> timer;

        private Tracked(ExecutionRecord record, long startedNanos) {
            this.record = record;
            this.startedNanos = startedNanos;
        }
    }
}
