package com.jobrunner.worker;

import com.jobrunner.config.WorkerConfig;
import com.jobrunner.core.ErrorSanitizer;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.exception.JobRejectedException;
import com.jobrunner.runtime.JobRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Feeds jobs from a {@link JobSource} into a {@link JobRuntime}.
 *
 * <p>Polling runs on the runtime's event loop: after a job it polls again at once,
 * on an empty source it waits the poll interval, and after an admission refusal it
 * hands the job back and waits the reject backoff. The worker stops, and shuts the
 * runtime down, after {@code maxJobs} completions or {@code maxTimeSeconds} of
 * running, whichever comes first (zero means unlimited).
 */
public class QueueWorker {

    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    private final JobRuntime runtime;
    private final JobSource source;
    private final WorkerConfig config;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong jobsProcessed = new AtomicLong(0);
    private final AtomicLong jobsFailed = new AtomicLong(0);
    private final AtomicLong jobsRejected = new AtomicLong(0);
    private final List<Runnable> stopCallbacks = new CopyOnWriteArrayList<>();
    private volatile long startNanos;
    private ScheduledFuture<?> pollTimer;

    public QueueWorker(JobRuntime runtime, JobSource source, WorkerConfig config) {
        if (runtime == null || source == null || config == null) {
            throw new NullPointerException("Runtime, source and config cannot be null");
        }
        this.runtime = runtime;
        this.source = source;
        this.config = config;
    }

    /**
     * Start the runtime and begin polling.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        startNanos = System.nanoTime();
        runtime.start();
        log.info("Queue worker started (poll interval {}ms, max jobs {}, max time {})",
                config.pollIntervalMs(),
                config.maxJobs() > 0 ? config.maxJobs() : "unlimited",
                config.maxTimeSeconds() > 0 ? config.maxTimeSeconds() + "s" : "unlimited");
        schedulePoll(0);
    }

    private void schedulePoll(long delayMs) {
        if (stopped.get()) {
            return;
        }
        try {
            pollTimer = runtime.getLoop().schedule(this::poll, delayMs);
        } catch (JobRejectedException e) {
            // runtime loop already gone
            stopped.set(true);
        }
    }

    private void poll() {
        if (!shouldContinue()) {
            stop();
            return;
        }

        Optional<JobDescriptor> next;
        try {
            next = source.poll();
        } catch (RuntimeException e) {
            log.error("Error during poll: {}", ErrorSanitizer.describe(e));
            schedulePoll(config.pollIntervalMs());
            return;
        }

        if (next.isEmpty()) {
            schedulePoll(config.pollIntervalMs());
            return;
        }
        schedulePoll(process(next.get()) ? 0 : config.rejectBackoffMs());
    }

    /**
     * @return false if admission control refused the job
     */
    private boolean process(JobDescriptor job) {
        String jobId = ErrorSanitizer.sanitizeJobId(job.getId());
        CompletableFuture<Void> outcome;
        try {
            log.debug("Processing job {} ({})", jobId, job.getType());
            outcome = runtime.executeJob(job);
        } catch (JobRejectedException e) {
            jobsRejected.incrementAndGet();
            log.debug("Job {} handed back to source: {}", jobId, e.getMessage());
            source.reject(job, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            jobsFailed.incrementAndGet();
            String reason = ErrorSanitizer.describe(e);
            log.error("Error setting up job {}: {}", jobId, reason);
            source.onFailed(job, reason);
            return true;
        }

        outcome.whenComplete((ignored, error) -> {
            if (error == null) {
                long processed = jobsProcessed.incrementAndGet();
                log.info("Job {} completed ({} processed)", jobId, processed);
                source.onCompleted(job);
            } else {
                jobsFailed.incrementAndGet();
                String reason = ErrorSanitizer.describe(error);
                log.error("Job {} failed: {}", jobId, reason);
                source.onFailed(job, reason);
            }
        });
        return true;
    }

    private boolean shouldContinue() {
        if (stopped.get() || runtime.isShuttingDown()) {
            return false;
        }
        if (config.maxJobs() > 0 && jobsProcessed.get() >= config.maxJobs()) {
            log.info("Worker reached max jobs ({})", config.maxJobs());
            return false;
        }
        if (config.maxTimeSeconds() > 0) {
            long elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000L;
            if (elapsedSeconds >= config.maxTimeSeconds()) {
                log.info("Worker reached max time ({}s)", config.maxTimeSeconds());
                return false;
            }
        }
        return true;
    }

    /**
     * Stop polling and shut the runtime down gracefully.
     *
     * @return future completing when the runtime has stopped
     */
    public CompletableFuture<Void> stop() {
        if (!stopped.compareAndSet(false, true)) {
            return runtime.shutdown();
        }
        ScheduledFuture<?> timer = pollTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        for (Runnable callback : stopCallbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.error("Error in stop callback: {}", e.getMessage());
            }
        }
        log.info("Queue worker stopping ({} processed, {} failed, {} rejected)",
                jobsProcessed.get(), jobsFailed.get(), jobsRejected.get());
        return runtime.shutdown();
    }

    /**
     * Run a callback when the worker stops.
     */
    public void onStop(Runnable callback) {
        stopCallbacks.add(callback);
    }

    public WorkerStats getStats() {
        double uptime = started.get() ? (System.nanoTime() - startNanos) / 1_000_000_000.0 : 0.0;
        return new WorkerStats(jobsProcessed.get(), jobsFailed.get(), jobsRejected.get(),
                Math.round(uptime * 100.0) / 100.0, stopped.get());
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * @param jobsProcessed Jobs completed successfully
     * @param jobsFailed    Jobs that failed, timed out or could not be set up
     * @param jobsRejected  Admission refusals handed back to the source
     * @param uptimeSeconds Time since start
     * @param stopped       Whether the worker has stopped
     */
    public record WorkerStats(long jobsProcessed, long jobsFailed, long jobsRejected,
                              double uptimeSeconds, boolean stopped) {}
}
