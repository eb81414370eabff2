package com.jobrunner.strategy;

import com.jobrunner.core.ErrorSanitizer;
import com.jobrunner.core.IsolationHint;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.core.JobScope;
import com.jobrunner.exception.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the job body synchronously on the calling thread, normally the event loop.
 *
 * <p>Fast and cheap, but the caller is blocked for the job's duration and nothing is
 * preempted: an overrun of the declared timeout is only reported. The job sees its
 * memory ceiling and deadline through {@link JobScope}.
 */
public class InlineStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(InlineStrategy.class);

    public static final String NAME = "inline";

    private static final long MB = 1024L * 1024L;

    private final int processMaxMemoryMb;
    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

    /**
     * @param processMaxMemoryMb Upper bound for any job's memory ceiling
     */
    public InlineStrategy(int processMaxMemoryMb) {
        if (processMaxMemoryMb <= 0) {
            throw new IllegalArgumentException("Process memory cap must be positive");
        }
        this.processMaxMemoryMb = processMaxMemoryMb;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean canHandle(JobDescriptor job) {
        return job.getIsolation() == IsolationHint.INLINE;
    }

    @Override
    public CompletableFuture<Void> execute(JobDescriptor job) {
        String jobId = ErrorSanitizer.sanitizeJobId(job.getId());
        int ceilingMb = Math.min(job.getMaxMemoryMb(), processMaxMemoryMb);
        Instant deadline = Instant.now().plusSeconds(job.getTimeoutSeconds());

        long heapBefore = memory.getHeapMemoryUsage().getUsed();
        long start = System.nanoTime();
        try (JobScope ignored = JobScope.open(job.getId(), ceilingMb, deadline)) {
            job.execute();
            return CompletableFuture.completedFuture(null);
        } catch (Throwable t) {
            String message = ErrorSanitizer.describe(t);
            log.warn("Inline job {} failed: {}", jobId, message);
            return CompletableFuture.failedFuture(new JobExecutionException(message));
        } finally {
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
            if (seconds > job.getTimeoutSeconds()) {
                log.warn("Inline job {} exceeded its timeout: {}s > {}s",
                        jobId, String.format("%.2f", seconds), job.getTimeoutSeconds());
            }
            long grownMb = (memory.getHeapMemoryUsage().getUsed() - heapBefore) / MB;
            if (grownMb > ceilingMb) {
                log.warn("Inline job {} grew the heap by about {}MB, above its {}MB ceiling",
                        jobId, grownMb, ceilingMb);
            }
        }
    }

    public int getProcessMaxMemoryMb() {
        return processMaxMemoryMb;
    }
}
