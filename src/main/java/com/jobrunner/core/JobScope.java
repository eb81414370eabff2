package com.jobrunner.core;

import java.time.Instant;
import java.util.Optional;

/**
 * Scoped execution limits for a job running inline.
 *
 * <p>Opened with try-with-resources around the job body; closing restores whatever
 * scope was active before, on every exit path. A job body can consult
 * {@link #current()} to learn its memory ceiling and to return early once
 * {@link #isPastDeadline()} turns true. Nothing here preempts the job.
 */
public final class JobScope implements AutoCloseable {

    private static final ThreadLocal<JobScope> CURRENT = new ThreadLocal<>();

    private final String jobId;
    private final int memoryCeilingMb;
    private final Instant deadline;
    private final JobScope previous;
    private boolean closed;

    private JobScope(String jobId, int memoryCeilingMb, Instant deadline, JobScope previous) {
        this.jobId = jobId;
        this.memoryCeilingMb = memoryCeilingMb;
        this.deadline = deadline;
        this.previous = previous;
    }

    /**
     * Install a new scope on the current thread.
     */
    public static JobScope open(String jobId, int memoryCeilingMb, Instant deadline) {
        JobScope scope = new JobScope(jobId, memoryCeilingMb, deadline, CURRENT.get());
        CURRENT.set(scope);
        return scope;
    }

    /**
     * Scope of the job running on this thread, if any.
     */
    public static Optional<JobScope> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public String getJobId() {
        return jobId;
    }

    public int getMemoryCeilingMb() {
        return memoryCeilingMb;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public boolean isPastDeadline() {
        return Instant.now().isAfter(deadline);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (previous == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(previous);
        }
    }
}
