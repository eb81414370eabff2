package com.jobrunner.strategy;

import com.jobrunner.core.ErrorSanitizer;
import com.jobrunner.core.JobDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * State of one isolated run. The first terminal transition wins and cleans up;
 * later ones are ignored.
 */
final class IsolatedExecution {

    private static final Logger log = LoggerFactory.getLogger(IsolatedExecution.class);

    enum State {
        PENDING, VALIDATING, SPAWNING, RUNNING, SUCCEEDED, FAILED, TIMED_OUT;

        boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
        }
    }

    private final JobDescriptor job;
    private final String jobId;
    private final CompletableFuture<Void> result = new CompletableFuture<>();

    private State state = State.PENDING;
    private long startedNanos;
    private Path payloadFile;
    private Process process;
    private StreamCollector stderr;
    private ScheduledFuture<?> killTimer;

    IsolatedExecution(JobDescriptor job) {
        this.job = job;
        this.jobId = ErrorSanitizer.sanitizeJobId(job.getId());
    }

    synchronized void advance(State next) {
        if (state.isTerminal() || next.isTerminal() || next.ordinal() <= state.ordinal()) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for job " + jobId);
        }
        state = next;
    }

    /**
     * Move to a terminal state and clean up, once.
     *
     * @return false if the execution had already finished
     */
    synchronized boolean finish(State terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not terminal");
        }
        if (state.isTerminal()) {
            return false;
        }
        state = terminal;
        cleanup();
        return true;
    }

    private void cleanup() {
        if (killTimer != null) {
            killTimer.cancel(false);
        }
        if (payloadFile != null) {
            try {
                Files.deleteIfExists(payloadFile);
            } catch (IOException e) {
                log.warn("Could not delete payload file of job {}: {}", jobId, e.getMessage());
            }
        }
    }

    synchronized State state() {
        return state;
    }

    synchronized void attachPayload(Path file) {
        this.payloadFile = file;
    }

    synchronized void attachProcess(Process process, StreamCollector stderr) {
        this.process = process;
        this.stderr = stderr;
        this.startedNanos = System.nanoTime();
    }

    synchronized void attachKillTimer(ScheduledFuture<?> timer) {
        if (state.isTerminal()) {
            timer.cancel(false);
        } else {
            this.killTimer = timer;
        }
    }

    synchronized Process process() {
        return process;
    }

    synchronized StreamCollector stderr() {
        return stderr;
    }

    synchronized Path payloadFile() {
        return payloadFile;
    }

    double elapsedSeconds() {
        return (System.nanoTime() - startedNanos) / 1_000_000_000.0;
    }

    JobDescriptor job() {
        return job;
    }

    String jobId() {
        return jobId;
    }

    CompletableFuture<Void> result() {
        return result;
    }

    boolean isAlive() {
        Process p = process();
        return p != null && p.isAlive();
    }
}
