package com.jobrunner.runtime;

import com.jobrunner.exception.JobRejectedException;
import com.jobrunner.exception.JobRunnerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded scheduler that owns all runtime state.
 *
 * <p>Tasks run one at a time in submission order; timers are ordinary tasks that
 * become ready when their delay expires, so work queued ahead of a due timer runs
 * first. Code already on the loop thread may call {@link #call(Callable)} without
 * deadlocking: the callable then runs in place.
 */
public class EventLoop implements Executor {

    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private final String name;
    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread loopThread;

    public EventLoop(String name) {
        this.name = name;
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, name + "-loop");
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    }

    /**
     * Whether the current thread is the loop thread.
     */
    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Queue a task. Exceptions it throws are logged, never propagated.
     */
    @Override
    public void execute(Runnable task) {
        if (task == null) {
            throw new NullPointerException("Task cannot be null");
        }
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            throw new JobRejectedException("Event loop " + name + " is shut down");
        }
    }

    /**
     * Run a callable on the loop and wait for its result.
     * Runtime exceptions thrown by the callable reach the caller unchanged.
     */
    public <T> T call(Callable<T> task) {
        if (task == null) {
            throw new NullPointerException("Task cannot be null");
        }
        if (inLoop()) {
            return callInPlace(task);
        }

        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new JobRejectedException("Event loop " + name + " is shut down");
        }

        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new JobRunnerException("Interrupted while waiting for event loop " + name, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new JobRunnerException(cause.getMessage(), cause);
        }
    }

    /**
     * Run a task once after a delay.
     */
    public ScheduledFuture<?> schedule(Runnable task, long delayMs) {
        try {
            return executor.schedule(guarded(task), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            throw new JobRejectedException("Event loop " + name + " is shut down");
        }
    }

    /**
     * Run a task periodically. A failing run is logged and the schedule continues.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
        try {
            return executor.scheduleAtFixedRate(guarded(task), initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            throw new JobRejectedException("Event loop " + name + " is shut down");
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stop accepting tasks; already queued non-delayed tasks still run.
     */
    public void shutdown() {
        executor.shutdown();
    }

    /**
     * Stop immediately and drop queued tasks.
     */
    public void shutdownNow() {
        executor.shutdownNow();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    public String getName() {
        return name;
    }

    private <T> T callInPlace(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new JobRunnerException(e.getMessage(), e);
        }
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Throwable t) {
                log.error("Unhandled error in event loop {} task: {}", name, t.toString());
            }
        };
    }
}
