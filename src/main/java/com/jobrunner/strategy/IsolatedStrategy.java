package com.jobrunner.strategy;

import com.jobrunner.config.IsolationConfig;
import com.jobrunner.config.SecurityLimits;
import com.jobrunner.core.ErrorSanitizer;
import com.jobrunner.core.IsolationHint;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.core.JobValidator;
import com.jobrunner.exception.JobExecutionException;
import com.jobrunner.exception.JobRejectedException;
import com.jobrunner.exception.JobTimeoutException;
import com.jobrunner.exception.SecurityViolationException;
import com.jobrunner.runtime.EventLoop;
import com.jobrunner.strategy.IsolatedExecution.State;
import com.jobrunner.strategy.isolated.IsolatedJobLauncher;
import com.jobrunner.strategy.isolated.JobStateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs each job in a fresh child JVM.
 *
 * <p>The job's plain-data fields travel as JSON in an owner-only temporary file. The
 * child heap is capped with {@code -Xmx}; a timer on the event loop force-kills the
 * child and its descendants once the effective timeout elapses. Exit is observed
 * through {@link Process#onExit()} and settled back on the loop; output streams are
 * drained on a separate I/O pool, so nothing here blocks the loop.
 */
public class IsolatedStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(IsolatedStrategy.class);

    public static final String NAME = "isolated";

    /**
     * Smallest -Xmx handed to a child; below this the JVM cannot start.
     */
    static final int MIN_CHILD_HEAP_MB = 32;

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
    private static final long STDERR_GRACE_MS = 2_000;

    private final EventLoop loop;
    private final SecurityLimits limits;
    private final IsolationConfig isolation;
    private final String javaCommand;
    private final String classpath;
    private final Path tempDirectory;
    private final List<Path> allowedRoots;

    private final ExecutorService ioPool;
    private final Executor settleExecutor;
    private final Set<IsolatedExecution> active = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public IsolatedStrategy(EventLoop loop, SecurityLimits limits, IsolationConfig isolation) {
        if (loop == null || limits == null || isolation == null) {
            throw new NullPointerException("Loop, limits and isolation config cannot be null");
        }
        this.loop = loop;
        this.limits = limits;
        this.isolation = isolation;
        this.javaCommand = isolation.javaCommand() != null
                ? isolation.javaCommand()
                : Path.of(System.getProperty("java.home"), "bin", "java").toString();
        this.classpath = isolation.classpath() != null
                ? isolation.classpath()
                : System.getProperty("java.class.path");
        this.tempDirectory = Path.of(isolation.tempDirectory() != null
                ? isolation.tempDirectory()
                : System.getProperty("java.io.tmpdir"));
        this.allowedRoots = limits.allowedJobPaths().stream()
                .map(p -> realPath(Path.of(p)))
                .toList();

        AtomicInteger ioThreads = new AtomicInteger();
        this.ioPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, loop.getName() + "-io-" + ioThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        // settle on the loop; once the loop is gone, settle in place so futures still complete
        this.settleExecutor = task -> {
            try {
                loop.execute(task);
            } catch (JobRejectedException e) {
                task.run();
            }
        };

        log.info("Isolated strategy ready (java: {}, allowed paths: {}, isolated by default: {})",
                javaCommand, allowedRoots.size(), limits.isolatedByDefault());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean canHandle(JobDescriptor job) {
        IsolationHint hint = job.getIsolation();
        if (hint == IsolationHint.ISOLATED) {
            return true;
        }
        return limits.isolatedByDefault() && hint != IsolationHint.INLINE;
    }

    @Override
    public CompletableFuture<Void> execute(JobDescriptor job) {
        if (closed.get()) {
            throw new JobRejectedException("Isolated strategy is closed");
        }

        IsolatedExecution execution = new IsolatedExecution(job);
        execution.advance(State.VALIDATING);
        JobValidator.validateResources(job, limits);
        checkCodeSource(job.getClass());

        int timeoutSeconds = Math.min(job.getTimeoutSeconds(), limits.maxTimeoutSeconds());
        int memoryMb = Math.min(job.getMaxMemoryMb(), limits.maxMemoryMb());

        execution.advance(State.SPAWNING);
        Process process = null;
        try {
            byte[] payload = JobStateCodec.encode(JobStateCodec.envelope(job, timeoutSeconds, memoryMb));
            Path payloadFile = createPayloadFile();
            execution.attachPayload(payloadFile);
            Files.write(payloadFile, payload);

            ProcessBuilder builder = new ProcessBuilder(command(memoryMb, payloadFile));
            process = builder.start();
            process.getOutputStream().close();
        } catch (IOException | RuntimeException e) {
            kill(process);
            fail(execution, "Failed to start isolated process: " + ErrorSanitizer.describe(e));
            return execution.result();
        }

        String jobId = execution.jobId();
        StreamCollector stderr = StreamCollector.start(process.getErrorStream(), isolation.stderrLimit(), null, ioPool);
        StreamCollector.start(process.getInputStream(), 0, "[" + jobId + "]", ioPool);
        execution.attachProcess(process, stderr);
        execution.advance(State.RUNNING);
        active.add(execution);

        log.debug("Spawned isolated process {} for job {} (timeout {}s, memory {}MB)",
                process.pid(), jobId, timeoutSeconds, memoryMb);

        execution.attachKillTimer(loop.schedule(() -> timeOut(execution, timeoutSeconds),
                TimeUnit.SECONDS.toMillis(timeoutSeconds)));

        process.onExit()
                .thenCompose(p -> stderr.done().copy()
                        .orTimeout(STDERR_GRACE_MS, TimeUnit.MILLISECONDS)
                        .exceptionally(t -> stderr.snapshot()))
                .whenCompleteAsync((stderrText, error) -> exited(execution, stderrText), settleExecutor);

        return execution.result();
    }

    /**
     * Children still alive.
     */
    public int activeProcesses() {
        return (int) active.stream().filter(IsolatedExecution::isAlive).count();
    }

    /**
     * Kill every live child and stop the I/O pool. Running jobs fail.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (IsolatedExecution execution : active) {
            if (execution.finish(State.FAILED)) {
                execution.result().completeExceptionally(
                        new JobExecutionException("Job " + execution.jobId() + " was terminated during shutdown"));
            }
            kill(execution.process());
        }
        active.clear();
        ioPool.shutdownNow();
        log.info("Isolated strategy closed");
    }

    List<String> command(int memoryMb, Path payloadFile) {
        List<String> command = new ArrayList<>();
        command.add(javaCommand);
        command.add("-Xmx" + Math.max(MIN_CHILD_HEAP_MB, memoryMb) + "m");
        command.addAll(isolation.jvmOptions());
        command.add("-XX:+ExitOnOutOfMemoryError");
        command.add("-cp");
        command.add(classpath);
        command.add(IsolatedJobLauncher.class.getName());
        command.add(payloadFile.toString());
        return command;
    }

    void timeOut(IsolatedExecution execution, int timeoutSeconds) {
        Process process = execution.process();
        if (process != null && !process.isAlive()) {
            // exited before the deadline; still collecting stderr, settled by exited()
            log.debug("Isolated job {} already exited with code {} at its deadline",
                    execution.jobId(), process.exitValue());
            return;
        }
        if (!execution.finish(State.TIMED_OUT)) {
            return;
        }
        kill(execution.process());
        log.warn("Isolated job {} timed out after {}s, process killed", execution.jobId(), timeoutSeconds);
        execution.result().completeExceptionally(new JobTimeoutException(execution.jobId(), timeoutSeconds));
    }

    private void exited(IsolatedExecution execution, String stderrText) {
        active.remove(execution);
        int exitCode = execution.process().exitValue();

        if (exitCode == IsolatedJobLauncher.EXIT_SUCCESS) {
            if (execution.finish(State.SUCCEEDED)) {
                log.debug("Isolated job {} completed in {}s", execution.jobId(),
                        String.format("%.2f", execution.elapsedSeconds()));
                execution.result().complete(null);
            }
            return;
        }

        String detail = ErrorSanitizer.sanitizeMessage(stderrText == null ? "" : stderrText.trim());
        if (execution.finish(State.FAILED)) {
            log.warn("Isolated job {} failed with exit code {}: {}", execution.jobId(), exitCode, detail);
            String message = "Isolated job exited with code " + exitCode;
            if (!detail.isEmpty()) {
                message = message + ": " + detail;
            }
            execution.result().completeExceptionally(new JobExecutionException(message));
        }
    }

    private void fail(IsolatedExecution execution, String message) {
        if (execution.finish(State.FAILED)) {
            log.warn("Isolated job {} failed: {}", execution.jobId(), message);
            execution.result().completeExceptionally(new JobExecutionException(message));
        }
    }

    private void checkCodeSource(Class<?> jobClass) {
        if (allowedRoots.isEmpty()) {
            return;
        }
        Path location = codeLocation(jobClass).orElseThrow(() -> new SecurityViolationException(
                "Job class " + jobClass.getName() + " has no resolvable code location"));
        for (Path allowed : allowedRoots) {
            if (location.startsWith(allowed)) {
                return;
            }
        }
        log.warn("Rejected job class {} outside the allowed paths", jobClass.getName());
        throw new SecurityViolationException("Job class " + jobClass.getName() + " is not in an allowed location");
    }

    static Optional<Path> codeLocation(Class<?> jobClass) {
        CodeSource source = jobClass.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return Optional.empty();
        }
        URL url = source.getLocation();
        try {
            return Optional.of(realPath(Path.of(url.toURI())));
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            return Optional.empty();
        }
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path.toAbsolutePath().normalize();
        }
    }

    private Path createPayloadFile() throws IOException {
        Files.createDirectories(tempDirectory);
        try {
            return Files.createTempFile(tempDirectory, "jobrunner-job-", ".json",
                    PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        } catch (UnsupportedOperationException e) {
            Path file = Files.createTempFile(tempDirectory, "jobrunner-job-", ".json");
            File f = file.toFile();
            f.setReadable(false, false);
            f.setReadable(true, true);
            f.setWritable(false, false);
            f.setWritable(true, true);
            return file;
        }
    }

    private static void kill(Process process) {
        if (process == null) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    public Path getTempDirectory() {
        return tempDirectory;
    }
}
