package com.jobrunner.strategy.isolated;

import com.jobrunner.core.ErrorSanitizer;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.core.JobScope;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Entry point of an isolated child process.
 *
 * <p>Reads the envelope named on the command line, rebuilds the job through its public
 * no-arg constructor, restores its fields and runs it. Exit status 0 means success;
 * on failure a single {@code Job failed: <message>} line goes to stderr and the
 * status is 1. Stack traces are never printed.
 */
public final class IsolatedJobLauncher {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private IsolatedJobLauncher() {
    }

    public static void main(String[] args) {
        int status = run(args, System.err);
        System.err.flush();
        System.exit(status);
    }

    static int run(String[] args, PrintStream err) {
        if (args.length != 1) {
            err.println("Job failed: expected exactly one argument, the payload file");
            return EXIT_USAGE;
        }

        try {
            JobEnvelope envelope = JobStateCodec.read(Path.of(args[0]));
            JobDescriptor job = instantiate(envelope.jobClass());
            job.restoreFields(envelope.fields());

            Instant deadline = Instant.now().plusSeconds(envelope.timeoutSeconds());
            try (JobScope ignored = JobScope.open(envelope.id(), envelope.maxMemoryMb(), deadline)) {
                job.execute();
            }
            return EXIT_SUCCESS;
        } catch (Throwable t) {
            err.println("Job failed: " + ErrorSanitizer.describe(t));
            return EXIT_FAILURE;
        }
    }

    private static JobDescriptor instantiate(String className) throws ReflectiveOperationException {
        if (className == null || className.isBlank()) {
            throw new IllegalArgumentException("Payload names no job class");
        }
        // Load without initializing so a non-job class never runs its static initializer
        Class<?> type = Class.forName(className, false, IsolatedJobLauncher.class.getClassLoader());
        if (!JobDescriptor.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException("Class " + className + " is not a job");
        }
        return (JobDescriptor) type.getConstructor().newInstance();
    }
}
