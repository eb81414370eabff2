package com.jobrunner.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Drains a child process stream to its end, keeping at most {@code limit} characters.
 */
final class StreamCollector {

    private static final Logger log = LoggerFactory.getLogger(StreamCollector.class);

    private final StringBuilder text = new StringBuilder();
    private final int limit;
    private final CompletableFuture<String> done = new CompletableFuture<>();

    private StreamCollector(int limit) {
        this.limit = limit;
    }

    /**
     * Start draining on the given executor.
     *
     * @param logPrefix when not null each line is also logged at DEBUG with this prefix
     */
    static StreamCollector start(InputStream stream, int limit, String logPrefix, Executor executor) {
        StreamCollector collector = new StreamCollector(limit);
        executor.execute(() -> collector.drain(stream, logPrefix));
        return collector;
    }

    /**
     * Completes with the kept text when the stream reaches its end.
     */
    CompletableFuture<String> done() {
        return done;
    }

    synchronized String snapshot() {
        return text.toString();
    }

    private void drain(InputStream stream, String logPrefix) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                append(line);
                if (logPrefix != null) {
                    log.debug("{} {}", logPrefix, line);
                }
            }
        } catch (IOException e) {
            // stream closed under us when the process was killed
            log.debug("Stream closed early: {}", e.getMessage());
        } finally {
            done.complete(snapshot());
        }
    }

    private synchronized void append(String line) {
        int room = limit - text.length();
        if (room <= 0) {
            return;
        }
        if (text.length() > 0) {
            text.append('\n');
            room--;
        }
        text.append(line, 0, Math.min(line.length(), Math.max(0, room)));
    }
}
