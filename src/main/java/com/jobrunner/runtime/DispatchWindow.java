package com.jobrunner.runtime;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding window of dispatch timestamps for rate limiting.
 *
 * <p>Timestamps are appended in time order, so expiry only ever drains the head.
 * Pruning happens lazily on each mutating or counting call. Confined to the event
 * loop thread; not thread-safe.
 */
public class DispatchWindow {

    public static final long DEFAULT_WINDOW_MS = 60_000;

    private final long windowSizeMs;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    public DispatchWindow() {
        this(DEFAULT_WINDOW_MS);
    }

    public DispatchWindow(long windowSizeMs) {
        if (windowSizeMs <= 0) {
            throw new IllegalArgumentException("Window size must be positive");
        }
        this.windowSizeMs = windowSizeMs;
    }

    /**
     * Whether another dispatch fits under the limit right now.
     */
    public boolean hasCapacity(int limit) {
        return count() < limit;
    }

    /**
     * Record a dispatch at the current time.
     */
    public void record() {
        long now = System.currentTimeMillis();
        evictExpired(now);
        timestamps.addLast(now);
    }

    /**
     * Dispatches within the trailing window.
     */
    public int count() {
        evictExpired(System.currentTimeMillis());
        return timestamps.size();
    }

    public void clear() {
        timestamps.clear();
    }

    public long getWindowSizeMs() {
        return windowSizeMs;
    }

    private void evictExpired(long now) {
        long windowStart = now - windowSizeMs;
        Long head;
        while ((head = timestamps.peekFirst()) != null && head <= windowStart) {
            timestamps.pollFirst();
        }
    }
}
