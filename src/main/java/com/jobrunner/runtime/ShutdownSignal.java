package com.jobrunner.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation token. Triggering it notifies every registered callback once.
 */
public class ShutdownSignal {

    private static final Logger log = LoggerFactory.getLogger(ShutdownSignal.class);

    private final AtomicBoolean triggered = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean isTriggered() {
        return triggered.get();
    }

    /**
     * Register a callback; runs immediately if the token already fired.
     */
    public void onTrigger(Runnable callback) {
        callbacks.add(callback);
        if (triggered.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    public void trigger(String reason) {
        if (!triggered.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutdown requested: {}", reason);
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    log.error("Shutdown callback failed: {}", e.getMessage());
                }
            }
        }
    }
}
