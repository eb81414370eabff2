package com.jobrunner.runtime;

import com.jobrunner.config.HealthConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adjusts the in-flight job ceiling from health samples.
 *
 * <p>Stressed (load or memory above its maximum): the ceiling shrinks by the shrink
 * factor, never below the floor. Healthy (both below half their maximum) while at
 * least 80% of the ceiling is in use: the ceiling grows by the grow step, never
 * above the cap. Otherwise it stays put. Only the event loop adjusts; any thread
 * may read.
 */
public class ConcurrencyGovernor {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyGovernor.class);

    static final double BUSY_FRACTION = 0.8;

    private final HealthConfig config;
    private final AtomicInteger ceiling;

    public ConcurrencyGovernor(HealthConfig config) {
        config.validate();
        this.config = config;
        this.ceiling = new AtomicInteger(config.initialConcurrency());
    }

    public int getCeiling() {
        return ceiling.get();
    }

    public int getFloor() {
        return config.minConcurrency();
    }

    public int getCap() {
        return config.maxConcurrency();
    }

    public boolean isStressed(HealthSample sample) {
        return sample.cpuLoad() > config.maxCpuLoad()
                || sample.memoryPercent() > config.maxMemoryPercent();
    }

    public boolean isHealthy(HealthSample sample) {
        return sample.cpuLoad() < config.maxCpuLoad() * 0.5
                && sample.memoryPercent() < config.maxMemoryPercent() * 0.5;
    }

    /**
     * Apply one sample.
     *
     * @return the ceiling after adjustment
     */
    public int adjust(HealthSample sample) {
        int current = ceiling.get();
        if (!config.adaptive()) {
            return current;
        }

        int next = current;
        if (isStressed(sample)) {
            next = Math.max(config.minConcurrency(), (int) (current * config.shrinkFactor()));
            if (next != current) {
                log.warn("System stressed (load {}, memory {}), reducing concurrent limit: {} -> {}",
                        round(sample.cpuLoad()), round(sample.memoryPercent()), current, next);
            }
        } else if (isHealthy(sample) && sample.runningJobs() >= current * BUSY_FRACTION) {
            next = Math.min(config.maxConcurrency(), current + config.growStep());
            if (next != current) {
                log.info("System healthy, increasing concurrent limit: {} -> {}", current, next);
            }
        }
        ceiling.set(next);
        return next;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
