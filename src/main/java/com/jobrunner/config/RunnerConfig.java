package com.jobrunner.config;

/**
 * Root configuration for the job runner.
 * Loaded once at startup; never mutated while the process runs.
 *
 * @param name       Runner name, used in logs and thread names
 * @param limits     Server-side security limits
 * @param analyzer   Job analyzer thresholds and sources
 * @param health     Health sampling and adaptive concurrency
 * @param isolation  Child process settings
 * @param shutdown   Graceful shutdown settings
 * @param worker     Queue worker settings
 */
public record RunnerConfig(
        String name,
        SecurityLimits limits,
        AnalyzerConfig analyzer,
        HealthConfig health,
        IsolationConfig isolation,
        ShutdownConfig shutdown,
        WorkerConfig worker
) {
    public static RunnerConfig defaults() {
        return new RunnerConfig(
                "jobrunner",
                SecurityLimits.defaults(),
                AnalyzerConfig.defaults(),
                HealthConfig.defaults(),
                IsolationConfig.defaults(),
                ShutdownConfig.defaults(),
                WorkerConfig.defaults()
        );
    }

    public RunnerConfig withLimits(SecurityLimits limits) {
        return new RunnerConfig(name, limits, analyzer, health, isolation, shutdown, worker);
    }

    public RunnerConfig withAnalyzer(AnalyzerConfig analyzer) {
        return new RunnerConfig(name, limits, analyzer, health, isolation, shutdown, worker);
    }

    public RunnerConfig withHealth(HealthConfig health) {
        return new RunnerConfig(name, limits, analyzer, health, isolation, shutdown, worker);
    }

    public RunnerConfig withIsolation(IsolationConfig isolation) {
        return new RunnerConfig(name, limits, analyzer, health, isolation, shutdown, worker);
    }

    public RunnerConfig withShutdown(ShutdownConfig shutdown) {
        return new RunnerConfig(name, limits, analyzer, health, isolation, shutdown, worker);
    }

    public RunnerConfig withWorker(WorkerConfig worker) {
        return new RunnerConfig(name, limits, analyzer, health, isolation, shutdown, worker);
    }

    /**
     * Validate every section.
     */
    public void validate() {
        limits.validate();
        analyzer.validate();
        health.validate();
    }
}
