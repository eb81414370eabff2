package com.jobrunner.config;

import com.jobrunner.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads runner configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded and validated configuration
     */
    public static RunnerConfig load(String path) {
        log.info("Loading runner configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static RunnerConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The runner section may be at root or under 'jobrunner'
        Map<String, Object> runner = root.containsKey("jobrunner")
                ? (Map<String, Object>) root.get("jobrunner")
                : root;

        RunnerConfig defaults = RunnerConfig.defaults();
        String name = getString(runner, "name", defaults.name());

        try {
            RunnerConfig config = new RunnerConfig(
                    name,
                    parseLimits(section(runner, "limits"), defaults.limits()),
                    parseAnalyzer(section(runner, "analyzer"), defaults.analyzer()),
                    parseHealth(section(runner, "health"), defaults.health()),
                    parseIsolation(section(runner, "isolation"), defaults.isolation()),
                    parseShutdown(section(runner, "shutdown"), defaults.shutdown()),
                    parseWorker(section(runner, "worker"), defaults.worker())
            );
            config.validate();

            log.info("Loaded runner configuration: {} (max timeout {}s, max memory {}MB, {} jobs/min, thresholds {}s/{}s)",
                    name,
                    config.limits().maxTimeoutSeconds(),
                    config.limits().maxMemoryMb(),
                    config.limits().maxJobsPerMinute(),
                    config.analyzer().inlineThresholdSeconds(),
                    config.analyzer().pooledThresholdSeconds());

            return config;
        } catch (NumberFormatException | ClassCastException e) {
            throw new ConfigurationException("Invalid value in configuration: " + e.getMessage(), e);
        }
    }

    private static SecurityLimits parseLimits(Map<String, Object> map, SecurityLimits d) {
        if (map == null) {
            return d;
        }
        return new SecurityLimits(
                getInt(map, "max-timeout-seconds", d.maxTimeoutSeconds()),
                getInt(map, "max-memory-mb", d.maxMemoryMb()),
                getInt(map, "max-concurrent-jobs", d.maxConcurrentJobs()),
                getInt(map, "max-jobs-per-minute", d.maxJobsPerMinute()),
                getStringList(map, "allowed-job-paths", d.allowedJobPaths()),
                getBoolean(map, "isolated-by-default", d.isolatedByDefault()),
                getBoolean(map, "strict-mode", d.strictMode())
        );
    }

    @SuppressWarnings("unchecked")
    private static AnalyzerConfig parseAnalyzer(Map<String, Object> map, AnalyzerConfig d) {
        if (map == null) {
            return d;
        }

        List<PatternConfig> patterns = new ArrayList<>();
        List<Map<String, Object>> patternList = (List<Map<String, Object>>) map.get("patterns");
        if (patternList != null) {
            for (int i = 0; i < patternList.size(); i++) {
                Map<String, Object> p = patternList.get(i);
                String regex = getString(p, "regex", null);
                if (regex == null || regex.isBlank()) {
                    throw new ConfigurationException("Analyzer pattern " + i + " has no regex");
                }
                patterns.add(new PatternConfig(
                        getString(p, "name", "custom-" + i),
                        regex,
                        getInt(p, "weight", PatternConfig.DEFAULT_WEIGHT)));
            }
        }

        return new AnalyzerConfig(
                getDouble(map, "inline-threshold", d.inlineThresholdSeconds()),
                getDouble(map, "pooled-threshold", d.pooledThresholdSeconds()),
                getInt(map, "min-executions", d.minExecutions()),
                getLong(map, "stats-ttl-seconds", d.statsTtlSeconds()),
                getStringList(map, "source-roots", d.sourceRoots()),
                patterns
        );
    }

    private static HealthConfig parseHealth(Map<String, Object> map, HealthConfig d) {
        if (map == null) {
            return d;
        }
        return new HealthConfig(
                getInt(map, "memory-limit-mb", d.memoryLimitMb()),
                getLong(map, "memory-check-interval-ms", d.memoryCheckIntervalMs()),
                getLong(map, "health-check-interval-ms", d.healthCheckIntervalMs()),
                getDouble(map, "max-cpu-load", d.maxCpuLoad()),
                getDouble(map, "max-memory-percent", d.maxMemoryPercent()),
                getInt(map, "initial-concurrency", d.initialConcurrency()),
                getInt(map, "min-concurrency", d.minConcurrency()),
                getInt(map, "max-concurrency", d.maxConcurrency()),
                getDouble(map, "shrink-factor", d.shrinkFactor()),
                getInt(map, "grow-step", d.growStep()),
                getBoolean(map, "adaptive", d.adaptive())
        );
    }

    private static IsolationConfig parseIsolation(Map<String, Object> map, IsolationConfig d) {
        if (map == null) {
            return d;
        }
        return new IsolationConfig(
                getString(map, "java-command", d.javaCommand()),
                getString(map, "classpath", d.classpath()),
                getStringList(map, "jvm-options", d.jvmOptions()),
                getInt(map, "stderr-limit", d.stderrLimit()),
                getString(map, "temp-directory", d.tempDirectory())
        );
    }

    private static ShutdownConfig parseShutdown(Map<String, Object> map, ShutdownConfig d) {
        if (map == null) {
            return d;
        }
        return new ShutdownConfig(
                getLong(map, "drain-timeout-ms", d.drainTimeoutMs()),
                getLong(map, "drain-check-interval-ms", d.drainCheckIntervalMs())
        );
    }

    private static WorkerConfig parseWorker(Map<String, Object> map, WorkerConfig d) {
        if (map == null) {
            return d;
        }
        return new WorkerConfig(
                getLong(map, "poll-interval-ms", d.pollIntervalMs()),
                getLong(map, "reject-backoff-ms", d.rejectBackoffMs()),
                getInt(map, "max-jobs", d.maxJobs()),
                getLong(map, "max-time-seconds", d.maxTimeSeconds())
        );
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Section '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        return Double.parseDouble(value.toString());
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        return List.of(value.toString());
    }
}
