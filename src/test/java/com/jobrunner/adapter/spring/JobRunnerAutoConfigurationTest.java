package com.jobrunner.adapter.spring;

import com.jobrunner.analysis.JobAnalyzer;
import com.jobrunner.config.RunnerConfig;
import com.jobrunner.core.IsolationHint;
import com.jobrunner.fixtures.SendEmailJob;
import com.jobrunner.runtime.JobRuntime;
import com.jobrunner.spring.EnableJobRunner;
import com.jobrunner.stats.JsonFileStatisticsStore;
import com.jobrunner.stats.StatisticsStore;
import com.jobrunner.strategy.AnalyzingStrategySelector;
import com.jobrunner.strategy.StrategySelector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JobRunnerAutoConfiguration.
 */
class JobRunnerAutoConfigurationTest {

    @Configuration
    @EnableJobRunner
    static class TestApplication {
    }

    @Test
    @DisplayName("Should wire a started runtime from the configured file")
    void shouldWireRuntime() throws Exception {
        JobRuntime runtime;
        try (ConfigurableApplicationContext context = start("jobrunner.config-path=classpath:jobrunner-test.yaml")) {
            runtime = context.getBean(JobRuntime.class);
            RunnerConfig config = context.getBean(RunnerConfig.class);

            assertEquals("test-runner", config.name());
            assertSame(config, runtime.getConfig());
            assertSame(context.getBean(JobAnalyzer.class), runtime.getAnalyzer());
            assertInstanceOf(AnalyzingStrategySelector.class, context.getBean(StrategySelector.class));

            SendEmailJob job = new SendEmailJob();
            job.setIsolation(IsolationHint.INLINE);
            runtime.executeJob(job).get(5, TimeUnit.SECONDS);
            assertEquals(1, runtime.getStats().processedJobs());
        }

        assertTrue(runtime.isTerminated());
    }

    @Test
    @DisplayName("Should use the file store when a statistics file is set")
    void shouldUseFileStore(@TempDir Path dir) {
        Path statsFile = dir.resolve("stats.json");
        try (ConfigurableApplicationContext context = start("jobrunner.stats-file=" + statsFile)) {
            StatisticsStore store = context.getBean(StatisticsStore.class);

            assertInstanceOf(JsonFileStatisticsStore.class, store);
            assertEquals(statsFile, ((JsonFileStatisticsStore) store).getFile());
        }
    }

    @Test
    @DisplayName("Should create nothing when disabled")
    void shouldBackOffWhenDisabled() {
        try (ConfigurableApplicationContext context = start("jobrunner.enabled=false")) {
            assertTrue(context.getBeansOfType(JobRuntime.class).isEmpty());
        }
    }

    private static ConfigurableApplicationContext start(String... properties) {
        return new SpringApplicationBuilder(TestApplication.class)
                .web(WebApplicationType.NONE)
                .properties(properties)
                .run();
    }
}
