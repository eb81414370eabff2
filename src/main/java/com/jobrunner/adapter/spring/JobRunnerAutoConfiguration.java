package com.jobrunner.adapter.spring;

import com.jobrunner.analysis.JobAnalyzer;
import com.jobrunner.config.ConfigLoader;
import com.jobrunner.config.RunnerConfig;
import com.jobrunner.runtime.EventLoop;
import com.jobrunner.runtime.JobRuntime;
import com.jobrunner.stats.InMemoryStatisticsStore;
import com.jobrunner.stats.JsonFileStatisticsStore;
import com.jobrunner.stats.StatisticsStore;
import com.jobrunner.strategy.AnalyzingStrategySelector;
import com.jobrunner.strategy.InlineStrategy;
import com.jobrunner.strategy.IsolatedStrategy;
import com.jobrunner.strategy.StrategySelector;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Spring Boot auto-configuration for the job runner.
 * The runtime owns the loop and strategies and tears them down itself on context close.
 */
@Configuration
@ConditionalOnProperty(prefix = "jobrunner", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(JobRunnerProperties.class)
public class JobRunnerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(JobRunnerAutoConfiguration.class);

    private JobRuntime jobRuntime;

    @Bean
    @ConditionalOnMissingBean
    public RunnerConfig runnerConfig(JobRunnerProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public StatisticsStore statisticsStore(JobRunnerProperties properties) {
        if (properties.getStatsFile() != null && !properties.getStatsFile().isBlank()) {
            return new JsonFileStatisticsStore(Path.of(properties.getStatsFile()));
        }
        return new InMemoryStatisticsStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobAnalyzer jobAnalyzer(RunnerConfig config, StatisticsStore store) {
        return new JobAnalyzer(config.analyzer(), store);
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public EventLoop jobRunnerEventLoop(RunnerConfig config) {
        return new EventLoop(config.name());
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public InlineStrategy inlineStrategy(RunnerConfig config) {
        return new InlineStrategy(config.health().memoryLimitMb());
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public IsolatedStrategy isolatedStrategy(EventLoop loop, RunnerConfig config) {
        return new IsolatedStrategy(loop, config.limits(), config.isolation());
    }

    @Bean
    @ConditionalOnMissingBean
    public StrategySelector strategySelector(JobAnalyzer analyzer, InlineStrategy inline, IsolatedStrategy isolated) {
        return AnalyzingStrategySelector.standard(analyzer, inline, isolated);
    }

    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public JobRuntime jobRuntime(RunnerConfig config, StrategySelector selector, JobAnalyzer analyzer,
                                 EventLoop loop, JobRunnerProperties properties) {
        log.info("Creating JobRuntime: {}", config.name());
        this.jobRuntime = new JobRuntime(config, selector, analyzer, loop);
        this.jobRuntime.start();
        if (properties.isShutdownHook()) {
            this.jobRuntime.installShutdownHook();
        }
        return this.jobRuntime;
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        if (jobRuntime != null && !jobRuntime.isTerminated()) {
            log.info("Shutting down JobRuntime");
            jobRuntime.shutdown();
            long waitMs = jobRuntime.getConfig().shutdown().drainTimeoutMs() + 1_000;
            if (!jobRuntime.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("JobRuntime did not stop within {}ms", waitMs);
            }
        }
    }
}
