package com.phillippitts.interviewcopilot.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Publishes the session and generation pools as Micrometer gauges tagged {@code pool=session} or
 * {@code pool=generation}: {@code copilot.pool.size}, {@code copilot.pool.active},
 * {@code copilot.pool.queued} and {@code copilot.pool.completed}.
 *
 * <p>A growing {@code copilot.pool.queued{pool=generation}} means answers are arriving slower than
 * questions. Scrape via {@code /actuator/prometheus}; a summary is also logged every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final Map<String, ObjectProvider<ThreadPoolTaskExecutor>> pools = new LinkedHashMap<>();

    public ThreadPoolMetricsConfig(
            @Qualifier("sessionExecutor") ObjectProvider<ThreadPoolTaskExecutor> sessionExecutorProvider,
            @Qualifier("generationExecutor") ObjectProvider<ThreadPoolTaskExecutor> generationExecutorProvider) {
        pools.put("session", sessionExecutorProvider);
        pools.put("generation", generationExecutorProvider);
    }

    @Bean
    public MeterBinder copilotPoolMetrics() {
        return registry -> {
            pools.forEach((name, provider) -> bind(registry, name, provider.getObject().getThreadPoolExecutor()));
            LOG.info("Pool gauges registered for {}", pools.keySet());
        };
    }

    static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Tags tags = Tags.of("pool", pool);
        Gauge.builder("copilot.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .tags(tags).description("Current thread count").register(registry);
        Gauge.builder("copilot.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .tags(tags).description("Threads running a task").register(registry);
        Gauge.builder("copilot.pool.queued", executor, e -> e.getQueue().size())
                .tags(tags).description("Tasks waiting for a thread").register(registry);
        Gauge.builder("copilot.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .tags(tags).description("Tasks completed since startup").register(registry);
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        pools.forEach((name, provider) -> {
            ThreadPoolExecutor executor = provider.getObject().getThreadPoolExecutor();
            LOG.info("Pool {}: threads={}/{}, active={}, queued={}, completed={}",
                    name,
                    executor.getPoolSize(),
                    executor.getMaximumPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size(),
                    executor.getCompletedTaskCount());
        });
    }
}
