package com.phillippitts.catalogintel.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes record and stage pool gauges via Micrometer:
 * {@code catalog.<pool>.pool.size}, {@code .active}, {@code .queued}, {@code .completed},
 * {@code .max.size}, where pool is {@code record} or {@code stage}.
 *
 * <p>Also logs a pool health summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> recordExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> stageExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("recordExecutor") ObjectProvider<ThreadPoolTaskExecutor> recordExecutorProvider,
            @Qualifier("stageExecutor") ObjectProvider<ThreadPoolTaskExecutor> stageExecutorProvider) {
        this.recordExecutorProvider = recordExecutorProvider;
        this.stageExecutorProvider = stageExecutorProvider;
    }

    @Bean
    public MeterBinder pipelineExecutorMetrics() {
        return registry -> {
            bind(registry, "record", recordExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "stage", stageExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: catalog.record.pool.* and catalog.stage.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        logHealth("Record", recordExecutorProvider.getObject().getThreadPoolExecutor());
        logHealth("Stage", stageExecutorProvider.getObject().getThreadPoolExecutor());
    }

    static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        String prefix = "catalog." + pool + ".pool";
        Gauge.builder(prefix + ".size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the " + pool + " pool")
                .register(registry);
        Gauge.builder(prefix + ".active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Threads actively running " + pool + " tasks")
                .register(registry);
        Gauge.builder(prefix + ".queued", executor, e -> e.getQueue().size())
                .description("Tasks waiting in the " + pool + " queue")
                .register(registry);
        Gauge.builder(prefix + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed " + pool + " tasks")
                .register(registry);
        Gauge.builder(prefix + ".max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum size of the " + pool + " pool")
                .register(registry);
    }

    private static void logHealth(String pool, ThreadPoolExecutor executor) {
        LOG.info("{} Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                pool,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
