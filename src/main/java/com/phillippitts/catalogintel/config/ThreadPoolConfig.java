package com.phillippitts.catalogintel.config;

import com.phillippitts.catalogintel.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors for batch record workers, stage calls and sink offload.
 *
 * <p>The record and event pools use {@link ThreadPoolExecutor.CallerRunsPolicy}: when a pool
 * and its queue are full the submitting thread runs the task. The stage pool uses
 * {@link ThreadPoolExecutor.AbortPolicy} so a saturated pool fails the stage instead of
 * running it on the record worker outside the deadline wait. Every pool copies the submitter's Log4j2 {@link ThreadContext} into the worker so
 * request, batch and product ids appear in async logs.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs one record's pipeline per task. Its max size bounds batch concurrency.
     */
    @Bean(name = "recordExecutor")
    public ThreadPoolTaskExecutor recordExecutor() {
        return build(threadPoolProperties.getRecord(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Runs ingest, enrich and vision calls so an overdue call can be cancelled
     * without blocking the record worker past its deadline.
     */
    @Bean(name = "stageExecutor")
    public ThreadPoolTaskExecutor stageExecutor() {
        return build(threadPoolProperties.getStage(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Offloads sink delivery from the request thread.
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        return build(threadPoolProperties.getEvent(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagation() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
