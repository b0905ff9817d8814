package com.phillippitts.interviewcopilot.config;

import com.phillippitts.interviewcopilot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind live sessions.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and the expected number of sessions.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Shared pool that drains every session's ordered queue.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.session.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - handles typical concurrent sessions</li>
     *   <li>Max pool: default 16 - absorbs bursts of audio frames</li>
     *   <li>Queue: default 500 drain passes</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the WebSocket thread drains the queue itself, which pushes back on the socket
     * instead of dropping frames. Ordering is unaffected because each session queue has at most
     * one drain pass in flight.
     *
     * @return executor for session queues
     */
    @Bean(name = "sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        return build(threadPoolProperties.getSession(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Pool that runs answer generation.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running a model call on the
     * session thread would stall audio ingestion and bypass the generation timeout, so a full
     * pool surfaces as a {@code GENERATION_FAILED} error the user can retry.
     *
     * @return executor for answer generation
     */
    @Bean(name = "generationExecutor")
    public ThreadPoolTaskExecutor generationExecutor() {
        return build(threadPoolProperties.getGeneration(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejectionHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionHandler);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread so
     * session and user correlation ids survive the hop, and restores the worker's own context
     * afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
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
