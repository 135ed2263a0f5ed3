package com.phillippitts.poseidon.config;

import com.phillippitts.poseidon.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind the extraction fan-out and the session timers.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected concurrent conversations.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded thread pool for parallel backend extraction.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.extraction.*} properties:
     * <ul>
     *   <li>Core pool: default 6 - two concurrent reconciliations of three backends</li>
     *   <li>Max pool: default 12 - handles bursts</li>
     *   <li>Queue: default 60 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}
     * When the pool and queue are full the submission is refused and the fan-out records the
     * backend as unavailable. Running it on the request thread would serialize the backends and
     * escape their deadlines.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the request thread to the worker
     * thread so backend logs carry requestId and conversationId.
     *
     * @return Configured executor for backend extraction
     */
    @Bean(name = "extractionExecutor")
    public Executor extractionExecutor() {
        ThreadPoolProperties.ExtractionPoolProperties props = threadPoolProperties.getExtraction();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Creates the scheduler running session expiry timers.
     *
     * <p>Timers only flip in-memory state, so the pool is small. The scheduler shares the
     * application {@link Clock} so "expires at" instants computed by the session controller
     * and the scheduler agree.
     *
     * @param clock application clock
     * @return Configured scheduler for session timers
     */
    @Bean(name = "sessionScheduler")
    public TaskScheduler sessionScheduler(Clock clock) {
        ThreadPoolProperties.SchedulerPoolProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setClock(clock);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    static TaskDecorator mdcPropagating() {
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
