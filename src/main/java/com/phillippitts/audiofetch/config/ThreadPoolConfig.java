package com.phillippitts.audiofetch.config;

import com.phillippitts.audiofetch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used in asynchronous processing.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for batch acquisitions.
     *
     * <p>Pool sizing configured via {@code threadpool.acquisition.*}:
     * <ul>
     *   <li>Core/max pool: default 4 - one thread per concurrent download</li>
     *   <li>Queue: default 100 tasks - a large playlist waits here instead of spawning threads</li>
     * </ul>
     *
     * <p>The batch coordinator applies its own per-batch concurrency limit on top of this pool.
     *
     * <p>Rejection policy: {@link CallerRunsUnlessShutdown}. A saturated pool runs the task on the
     * submitting thread for backpressure; a shut-down pool throws so callers can fail the work.
     *
     * @return Configured executor for acquisitions
     */
    @Bean(name = "acquisitionExecutor")
    public Executor acquisitionExecutor() {
        return buildExecutor(threadPoolProperties.getAcquisition());
    }

    /**
     * Executor that runs single-track jobs end to end (search, download, post-processing).
     *
     * <p>Pool sizing configured via {@code threadpool.job.*}: core 2, max 4, queue 50 by default.
     *
     * @return Configured executor for download jobs
     */
    @Bean(name = "jobExecutor")
    public Executor jobExecutor() {
        return buildExecutor(threadPoolProperties.getJob());
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new CallerRunsUnlessShutdown());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext (MDC) of the submitting thread to the worker thread so
     * {@code jobId} survives the hand-off, and restores the worker's own context afterwards.
     */
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

    /**
     * Like {@link ThreadPoolExecutor.CallerRunsPolicy}, except that a task rejected by a shut-down
     * pool raises {@link RejectedExecutionException} instead of being dropped silently.
     */
    static final class CallerRunsUnlessShutdown implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                throw new RejectedExecutionException("Executor has been shut down");
            }
            task.run();
        }
    }
}
