package com.phillippitts.tastemodel.config;

import com.phillippitts.tastemodel.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pools used by the retrain pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private static final int TRAINING_SHUTDOWN_SECONDS = 30;

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor that runs retrain jobs off the decision worker and off request threads.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. The coordinator admits at
     * most one run at a time, so a rejection means the pool is misconfigured and must surface
     * as a failed run instead of executing on the caller's thread.
     *
     * <p>Shutdown waits for an in-flight training run; runs are never force-killed.
     *
     * @return Configured executor for training runs
     */
    @Bean(name = "trainingExecutor")
    public Executor trainingExecutor() {
        return newExecutor(threadPoolProperties.getTraining(), true);
    }

    /**
     * Executor for serving probes. A hung probe occupies one thread here while the health
     * loop moves on after the probe timeout.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; a rejected probe is
     * recorded as a failed probe by the health monitor.
     *
     * @return Configured executor for health probes
     */
    @Bean(name = "probeExecutor")
    public Executor probeExecutor() {
        return newExecutor(threadPoolProperties.getProbe(), false);
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props,
                                                      boolean waitOnShutdown) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(waitOnShutdown);
        if (waitOnShutdown) {
            executor.setAwaitTerminationSeconds(TRAINING_SHUTDOWN_SECONDS);
        }
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext (MDC) of the submitting thread onto the worker thread
     * so modelType/runId/requestId survive the hop.
     */
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
