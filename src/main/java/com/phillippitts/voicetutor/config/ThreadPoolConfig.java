package com.phillippitts.voicetutor.config;

import com.phillippitts.voicetutor.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors used by turn orchestration.
 *
 * <ul>
 *   <li>{@code queueExecutor} drains the per-session turn queues</li>
 *   <li>{@code backendExecutor} runs single generation attempts so the circuit breaker can time them out</li>
 *   <li>{@code circuitScheduler} fires the OPEN to HALF_OPEN cooldown</li>
 * </ul>
 *
 * <p>Both executors copy the Log4j2 ThreadContext of the submitting thread so that the
 * {@code sessionId} stays attached to async log lines.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for queued turn work.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and its queue
     * are full the thread completing the previous turn runs the next one, which applies backpressure
     * without dropping turns.
     *
     * @return configured executor for per-session queues
     */
    @Bean(name = "queueExecutor")
    public ThreadPoolTaskExecutor queueExecutor() {
        return buildExecutor(threadPoolProperties.getQueue(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Executor for individual backend attempts. Sized independently of the queue pool because queue
     * workers block while an attempt runs here.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A saturated pool must fail the
     * attempt instead of running it on the waiting thread, where its timeout could not apply.
     *
     * @return configured executor for generation attempts
     */
    @Bean(name = "backendExecutor")
    public ThreadPoolTaskExecutor backendExecutor() {
        return buildExecutor(threadPoolProperties.getBackend(), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "circuitScheduler")
    public ThreadPoolTaskScheduler circuitScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threadPoolProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("circuit-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
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
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

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
