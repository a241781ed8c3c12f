package com.phillippitts.voicetutor.config;

import com.phillippitts.voicetutor.service.cache.SemanticCache;
import com.phillippitts.voicetutor.service.queue.UserQueueManager;
import com.phillippitts.voicetutor.service.resilience.CircuitBreaker;
import com.phillippitts.voicetutor.service.resilience.CircuitBreakerMetrics;
import com.phillippitts.voicetutor.service.resilience.CircuitState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes orchestration state via Micrometer gauges.
 *
 * <ul>
 *   <li>voicetutor.queue.sessions / depth.total / depth.max - session queues</li>
 *   <li>voicetutor.queue.pool.active / pool.queued - queue executor</li>
 *   <li>voicetutor.cache.size / hit.rate - semantic cache</li>
 *   <li>voicetutor.circuit.state (0 closed, 1 half-open, 2 open) / failure.rate - circuit breaker</li>
 * </ul>
 *
 * <p>Also logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class OrchestrationMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(OrchestrationMetricsConfig.class);

    private final UserQueueManager queueManager;
    private final SemanticCache cache;
    private final CircuitBreaker circuitBreaker;
    private final ThreadPoolTaskExecutor queueExecutor;

    public OrchestrationMetricsConfig(UserQueueManager queueManager,
                                      SemanticCache cache,
                                      CircuitBreaker circuitBreaker,
                                      @Qualifier("queueExecutor") ThreadPoolTaskExecutor queueExecutor) {
        this.queueManager = queueManager;
        this.cache = cache;
        this.circuitBreaker = circuitBreaker;
        this.queueExecutor = queueExecutor;
    }

    /**
     * Binds orchestration gauges to the Micrometer registry.
     *
     * @return MeterBinder that registers the gauges
     */
    @Bean
    public MeterBinder orchestrationMetrics() {
        return registry -> {
            Gauge.builder("voicetutor.queue.sessions", queueManager, UserQueueManager::activeSessions)
                    .description("Sessions with a registered turn queue")
                    .register(registry);
            Gauge.builder("voicetutor.queue.depth.total", queueManager, m -> m.getGlobalMetrics().totalQueueDepth())
                    .description("Pending turns across all sessions")
                    .register(registry);
            Gauge.builder("voicetutor.queue.depth.max", queueManager, m -> m.getGlobalMetrics().maxQueueDepth())
                    .description("Deepest session queue")
                    .register(registry);

            ThreadPoolExecutor executor = queueExecutor.getThreadPoolExecutor();
            Gauge.builder("voicetutor.queue.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Queue workers currently running a turn")
                    .register(registry);
            Gauge.builder("voicetutor.queue.pool.queued", executor, e -> e.getQueue().size())
                    .description("Turns waiting for a queue worker")
                    .register(registry);

            Gauge.builder("voicetutor.cache.size", cache, c -> c.getMetrics().totalEntries())
                    .description("Entries in the semantic cache")
                    .register(registry);
            Gauge.builder("voicetutor.cache.hit.rate", cache, c -> c.getMetrics().hitRate())
                    .description("Semantic cache hit rate in percent")
                    .register(registry);

            Gauge.builder("voicetutor.circuit.state", circuitBreaker, cb -> stateValue(cb.getState()))
                    .description("Circuit state: 0 closed, 1 half-open, 2 open")
                    .tag("circuit", circuitBreaker.getName())
                    .register(registry);
            Gauge.builder("voicetutor.circuit.failure.rate", circuitBreaker, cb -> cb.getMetrics().failureRate())
                    .description("Circuit failure rate in percent")
                    .tag("circuit", circuitBreaker.getName())
                    .register(registry);

            LOG.info("Orchestration metrics registered: voicetutor.* available via /actuator/metrics");
        };
    }

    /**
     * Logs an orchestration health summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logOrchestrationHealth() {
        CircuitBreakerMetrics circuit = circuitBreaker.getMetrics();
        LOG.info("Orchestration health: sessions={}, pendingTurns={}, cacheEntries={}, circuit={} "
                        + "(requests={}, failures={}, rejected={})",
                queueManager.activeSessions(),
                queueManager.getGlobalMetrics().totalQueueDepth(),
                cache.getMetrics().totalEntries(),
                circuit.state(),
                circuit.requests(),
                circuit.failures(),
                circuit.rejected());
    }

    static double stateValue(CircuitState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }
}
