package com.phillippitts.voicetutor.config;

import com.phillippitts.voicetutor.config.properties.CircuitBreakerProperties;
import com.phillippitts.voicetutor.config.properties.SemanticCacheProperties;
import com.phillippitts.voicetutor.config.properties.ThreadPoolProperties;
import com.phillippitts.voicetutor.service.cache.SemanticCache;
import com.phillippitts.voicetutor.service.queue.UserQueueManager;
import com.phillippitts.voicetutor.service.resilience.CircuitBreaker;
import com.phillippitts.voicetutor.service.resilience.CircuitState;
import com.phillippitts.voicetutor.testutil.EventCapturingPublisher;
import com.phillippitts.voicetutor.testutil.SyncExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.mock;

class OrchestrationMetricsConfigTest {

    private ThreadPoolTaskExecutor queueExecutor;
    private UserQueueManager queueManager;
    private OrchestrationMetricsConfig config;

    @BeforeEach
    void setUp() {
        EventCapturingPublisher publisher = new EventCapturingPublisher();
        queueExecutor = new ThreadPoolConfig(new ThreadPoolProperties()).queueExecutor();
        queueManager = new UserQueueManager(new SyncExecutor(), publisher);
        SemanticCache cache = new SemanticCache(new SemanticCacheProperties());
        CircuitBreaker circuitBreaker = new CircuitBreaker(new CircuitBreakerProperties(), new SyncExecutor(),
                mock(TaskScheduler.class), publisher);
        config = new OrchestrationMetricsConfig(queueManager, cache, circuitBreaker, queueExecutor);
    }

    @AfterEach
    void tearDown() {
        queueExecutor.shutdown();
    }

    @Test
    void registersOrchestrationGauges() {
        MeterRegistry registry = new SimpleMeterRegistry();

        config.orchestrationMetrics().bindTo(registry);

        assertThat(registry.find("voicetutor.queue.sessions").gauge()).isNotNull();
        assertThat(registry.find("voicetutor.queue.depth.total").gauge()).isNotNull();
        assertThat(registry.find("voicetutor.queue.depth.max").gauge()).isNotNull();
        assertThat(registry.find("voicetutor.queue.pool.active").gauge()).isNotNull();
        assertThat(registry.find("voicetutor.queue.pool.queued").gauge()).isNotNull();
        assertThat(registry.find("voicetutor.cache.size").gauge()).isNotNull();
        assertThat(registry.find("voicetutor.cache.hit.rate").gauge()).isNotNull();
        assertThat(registry.find("voicetutor.circuit.state").tag("circuit", "generation").gauge().value())
                .isEqualTo(0.0);
        assertThat(registry.find("voicetutor.circuit.failure.rate").gauge()).isNotNull();
    }

    @Test
    void sessionGaugeTracksQueues() {
        MeterRegistry registry = new SimpleMeterRegistry();
        config.orchestrationMetrics().bindTo(registry);

        queueManager.getQueue("s1");
        queueManager.getQueue("s2");

        assertThat(registry.find("voicetutor.queue.sessions").gauge().value()).isEqualTo(2.0);
    }

    @Test
    void mapsCircuitStatesToGaugeValues() {
        assertThat(OrchestrationMetricsConfig.stateValue(CircuitState.CLOSED)).isEqualTo(0.0);
        assertThat(OrchestrationMetricsConfig.stateValue(CircuitState.HALF_OPEN)).isEqualTo(1.0);
        assertThat(OrchestrationMetricsConfig.stateValue(CircuitState.OPEN)).isEqualTo(2.0);
    }

    @Test
    void healthSummaryLogsWithoutError() {
        assertThatCode(config::logOrchestrationHealth).doesNotThrowAnyException();
    }
}
