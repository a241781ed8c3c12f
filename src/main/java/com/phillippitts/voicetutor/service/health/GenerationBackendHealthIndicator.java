package com.phillippitts.voicetutor.service.health;

import com.phillippitts.voicetutor.service.orchestration.GenerationBackend;
import com.phillippitts.voicetutor.service.resilience.CircuitBreaker;
import com.phillippitts.voicetutor.service.resilience.CircuitBreakerMetrics;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the generation backend, derived from its circuit breaker.
 *
 * <ul>
 *   <li>UP: circuit CLOSED</li>
 *   <li>DEGRADED: circuit HALF_OPEN, recovery being probed</li>
 *   <li>DOWN: circuit OPEN, turns answered locally</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class GenerationBackendHealthIndicator implements HealthIndicator {

    private final CircuitBreaker circuitBreaker;
    private final GenerationBackend backend;

    public GenerationBackendHealthIndicator(CircuitBreaker circuitBreaker, GenerationBackend backend) {
        this.circuitBreaker = circuitBreaker;
        this.backend = backend;
    }

    @Override
    public Health health() {
        CircuitBreakerMetrics metrics = circuitBreaker.getMetrics();

        Health.Builder builder = switch (metrics.state()) {
            case CLOSED -> Health.up().withDetail("status", "Backend operational");
            case HALF_OPEN -> Health.status("DEGRADED").withDetail("status", "Probing backend recovery");
            case OPEN -> Health.down().withDetail("status", "Backend unavailable - using local fallbacks");
        };

        return builder
                .withDetail("backend", backend.getName())
                .withDetail("circuit", metrics.name())
                .withDetail("requests", metrics.requests())
                .withDetail("failures", metrics.failures())
                .withDetail("rejected", metrics.rejected())
                .withDetail("failureRate", metrics.failureRate())
                .build();
    }
}
