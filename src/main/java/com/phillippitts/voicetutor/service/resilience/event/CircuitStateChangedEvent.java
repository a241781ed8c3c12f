package com.phillippitts.voicetutor.service.resilience.event;

import com.phillippitts.voicetutor.service.resilience.CircuitBreakerMetrics;
import com.phillippitts.voicetutor.service.resilience.CircuitState;

import java.time.Instant;

/**
 * Published on every circuit breaker state transition, including a manual reset.
 */
public record CircuitStateChangedEvent(
        String circuit,
        CircuitState from,
        CircuitState to,
        CircuitBreakerMetrics metrics,
        Instant at
) {
    public CircuitStateChangedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
