package com.phillippitts.voicetutor.service.resilience;

import java.time.Instant;

/**
 * Snapshot of circuit breaker counters. Counters are cumulative until {@link CircuitBreaker#reset()}.
 *
 * @param name             circuit name
 * @param state            state when the snapshot was taken
 * @param requests         calls admitted while CLOSED or HALF_OPEN
 * @param failures         calls that failed after exhausting their attempts
 * @param successes        calls that succeeded on some attempt
 * @param timeouts         failed calls whose last error was a timeout
 * @param rejected         calls rejected while OPEN
 * @param distressFailures failed calls carrying a 429/5xx/quota signature
 * @param lastFailureTime  time of the most recent failed call, {@code null} if none
 * @param failureRate      failures per admitted request, in percent
 */
public record CircuitBreakerMetrics(
        String name,
        CircuitState state,
        long requests,
        long failures,
        long successes,
        long timeouts,
        long rejected,
        long distressFailures,
        Instant lastFailureTime,
        double failureRate
) {
}
