package com.phillippitts.voicetutor.service.metrics;

import com.phillippitts.voicetutor.domain.TurnOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for turn handling.
 *
 * <ul>
 *   <li>{@code voicetutor.turn.latency} timer tagged by outcome</li>
 *   <li>{@code voicetutor.turn.outcome} counter tagged by outcome</li>
 *   <li>{@code voicetutor.turn.gated} counter tagged by gating reason</li>
 * </ul>
 *
 * <p>All metrics are exposed at /actuator/prometheus.
 */
@Component
public class TurnMetrics {

    private static final String METRIC_PREFIX = "voicetutor.turn";

    private final MeterRegistry registry;

    public TurnMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a finished turn.
     *
     * @param outcome       how the turn was resolved
     * @param durationNanos orchestration latency in nanoseconds
     */
    public void recordTurn(TurnOutcome outcome, long durationNanos) {
        String tag = outcome.name().toLowerCase(Locale.ROOT);
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to resolve a turn")
                .tag("outcome", tag)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of turns by outcome")
                .tag("outcome", tag)
                .register(registry)
                .increment();
    }

    /**
     * Increments the gated-turn counter.
     *
     * @param reason gating reason code (speech_too_short, gibberish, ...)
     */
    public void incrementGated(String reason) {
        Counter.builder(METRIC_PREFIX + ".gated")
                .description("Number of turns rejected by input gating")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
