package com.phillippitts.voicetutor.service.events;

import com.phillippitts.voicetutor.domain.TurnOutcome;
import com.phillippitts.voicetutor.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.voicetutor.service.queue.event.BargeInEvent;
import com.phillippitts.voicetutor.service.resilience.CircuitState;
import com.phillippitts.voicetutor.service.resilience.event.CircuitStateChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log sink for orchestration events. Privacy-safe (no learner text) and throttled where
 * events can repeat quickly.
 */
@Component
class OrchestrationEventsListener {
    private static final Logger LOG = LogManager.getLogger(OrchestrationEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onCircuitStateChanged(CircuitStateChangedEvent e) {
        if (e.to() == CircuitState.OPEN) {
            String key = "circuit-open-" + e.circuit();
            if (shouldLog(key)) {
                LOG.warn("Backend circuit '{}' opened ({} -> OPEN, failures={}/{}). Turns use local fallbacks.",
                        e.circuit(), e.from(), e.metrics().failures(), e.metrics().requests());
            }
        } else {
            LOG.info("Backend circuit '{}' {} -> {}", e.circuit(), e.from(), e.to());
        }
    }

    @EventListener
    void onBargeIn(BargeInEvent e) {
        LOG.debug("Barge-in: session={}, cancelled={}", e.sessionId(), e.cancelledCount());
    }

    @EventListener
    void onTurnCompleted(TurnCompletedEvent e) {
        if (e.outcome() == TurnOutcome.FALLBACK && shouldLog("fallback-" + e.sessionId())) {
            LOG.warn("Session {} answered with a local fallback ({}ms)", e.sessionId(), e.latencyMs());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
