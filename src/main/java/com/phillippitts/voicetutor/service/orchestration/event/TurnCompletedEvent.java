package com.phillippitts.voicetutor.service.orchestration.event;

import com.phillippitts.voicetutor.domain.TurnOutcome;

import java.time.Instant;

/**
 * Emitted once per handled turn, after the response has been produced.
 *
 * <p>PII note: carries no learner text.
 *
 * @param sessionId  owning session
 * @param outcome    how the turn was resolved
 * @param gateReason gating reason code for gated turns, otherwise {@code null}
 * @param latencyMs  orchestration latency
 * @param timestamp  completion time
 */
public record TurnCompletedEvent(
        String sessionId,
        TurnOutcome outcome,
        String gateReason,
        long latencyMs,
        Instant timestamp
) {}
