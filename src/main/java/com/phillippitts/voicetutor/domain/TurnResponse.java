package com.phillippitts.voicetutor.domain;

import java.util.List;
import java.util.Objects;

/**
 * Result of orchestrating one turn. Every admitted turn gets one; gated and superseded turns get
 * one without content (or with a short re-prompt).
 *
 * @param sessionId   owning session
 * @param outcome     how the turn was resolved
 * @param content     tutor utterance, {@code null} for silent outcomes
 * @param gateReason  machine-readable gating reason, {@code null} unless {@link TurnOutcome#GATED}
 * @param banner      optional status banner for the client ("High traffic - using quick tips")
 * @param breakerOpen whether the backend circuit was open when the turn finished
 * @param queueDepth  session queue depth observed when the turn finished
 * @param citations   citations attached to cached content
 * @param latencyMs   end-to-end orchestration latency
 */
public record TurnResponse(
        String sessionId,
        TurnOutcome outcome,
        String content,
        String gateReason,
        String banner,
        boolean breakerOpen,
        int queueDepth,
        List<String> citations,
        long latencyMs
) {

    public TurnResponse {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public boolean hasUtterance() {
        return content != null && !content.isBlank();
    }

    public boolean usedCache() {
        return outcome == TurnOutcome.CACHED;
    }

    public boolean usedFallback() {
        return outcome == TurnOutcome.FALLBACK;
    }
}
