package com.phillippitts.voicetutor.domain;

/**
 * How a turn was resolved by the orchestrator.
 */
public enum TurnOutcome {
    /** Inadmissible input; no generation. */
    GATED,
    /** Resolved against the pending question without calling the backend. */
    ANSWER_CHECK,
    /** Served from the semantic cache. */
    CACHED,
    /** Fresh backend generation. */
    GENERATED,
    /** Backend failed or circuit open; canned local response. */
    FALLBACK,
    /** A newer turn won; no utterance for this one. */
    SUPERSEDED
}
