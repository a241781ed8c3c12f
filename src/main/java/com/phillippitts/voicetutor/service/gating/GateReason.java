package com.phillippitts.voicetutor.service.gating;

import java.util.Locale;

/**
 * Machine-readable reasons a turn was not admitted.
 */
public enum GateReason {
    AWAITING_END_OF_SPEECH,
    UTTERANCE_TOO_LONG,
    SPEECH_TOO_SHORT,
    LOW_CONFIDENCE,
    EMPTY_TEXT,
    GIBBERISH,
    REPETITIVE;

    /**
     * @return snake_case code used in metrics and client payloads, e.g. {@code speech_too_short}
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
