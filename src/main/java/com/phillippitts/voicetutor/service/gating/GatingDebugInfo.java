package com.phillippitts.voicetutor.service.gating;

import java.time.Instant;
import java.util.List;

/**
 * Per-session gating state for debug views.
 *
 * @param sessionId    session inspected
 * @param lastSpeechAt timestamp of the last partial turn, {@code null} when no utterance is open
 * @param recentInputs normalized inputs in the repetition window, oldest first
 * @param thresholds   thresholds in effect
 */
public record GatingDebugInfo(
        String sessionId,
        Instant lastSpeechAt,
        List<String> recentInputs,
        GatingProfile thresholds
) {

    public GatingDebugInfo {
        recentInputs = List.copyOf(recentInputs);
    }
}
