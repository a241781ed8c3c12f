package com.phillippitts.voicetutor.service.gating;

/**
 * Thresholds currently applied by {@link InputGatingService}.
 */
public record GatingProfile(
        String profile,
        int minDurationMs,
        double minConfidence,
        int vadSilenceMs,
        int maxUtteranceMs
) {
}
