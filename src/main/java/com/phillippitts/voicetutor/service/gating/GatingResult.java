package com.phillippitts.voicetutor.service.gating;

/**
 * Admission decision for one turn.
 *
 * @param valid              true when the turn may be processed
 * @param shouldGate         inverse of {@code valid}; kept separate for callers that only check gating
 * @param reason             why the turn was gated, {@code null} when admitted
 * @param detail             human-readable explanation for logs and debug views
 * @param normalizedInput    normalized text (or a speech placeholder) for admitted turns
 * @param vadSilenceDetected whether the turn was finalized by end-of-speech or VAD silence
 * @param profile            profile in effect when the decision was made
 */
public record GatingResult(
        boolean valid,
        boolean shouldGate,
        GateReason reason,
        String detail,
        String normalizedInput,
        boolean vadSilenceDetected,
        String profile
) {

    static GatingResult admitted(String normalizedInput, String profile) {
        return new GatingResult(true, false, null, null, normalizedInput, true, profile);
    }

    static GatingResult gated(GateReason reason, String detail, boolean vadSilenceDetected, String profile) {
        return new GatingResult(false, true, reason, detail, null, vadSilenceDetected, profile);
    }

    /**
     * @return reason code, or {@code null} when admitted
     */
    public String reasonCode() {
        return reason == null ? null : reason.code();
    }
}
