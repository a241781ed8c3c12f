package com.phillippitts.voicetutor.service.gating;

import java.util.Map;

/**
 * Snapshot of gating counters.
 *
 * @param totalInputs  every turn passed to {@code validate}
 * @param gatedInputs  turns that were not admitted
 * @param validInputs  admitted turns
 * @param gatingRate   gated share in percent
 * @param reasonCounts gated turns per reason code
 */
public record GatingMetrics(
        long totalInputs,
        long gatedInputs,
        long validInputs,
        double gatingRate,
        Map<String, Long> reasonCounts
) {

    public GatingMetrics {
        reasonCounts = Map.copyOf(reasonCounts);
    }
}
