package com.phillippitts.voicetutor.service.queue;

/**
 * Per-session queue counters.
 *
 * @param processed           operations that completed successfully
 * @param cancelled           pending operations superseded by barge-in or an explicit clear
 * @param errors              operations that completed exceptionally
 * @param avgProcessingTimeMs running average over successful operations
 * @param currentDepth        pending operations, excluding the one executing
 */
public record QueueMetrics(
        long processed,
        long cancelled,
        long errors,
        double avgProcessingTimeMs,
        int currentDepth
) {
}
