package com.phillippitts.voicetutor.service.queue;

/**
 * Aggregate over all session queues. Cumulative totals survive queue removal; depth figures cover
 * the queues currently registered.
 */
public record GlobalQueueMetrics(
        long totalSessions,
        long totalOperations,
        long totalCancellations,
        long totalErrors,
        int activeSessions,
        int totalQueueDepth,
        int maxQueueDepth,
        double avgQueueDepth
) {
}
