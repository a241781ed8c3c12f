package com.phillippitts.voicetutor.service.orchestration;

import com.phillippitts.voicetutor.service.cache.CacheMetrics;
import com.phillippitts.voicetutor.service.gating.GatingMetrics;
import com.phillippitts.voicetutor.service.queue.GlobalQueueMetrics;
import com.phillippitts.voicetutor.service.resilience.CircuitBreakerMetrics;

/**
 * Combined snapshot of every orchestration component, meant for periodic polling.
 */
public record OrchestratorMetrics(
        GatingMetrics gating,
        CircuitBreakerMetrics circuit,
        CacheMetrics cache,
        GlobalQueueMetrics queues,
        int activeConversations
) {
}
