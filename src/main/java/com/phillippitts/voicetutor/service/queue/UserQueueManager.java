package com.phillippitts.voicetutor.service.queue;

import com.phillippitts.voicetutor.service.queue.event.BargeInEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of per-session {@link UserQueue}s.
 *
 * <p>Queues are created lazily by {@link #getQueue(String)} and removed only by
 * {@link #removeQueue(String)} or {@link #cleanup()}. All queues share the {@code queueExecutor};
 * sessions are independent of each other.
 */
@Service
public class UserQueueManager {

    private static final Logger LOG = LogManager.getLogger(UserQueueManager.class);

    private final Map<String, UserQueue> queues = new ConcurrentHashMap<>();
    private final Executor queueExecutor;
    private final ApplicationEventPublisher publisher;

    private final AtomicLong totalSessions = new AtomicLong();
    private final AtomicLong totalOperations = new AtomicLong();
    private final AtomicLong totalCancellations = new AtomicLong();
    private final AtomicLong totalErrors = new AtomicLong();
    private final QueueListener aggregator = new Aggregator();

    public UserQueueManager(@Qualifier("queueExecutor") Executor queueExecutor,
                            ApplicationEventPublisher publisher) {
        this.queueExecutor = Objects.requireNonNull(queueExecutor, "queueExecutor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Returns the session's queue, creating it on first use.
     */
    public UserQueue getQueue(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return queues.computeIfAbsent(sessionId, id -> {
            long count = totalSessions.incrementAndGet();
            LOG.debug("Created queue for session {} (total sessions={})", id, count);
            return new UserQueue(id, queueExecutor, aggregator);
        });
    }

    /**
     * Cancels the pending backlog of a session without enqueueing anything. The executing item is
     * left to finish.
     *
     * @return number of pending items cancelled; 0 when the session has no queue
     */
    public int cancelInFlightForSession(String sessionId) {
        UserQueue queue = queues.get(sessionId);
        if (queue == null) {
            return 0;
        }
        int cancelled = queue.cancelPendingOperations();
        if (cancelled > 0) {
            LOG.debug("Cancelled {} pending operations for session {}", cancelled, sessionId);
        }
        return cancelled;
    }

    /**
     * @return pending items of the session's queue; 0 when the session has no queue
     */
    public int getQueueDepth(String sessionId) {
        UserQueue queue = queues.get(sessionId);
        return queue == null ? 0 : queue.getQueueDepth();
    }

    public void removeQueue(String sessionId) {
        UserQueue queue = queues.remove(sessionId);
        if (queue != null) {
            queue.clear();
            LOG.debug("Removed queue for session {}", sessionId);
        }
    }

    public GlobalQueueMetrics getGlobalMetrics() {
        int active = 0;
        int totalDepth = 0;
        int maxDepth = 0;
        for (UserQueue queue : queues.values()) {
            int depth = queue.getQueueDepth();
            active++;
            totalDepth += depth;
            maxDepth = Math.max(maxDepth, depth);
        }
        double avgDepth = active > 0 ? (double) totalDepth / active : 0.0;
        return new GlobalQueueMetrics(totalSessions.get(), totalOperations.get(), totalCancellations.get(),
                totalErrors.get(), active, totalDepth, maxDepth, avgDepth);
    }

    public int activeSessions() {
        return queues.size();
    }

    /**
     * Clears and removes every queue.
     */
    public void cleanup() {
        int count = queues.size();
        queues.forEach((sessionId, queue) -> queue.clear());
        queues.clear();
        LOG.info("All {} session queues cleared", count);
    }

    /** Folds per-queue callbacks into the cumulative totals and publishes barge-in events. */
    private final class Aggregator implements QueueListener {

        @Override
        public void onEnqueued(String sessionId, int depth) {
            totalOperations.incrementAndGet();
        }

        @Override
        public void onCancelled(String sessionId, int cancelledCount) {
            totalCancellations.addAndGet(cancelledCount);
            publisher.publishEvent(new BargeInEvent(sessionId, cancelledCount, Instant.now()));
        }

        @Override
        public void onProcessed(String sessionId, String operationId, long processingTimeMs) {
            LOG.debug("Operation {} processed in {}ms", operationId, processingTimeMs);
        }

        @Override
        public void onError(String sessionId, String operationId, Throwable error) {
            totalErrors.incrementAndGet();
        }
    }
}
