package com.phillippitts.voicetutor.service.queue;

import com.phillippitts.voicetutor.exception.TurnCancelledException;
import com.phillippitts.voicetutor.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialized execution queue for one session.
 *
 * <p>At most one operation runs at any time; the {@code processing} flag is set under the lock before
 * an item is dispatched and cleared when it finishes, after which the next pending item is dispatched.
 * Results are delivered in submission order.
 *
 * <p>Barge-in: enqueueing with {@code enableBargein} cancels every pending (not yet started) item
 * first; their futures complete with {@link TurnCancelledException}. The executing item is never
 * interrupted and still delivers its result.
 */
public class UserQueue {

    private static final Logger LOG = LogManager.getLogger(UserQueue.class);

    private final String sessionId;
    private final Executor executor;
    private final QueueListener listener;
    private final AtomicLong sequence = new AtomicLong();

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<QueueItem<?>> pending = new ArrayDeque<>();
    private boolean processing;
    private long processed;
    private long cancelled;
    private long errors;
    private double avgProcessingTimeMs;

    UserQueue(String sessionId, Executor executor, QueueListener listener) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Appends an operation and returns a future completed with its result.
     *
     * @param operation     blocking work to run on the queue executor
     * @param enableBargein cancel all pending items before appending
     * @return future completed with the operation's result, its exception, or
     *         {@link TurnCancelledException} if the item is superseded before it starts
     */
    public <T> CompletableFuture<T> enqueue(Supplier<T> operation, boolean enableBargein) {
        Objects.requireNonNull(operation, "operation must not be null");
        QueueItem<T> item = new QueueItem<>(sessionId + "-" + sequence.incrementAndGet(),
                operation, Instant.now());

        List<QueueItem<?>> superseded = List.of();
        int depth;
        lock.lock();
        try {
            if (enableBargein && !pending.isEmpty()) {
                superseded = drainPending();
            }
            pending.addLast(item);
            depth = pending.size();
        } finally {
            lock.unlock();
        }

        rejectAll(superseded);
        LOG.debug("Enqueued operation {} (depth={})", item.id(), depth);
        listener.onEnqueued(sessionId, depth);
        processNext();
        return item.future();
    }

    /**
     * Cancels every pending item. The executing item, if any, is left to finish.
     *
     * @return number of items cancelled
     */
    public int cancelPendingOperations() {
        List<QueueItem<?>> superseded;
        lock.lock();
        try {
            superseded = drainPending();
        } finally {
            lock.unlock();
        }
        rejectAll(superseded);
        return superseded.size();
    }

    /**
     * Cancels all pending items.
     */
    public void clear() {
        int count = cancelPendingOperations();
        LOG.debug("Queue cleared for session {} ({} pending cancelled)", sessionId, count);
    }

    public int getQueueDepth() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isProcessing() {
        lock.lock();
        try {
            return processing;
        } finally {
            lock.unlock();
        }
    }

    public QueueMetrics getMetrics() {
        lock.lock();
        try {
            return new QueueMetrics(processed, cancelled, errors, avgProcessingTimeMs, pending.size());
        } finally {
            lock.unlock();
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    // Must be called with lock held
    private List<QueueItem<?>> drainPending() {
        List<QueueItem<?>> drained = new ArrayList<>(pending.size());
        for (QueueItem<?> item : pending) {
            if (!item.isAborted()) {
                item.abort();
                drained.add(item);
            }
        }
        pending.clear();
        cancelled += drained.size();
        return drained;
    }

    private void rejectAll(List<QueueItem<?>> superseded) {
        if (superseded.isEmpty()) {
            return;
        }
        for (QueueItem<?> item : superseded) {
            item.future().completeExceptionally(new TurnCancelledException(sessionId, item.id()));
        }
        LOG.info("Cancelled {} pending operations", superseded.size());
        listener.onCancelled(sessionId, superseded.size());
    }

    private void processNext() {
        QueueItem<?> next;
        lock.lock();
        try {
            if (processing) {
                return;
            }
            next = pending.pollFirst();
            while (next != null && next.isAborted()) {
                next = pending.pollFirst();
            }
            if (next == null) {
                return;
            }
            processing = true;
        } finally {
            lock.unlock();
        }
        dispatch(next);
    }

    private <T> void dispatch(QueueItem<T> item) {
        long start = System.nanoTime();
        if (LOG.isDebugEnabled()) {
            LOG.debug("Processing operation {} after {}ms in queue",
                    item.id(), Duration.between(item.enqueuedAt(), Instant.now()).toMillis());
        }
        CompletableFuture<T> run;
        try {
            run = CompletableFuture.supplyAsync(item.operation(), executor);
        } catch (RejectedExecutionException e) {
            run = CompletableFuture.failedFuture(e);
        }
        run.whenComplete((result, error) -> finish(item, result, error, TimeUtils.elapsedMillis(start)));
    }

    private <T> void finish(QueueItem<T> item, T result, Throwable error, long elapsedMs) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        boolean deliver;
        lock.lock();
        try {
            processing = false;
            deliver = !item.isAborted();
            if (deliver && cause == null) {
                processed++;
                avgProcessingTimeMs = processed == 1
                        ? elapsedMs
                        : (avgProcessingTimeMs * (processed - 1) + elapsedMs) / processed;
            } else if (deliver) {
                errors++;
            }
        } finally {
            lock.unlock();
        }

        if (deliver) {
            if (cause == null) {
                item.future().complete(result);
                listener.onProcessed(sessionId, item.id(), elapsedMs);
            } else {
                LOG.debug("Operation {} failed: {}", item.id(), cause.toString());
                item.future().completeExceptionally(cause);
                listener.onError(sessionId, item.id(), cause);
            }
        }
        processNext();
    }
}
