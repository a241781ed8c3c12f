package com.phillippitts.voicetutor.service.queue;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A pending or executing unit of work inside a {@link UserQueue}. The {@code aborted} flag is only
 * written under the owning queue's lock.
 */
final class QueueItem<T> {

    private final String id;
    private final Supplier<T> operation;
    private final CompletableFuture<T> future = new CompletableFuture<>();
    private final Instant enqueuedAt;
    private boolean aborted;

    QueueItem(String id, Supplier<T> operation, Instant enqueuedAt) {
        this.id = id;
        this.operation = operation;
        this.enqueuedAt = enqueuedAt;
    }

    String id() {
        return id;
    }

    Supplier<T> operation() {
        return operation;
    }

    CompletableFuture<T> future() {
        return future;
    }

    Instant enqueuedAt() {
        return enqueuedAt;
    }

    boolean isAborted() {
        return aborted;
    }

    void abort() {
        this.aborted = true;
    }
}
