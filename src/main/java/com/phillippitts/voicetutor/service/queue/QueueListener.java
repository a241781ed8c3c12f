package com.phillippitts.voicetutor.service.queue;

/**
 * Callbacks from a {@link UserQueue} to its owner. Invoked outside the queue's lock.
 */
interface QueueListener {

    void onEnqueued(String sessionId, int depth);

    void onCancelled(String sessionId, int cancelledCount);

    void onProcessed(String sessionId, String operationId, long processingTimeMs);

    void onError(String sessionId, String operationId, Throwable error);
}
