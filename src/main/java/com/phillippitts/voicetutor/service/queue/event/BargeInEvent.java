package com.phillippitts.voicetutor.service.queue.event;

import java.time.Instant;

/**
 * Published when pending operations of a session are cancelled, either by a newer turn (barge-in)
 * or by an explicit backlog clear.
 */
public record BargeInEvent(String sessionId, int cancelledCount, Instant at) {
    public BargeInEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
