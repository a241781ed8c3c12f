package com.phillippitts.voicetutor.exception;

/**
 * Thrown when a single backend attempt does not complete within its timeout.
 * The abandoned attempt keeps running; only its result is discarded.
 */
public class BackendTimeoutException extends BackendException {

    private final long timeoutMs;

    public BackendTimeoutException(long timeoutMs) {
        super("Operation timeout");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
