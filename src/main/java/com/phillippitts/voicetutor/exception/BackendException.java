package com.phillippitts.voicetutor.exception;

/**
 * Thrown when the upstream text-generation backend fails a call.
 *
 * <p>The optional {@code status} mirrors the HTTP status reported by the backend (429, 5xx, ...)
 * and is what the circuit breaker inspects to recognise backend distress.
 */
public class BackendException extends VoiceTutorException {

    private final Integer status;

    public BackendException(String message) {
        super(message);
        this.status = null;
    }

    public BackendException(String message, Integer status) {
        super(status == null ? message : message + " (status: " + status + ")");
        this.status = status;
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
        this.status = null;
    }

    public BackendException(String message, Integer status, Throwable cause) {
        super(status == null ? message : message + " (status: " + status + ")", cause);
        this.status = status;
    }

    /**
     * @return backend status code, or {@code null} when the failure carried none
     */
    public Integer getStatus() {
        return status;
    }
}
