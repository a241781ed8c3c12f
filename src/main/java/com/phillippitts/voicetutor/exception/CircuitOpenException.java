package com.phillippitts.voicetutor.exception;

/**
 * Thrown when a call is rejected because the circuit breaker is OPEN.
 * No backend call is made; callers substitute a local fallback.
 */
public class CircuitOpenException extends VoiceTutorException {

    private final String circuitName;

    public CircuitOpenException(String circuitName) {
        super("Circuit breaker is OPEN - request rejected (circuit: " + circuitName + ")");
        this.circuitName = circuitName;
    }

    public String getCircuitName() {
        return circuitName;
    }
}
