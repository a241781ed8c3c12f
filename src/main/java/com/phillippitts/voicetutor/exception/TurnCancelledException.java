package com.phillippitts.voicetutor.exception;

/**
 * Completes a queued operation that was superseded before it started (barge-in or an explicit
 * backlog clear). Callers treat it as "superseded", never as a user-facing failure.
 */
public class TurnCancelledException extends VoiceTutorException {

    private final String sessionId;
    private final String operationId;

    public TurnCancelledException(String sessionId, String operationId) {
        super("Operation cancelled due to barge-in");
        this.sessionId = sessionId;
        this.operationId = operationId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getOperationId() {
        return operationId;
    }
}
