package com.phillippitts.voicetutor.exception;

/**
 * Base exception for all voice-tutor application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class VoiceTutorException extends RuntimeException {

    public VoiceTutorException(String message) {
        super(message);
    }

    public VoiceTutorException(String message, Throwable cause) {
        super(message, cause);
    }

    public VoiceTutorException(Throwable cause) {
        super(cause);
    }
}
