package com.phillippitts.voicetutor.domain;

/**
 * Recognizer metadata attached to a spoken turn.
 *
 * @param durationMs utterance duration reported by the recognizer, in milliseconds
 * @param confidence recognizer confidence between 0.0 and 1.0
 */
public record SpeechMetadata(long durationMs, double confidence) {

    public SpeechMetadata {
        if (durationMs < 0) {
            throw new IllegalArgumentException("Duration must not be negative, got: " + durationMs);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
    }
}
