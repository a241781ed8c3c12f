package com.phillippitts.voicetutor.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One user utterance submitted for processing. Ephemeral; never persisted.
 *
 * @param sessionId   session key that groups queue, dialog and gating state
 * @param text        raw recognized or typed text (may be empty, never null)
 * @param speech      optional recognizer metadata; {@code null} for typed input
 * @param endOfSpeech true once the client has detected the end of the utterance
 * @param submittedAt submission timestamp
 */
public record Turn(
        String sessionId,
        String text,
        SpeechMetadata speech,
        boolean endOfSpeech,
        Instant submittedAt
) {

    public Turn {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        if (sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId must not be blank");
        }
        text = text == null ? "" : text;
        Objects.requireNonNull(submittedAt, "submittedAt must not be null");
    }

    /**
     * Final turn (end of speech reached) submitted now.
     */
    public static Turn finalTurn(String sessionId, String text, SpeechMetadata speech) {
        return new Turn(sessionId, text, speech, true, Instant.now());
    }

    /**
     * Typed final turn without speech metadata.
     */
    public static Turn typed(String sessionId, String text) {
        return finalTurn(sessionId, text, null);
    }

    public boolean hasSpeech() {
        return speech != null;
    }
}
