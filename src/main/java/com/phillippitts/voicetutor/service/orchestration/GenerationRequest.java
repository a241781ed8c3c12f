package com.phillippitts.voicetutor.service.orchestration;

import com.phillippitts.voicetutor.domain.DialogState;

import java.util.Objects;

/**
 * Input handed to the generation backend for one admitted turn.
 *
 * @param sessionId   owning session
 * @param topic       lesson topic, e.g. {@code math-fractions}
 * @param subject     subject derived from the topic, e.g. {@code math}
 * @param dialogState dialog state at the time of the turn
 * @param input       normalized learner input
 */
public record GenerationRequest(
        String sessionId,
        String topic,
        String subject,
        DialogState dialogState,
        String input
) {
    public GenerationRequest {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(input, "input must not be null");
    }
}
