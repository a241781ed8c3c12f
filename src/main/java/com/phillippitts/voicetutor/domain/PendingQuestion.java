package com.phillippitts.voicetutor.domain;

import java.util.List;
import java.util.Objects;

/**
 * The single outstanding question of a session, used to resolve the next turn as an answer check.
 *
 * @param question       question text as spoken to the learner
 * @param expectedAnswer expected answer (letter for MCQ, number/expression for math)
 * @param questionType   comparison mode
 * @param options        MCQ options, empty otherwise
 */
public record PendingQuestion(
        String question,
        String expectedAnswer,
        QuestionType questionType,
        List<String> options
) {

    public PendingQuestion {
        Objects.requireNonNull(question, "question must not be null");
        Objects.requireNonNull(expectedAnswer, "expectedAnswer must not be null");
        questionType = questionType == null ? QuestionType.SHORT : questionType;
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static PendingQuestion of(String question, String expectedAnswer, QuestionType type) {
        return new PendingQuestion(question, expectedAnswer, type, List.of());
    }
}
