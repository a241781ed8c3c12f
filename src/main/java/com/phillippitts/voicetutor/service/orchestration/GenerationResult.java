package com.phillippitts.voicetutor.service.orchestration;

import com.phillippitts.voicetutor.domain.PendingQuestion;
import com.phillippitts.voicetutor.domain.TutorPlan;

import java.util.Objects;

/**
 * Backend output for one turn.
 *
 * @param content    tutor utterance
 * @param plan       structured plan, {@code null} when the backend returned none
 * @param question   question the utterance asks the learner, {@code null} when none
 * @param tokensUsed tokens consumed by the call
 */
public record GenerationResult(
        String content,
        TutorPlan plan,
        PendingQuestion question,
        int tokensUsed
) {
    public GenerationResult {
        Objects.requireNonNull(content, "content must not be null");
    }

    public static GenerationResult of(String content) {
        return new GenerationResult(content, null, null, 0);
    }
}
