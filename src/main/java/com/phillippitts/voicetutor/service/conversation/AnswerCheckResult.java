package com.phillippitts.voicetutor.service.conversation;

import com.phillippitts.voicetutor.domain.QuestionType;

/**
 * Outcome of checking a learner answer.
 *
 * @param correct   whether the answer was accepted
 * @param feedback  short spoken feedback
 * @param checkedAs comparison mode actually used (after auto-detection)
 */
public record AnswerCheckResult(boolean correct, String feedback, QuestionType checkedAs) {
}
