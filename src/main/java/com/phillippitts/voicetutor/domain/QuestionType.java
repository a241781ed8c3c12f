package com.phillippitts.voicetutor.domain;

/**
 * Kind of answer a pending question expects; drives how the answer checker compares.
 */
public enum QuestionType {
    SHORT,
    MCQ,
    MATH,
    OPEN
}
