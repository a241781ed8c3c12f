package com.phillippitts.voicetutor.service.conversation;

import com.phillippitts.voicetutor.domain.QuestionType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerCheckerTest {

    private final AnswerChecker checker = new AnswerChecker();

    @Test
    void mathAcceptsNumberWordsExpressionsAndTolerance() {
        assertThat(checker.check("4", "four", QuestionType.MATH).correct()).isTrue();
        assertThat(checker.check("4", "2 + 2", QuestionType.MATH).correct()).isTrue();
        assertThat(checker.check("0.5", "1 / 2", QuestionType.MATH).correct()).isTrue();
        assertThat(checker.check("4", "4.004", QuestionType.MATH).correct()).isTrue();
    }

    @Test
    void mathRejectsWrongNumberWithCorrection() {
        AnswerCheckResult result = checker.check("4", "5", QuestionType.MATH);

        assertThat(result.correct()).isFalse();
        assertThat(result.feedback()).contains("The answer is 4");
        assertThat(result.checkedAs()).isEqualTo(QuestionType.MATH);
    }

    @Test
    void multipleChoiceAcceptsLetterPhrasesAndIndex() {
        assertThat(checker.check("b", "B", QuestionType.MCQ).correct()).isTrue();
        assertThat(checker.check("b", "option b", QuestionType.MCQ).correct()).isTrue();
        assertThat(checker.check("b", "my answer b", QuestionType.MCQ).correct()).isTrue();
        assertThat(checker.check("b", "I think b", QuestionType.MCQ).correct()).isTrue();
        assertThat(checker.check("b", "2", QuestionType.MCQ).correct()).isTrue();
        assertThat(checker.check("b", "two", QuestionType.MCQ).correct()).isTrue();
    }

    @Test
    void multipleChoiceRejectsOtherLetter() {
        AnswerCheckResult result = checker.check("b", "c", QuestionType.MCQ);

        assertThat(result.correct()).isFalse();
        assertThat(result.feedback()).contains("correct answer is B");
    }

    @Test
    void shortAnswerAcceptsTyposAndContainment() {
        assertThat(checker.check("photosynthesis", "Photosynthesis", QuestionType.SHORT).correct()).isTrue();
        assertThat(checker.check("photosynthesis", "photosynthesys", QuestionType.SHORT).correct()).isTrue();
        assertThat(checker.check("photosynthesis", "fotosynthesis", QuestionType.SHORT).correct()).isTrue();
        assertThat(checker.check("photosynthesis", "it is photosynthesis", QuestionType.SHORT).correct()).isTrue();
        assertThat(checker.check("paris", "pariss", QuestionType.SHORT).correct()).isTrue();
    }

    @Test
    void shortAnswerRejectsUnrelatedOrEmptyAnswers() {
        assertThat(checker.check("photosynthesis", "respiration", QuestionType.SHORT).correct()).isFalse();
        assertThat(checker.check("paris", "", QuestionType.SHORT).correct()).isFalse();
        assertThat(checker.check("paris", null, QuestionType.SHORT).correct()).isFalse();
        assertThat(checker.check("paris", "lyon", QuestionType.SHORT).feedback()).contains("\"paris\"");
    }

    @Test
    void openQuestionsAutoDetectComparisonMode() {
        assertThat(checker.check("12", "twelve", QuestionType.OPEN).checkedAs()).isEqualTo(QuestionType.MATH);
        assertThat(checker.check("option c", "c", QuestionType.OPEN).checkedAs()).isEqualTo(QuestionType.MCQ);
        assertThat(checker.check("paris", "paris", null).checkedAs()).isEqualTo(QuestionType.SHORT);
    }

    @Test
    void evaluatesSimpleBinaryExpressions() {
        assertThat(AnswerChecker.evaluate("3 * 4")).isEqualTo(12.0);
        assertThat(AnswerChecker.evaluate("10-4")).isEqualTo(6.0);
        assertThat(AnswerChecker.evaluate("6 / 0")).isNull();
        assertThat(AnswerChecker.evaluate("1 + 2 + 3")).isNull();
    }

    @Test
    void levenshteinDistance() {
        assertThat(AnswerChecker.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(AnswerChecker.levenshtein("", "abc")).isEqualTo(3);
        assertThat(AnswerChecker.levenshtein("same", "same")).isZero();
    }

    @Test
    void normalizeConvertsNumberWordsAndStripsPunctuation() {
        assertThat(AnswerChecker.normalize("  Twenty!  ")).isEqualTo("20");
        assertThat(AnswerChecker.normalize("It's SEVEN.")).isEqualTo("its 7.");
    }
}
