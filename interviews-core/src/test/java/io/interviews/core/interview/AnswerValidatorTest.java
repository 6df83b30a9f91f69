package io.interviews.core.interview;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.interviews.core.exception.AnswerException;
import io.interviews.core.exception.ErrorCode;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.InputBody;
import io.interviews.core.questionnaire.question.MessageBody;
import io.interviews.core.questionnaire.question.Option;
import io.interviews.core.questionnaire.question.OptionsBody;
import io.interviews.core.questionnaire.question.QuestionKind;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AnswerValidator")
class AnswerValidatorTest {

    private static final AnswerableQuestion MESSAGE = AnswerableQuestion.builder()
            .label("m")
            .kind(QuestionKind.MESSAGE)
            .body(new MessageBody(""))
            .build();

    private static final AnswerableQuestion REQUIRED_INPUT = AnswerableQuestion.builder()
            .label("i")
            .kind(QuestionKind.INPUT)
            .body(new InputBody("", false, false))
            .build();

    private static final AnswerableQuestion SELECT = AnswerableQuestion.builder()
            .label("s")
            .kind(QuestionKind.SELECT)
            .body(new OptionsBody(
                    "", List.of(new Option(false), new Option(true)), false, false, 1))
            .build();

    private static final AnswerableQuestion AT_MOST_TWO = AnswerableQuestion.builder()
            .label("am")
            .kind(QuestionKind.SELECT_AT_MOST)
            .body(new OptionsBody(
                    "",
                    List.of(new Option(false), new Option(false), new Option(false)),
                    false,
                    true,
                    2))
            .build();

    private static final AnswerableQuestion EXACTLY_TWO = AnswerableQuestion.builder()
            .label("rl")
            .kind(QuestionKind.RANK_LIMIT)
            .body(new OptionsBody(
                    "",
                    List.of(new Option(false), new Option(false), new Option(false)),
                    false,
                    false,
                    2))
            .build();

    private static void assertRejected(
            AnswerableQuestion question, AnswerBody body, ErrorCode code) {
        assertThatThrownBy(() -> AnswerValidator.validate(question, body))
                .isInstanceOf(AnswerException.class)
                .hasFieldOrPropertyWithValue("errorCode", code);
    }

    @Test
    @DisplayName("rejects a missing body")
    void shouldRejectMissingBody() {
        assertRejected(MESSAGE, null, ErrorCode.ANSWER_IS_MISSING);
    }

    @Test
    @DisplayName("rejects a single choice answer without a choice")
    void shouldRejectMissingChoice() {
        assertRejected(
                SELECT, new AnswerBody.SelectAnswer(null, ""), ErrorCode.ANSWER_IS_MISSING);
    }

    @Test
    @DisplayName("rejects a body of another kind")
    void shouldRejectKindMismatch() {
        assertRejected(MESSAGE, new AnswerBody.InputAnswer("x"), ErrorCode.ANSWER_IS_INCORRECT);
        assertRejected(SELECT, AnswerBody.MultipleChoiceAnswer.of(0), ErrorCode.ANSWER_IS_INCORRECT);
    }

    @Nested
    @DisplayName("input")
    class Input {

        @Test
        @DisplayName("requires text unless optional")
        void shouldRequireText() {
            assertRejected(
                    REQUIRED_INPUT, new AnswerBody.InputAnswer(""), ErrorCode.ANSWER_IS_MISSING);
            assertThatCode(() -> AnswerValidator.validate(
                            REQUIRED_INPUT, new AnswerBody.InputAnswer("hello")))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("rejects a comment where none is asked")
        void shouldRejectUnexpectedComment() {
            assertRejected(
                    REQUIRED_INPUT,
                    new AnswerBody.InputAnswer("x", "note"),
                    ErrorCode.ANSWER_IS_INCORRECT);
        }
    }

    @Nested
    @DisplayName("options")
    class Options {

        @Test
        @DisplayName("accepts an in-range choice and an option comment where allowed")
        void shouldAcceptValidChoice() {
            assertThatCode(() -> AnswerValidator.validate(
                            SELECT, new AnswerBody.SelectAnswer(new Choice(1, "why"), "")))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("rejects an out-of-range choice")
        void shouldRejectOutOfRange() {
            assertRejected(SELECT, new AnswerBody.SelectAnswer(2), ErrorCode.ANSWER_IS_INCORRECT);
            assertRejected(SELECT, new AnswerBody.SelectAnswer(-1), ErrorCode.ANSWER_IS_INCORRECT);
        }

        @Test
        @DisplayName("rejects a comment on an option without one")
        void shouldRejectOptionComment() {
            assertRejected(
                    SELECT,
                    new AnswerBody.SelectAnswer(new Choice(0, "why"), ""),
                    ErrorCode.ANSWER_IS_INCORRECT);
        }

        @Test
        @DisplayName("enforces at-most limits and distinct choices")
        void shouldEnforceAtMost() {
            assertThatCode(() -> AnswerValidator.validate(
                            AT_MOST_TWO, AnswerBody.MultipleChoiceAnswer.of(2)))
                    .doesNotThrowAnyException();
            assertRejected(
                    AT_MOST_TWO,
                    AnswerBody.MultipleChoiceAnswer.of(0, 1, 2),
                    ErrorCode.ANSWER_IS_INCORRECT);
            assertRejected(
                    AT_MOST_TWO,
                    AnswerBody.MultipleChoiceAnswer.of(1, 1),
                    ErrorCode.ANSWER_IS_INCORRECT);
        }

        @Test
        @DisplayName("enforces exact limits")
        void shouldEnforceExactLimit() {
            assertThatCode(() -> AnswerValidator.validate(
                            EXACTLY_TWO, AnswerBody.MultipleChoiceAnswer.of(2, 0)))
                    .doesNotThrowAnyException();
            assertRejected(
                    EXACTLY_TWO,
                    AnswerBody.MultipleChoiceAnswer.of(1),
                    ErrorCode.ANSWER_IS_INCORRECT);
        }

        @Test
        @DisplayName("accepts a question comment where the body takes one")
        void shouldAcceptQuestionComment() {
            assertThatCode(() -> AnswerValidator.validate(
                            AT_MOST_TWO,
                            new AnswerBody.MultipleChoiceAnswer(List.of(new Choice(0)), "note")))
                    .doesNotThrowAnyException();
        }
    }
}
