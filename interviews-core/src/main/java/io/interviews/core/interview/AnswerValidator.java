package io.interviews.core.interview;

import io.interviews.core.exception.AnswerException;
import io.interviews.core.exception.ErrorCode;
import io.interviews.core.interview.AnswerBody.InputAnswer;
import io.interviews.core.interview.AnswerBody.MessageAnswer;
import io.interviews.core.interview.AnswerBody.MultipleChoiceAnswer;
import io.interviews.core.interview.AnswerBody.SelectAnswer;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.InputBody;
import io.interviews.core.questionnaire.question.OptionsBody;
import io.interviews.core.questionnaire.question.QuestionKind;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/// Checks that an answer body fits the question it answers.
///
/// | Kind | Body | Rule |
/// |---|---|---|
/// | MESSAGE | {@link MessageAnswer} | none |
/// | INPUT | {@link InputAnswer} | non-empty unless optional |
/// | SELECT | {@link SelectAnswer} | index in range |
/// | SELECT_AT_MOST, RANK_AT_MOST | {@link MultipleChoiceAnswer} | at most `limit` choices |
/// | SELECT_LIMIT, RANK_LIMIT | {@link MultipleChoiceAnswer} | exactly `limit` choices |
///
/// Choice indices must be in range and distinct. Comments are only accepted where the
/// body or the chosen option takes one.
public final class AnswerValidator {

    private AnswerValidator() {}

    /// Validates an answer body.
    ///
    /// @param question the answered question, not null
    /// @param body the answer body, may be null
    /// @throws AnswerException `abmiss` for a missing body or required input, `abincorr`
    ///     for any other mismatch
    public static void validate(AnswerableQuestion question, AnswerBody body)
            throws AnswerException {
        String label = question.getLabel();
        if (body == null) {
            throw new AnswerException(ErrorCode.ANSWER_IS_MISSING, label);
        }
        QuestionKind kind = question.getAnswerKind();
        if (!bodyFits(kind, body)) {
            throw new AnswerException(ErrorCode.ANSWER_IS_INCORRECT, label);
        }
        if (!body.comment().isEmpty() && !question.getBody().hasComment()) {
            throw new AnswerException(ErrorCode.ANSWER_IS_INCORRECT, label);
        }
        if (body instanceof InputAnswer input) {
            InputBody ib = (InputBody) question.getBody();
            if (!ib.optional() && input.input().isEmpty()) {
                throw new AnswerException(ErrorCode.ANSWER_IS_MISSING, label);
            }
        } else if (body instanceof SelectAnswer select) {
            if (select.choice() == null) {
                throw new AnswerException(ErrorCode.ANSWER_IS_MISSING, label);
            }
            checkChoices(label, (OptionsBody) question.getBody(), List.of(select.choice()));
        } else if (body instanceof MultipleChoiceAnswer multiple) {
            OptionsBody ob = (OptionsBody) question.getBody();
            int count = multiple.choices().size();
            boolean countFits = kind.isExactLimit() ? count == ob.limit() : count <= ob.limit();
            if (!countFits) {
                throw new AnswerException(ErrorCode.ANSWER_IS_INCORRECT, label);
            }
            checkChoices(label, ob, multiple.choices());
        }
    }

    private static boolean bodyFits(QuestionKind kind, AnswerBody body) {
        if (kind == QuestionKind.MESSAGE) {
            return body instanceof MessageAnswer;
        }
        if (kind == QuestionKind.INPUT) {
            return body instanceof InputAnswer;
        }
        if (kind == QuestionKind.SELECT) {
            return body instanceof SelectAnswer;
        }
        return kind.isMultipleChoice() && body instanceof MultipleChoiceAnswer;
    }

    private static void checkChoices(String label, OptionsBody body, List<Choice> choices)
            throws AnswerException {
        Set<Integer> seen = new HashSet<>();
        for (Choice choice : choices) {
            int index = choice.index();
            if (index < 0 || index >= body.options().size() || !seen.add(index)) {
                throw new AnswerException(ErrorCode.ANSWER_IS_INCORRECT, label);
            }
            if (!choice.comment().isEmpty() && !body.options().get(index).hasComment()) {
                throw new AnswerException(ErrorCode.ANSWER_IS_INCORRECT, label);
            }
        }
    }
}
