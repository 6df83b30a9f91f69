package io.interviews.core.localization;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.QuestionnaireValidationException;
import io.interviews.core.questionnaire.question.Option;
import io.interviews.core.questionnaire.question.OptionsBody;
import io.interviews.core.questionnaire.question.QuestionBody;
import java.util.List;
import java.util.Objects;

/// Localized texts of one question in one language.
///
/// The text may contain `@{n}` and `@{name}` markers resolved at display time by
/// {@link io.interviews.core.text.TextResolver}.
///
/// @param text question text, not null
/// @param commentLabel label of the comment field, empty when the body has no comment
/// @param options option localizations in option order, empty for non-option bodies
public record QuestionLocalization(
        String text, String commentLabel, List<OptionLocalization> options) {

    public QuestionLocalization {
        Objects.requireNonNull(text, "text must not be null");
        commentLabel = commentLabel == null ? "" : commentLabel;
        options = options == null ? List.of() : List.copyOf(options);
    }

    public QuestionLocalization(String text) {
        this(text, "", List.of());
    }

    public boolean hasCommentLabel() {
        return !commentLabel.isEmpty();
    }

    /// Checks the localization against the structural body it translates.
    ///
    /// ### Contracts
    /// - the text is not empty
    /// - a comment label is present exactly when the body has a comment
    /// - option bodies have one localization per option, with a non-empty label and a
    ///   comment label exactly where the option has a comment
    ///
    /// @param label question label, used in errors, not null
    /// @param body structural body, not null
    /// @throws QuestionnaireValidationException on the first mismatch
    public void check(String label, QuestionBody body) throws QuestionnaireValidationException {
        if (text.isEmpty()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.QUESTION_LOCALIZATION_TEXT_IS_MISSING, label);
        }
        if (body.hasComment() && !hasCommentLabel()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.QUESTION_LOCALIZATION_COMMENT_IS_MISSING, label);
        }
        if (!body.hasComment() && hasCommentLabel()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.QUESTION_LOCALIZATION_COMMENT_IS_PRESENT, label);
        }
        if (!(body instanceof OptionsBody ob)) {
            if (!options.isEmpty()) {
                throw new QuestionnaireValidationException(
                        ErrorCode.QUESTION_LOCALIZATION_OPTIONS_SIZE_IS_INCORRECT, label);
            }
            return;
        }
        if (ob.options().size() != options.size()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.QUESTION_LOCALIZATION_OPTIONS_SIZE_IS_INCORRECT, label);
        }
        for (int i = 0; i < options.size(); i++) {
            Option option = ob.options().get(i);
            OptionLocalization ol = options.get(i);
            if (ol.label().isEmpty()) {
                throw new QuestionnaireValidationException(
                        ErrorCode.QUESTION_OPTION_LABEL_IS_EMPTY, label);
            }
            if (option.hasComment() && !ol.hasCommentLabel()) {
                throw new QuestionnaireValidationException(
                        ErrorCode.OPTION_LOCALIZATION_COMMENT_DOES_NOT_EXIST, label);
            }
            if (!option.hasComment() && ol.hasCommentLabel()) {
                throw new QuestionnaireValidationException(
                        ErrorCode.OPTION_LOCALIZATION_COMMENT_IS_PRESENT, label);
            }
        }
    }
}
