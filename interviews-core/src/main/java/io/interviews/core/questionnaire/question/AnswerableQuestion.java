package io.interviews.core.questionnaire.question;

import io.interviews.core.questionnaire.transition.Transition;
import java.util.List;
import java.util.Objects;

/// Question that the respondent answers, defined inline or from a template.
///
/// A FromTemplate question copies the template's body at compile time; its
/// {@link #getAnswerKind() answer kind} is the template's kind, so answer validation,
/// display and the final-capable rule behave exactly as for an inline question of that
/// kind.
public final class AnswerableQuestion extends Question {

    private final QuestionKind kind;
    private final QuestionKind answerKind;
    private final String templateName;
    private final QuestionBody body;

    private AnswerableQuestion(Builder builder, List<Transition> transitions) {
        super(builder.label, transitions);
        this.kind = Objects.requireNonNull(builder.kind, "kind required");
        this.answerKind = Objects.requireNonNull(builder.answerKind, "answerKind required");
        this.templateName = builder.templateName;
        this.body = Objects.requireNonNull(builder.body, "body required");
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public QuestionKind getKind() {
        return kind;
    }

    /// Returns the kind that drives answering and display.
    ///
    /// @return the template's kind for FromTemplate, otherwise {@link #getKind()}
    public QuestionKind getAnswerKind() {
        return answerKind;
    }

    /// Returns the template name for FromTemplate questions.
    ///
    /// @return template name, or null for inline questions
    public String getTemplateName() {
        return templateName;
    }

    public boolean isFromTemplate() {
        return templateName != null;
    }

    public QuestionBody getBody() {
        return body;
    }

    @Override
    public boolean canBeFinal() {
        return answerKind.canBeFinal();
    }

    /// Whether a text function of this question reads the answer to the given question.
    ///
    /// @param label question label, not null
    /// @return true if any text function has it as parameter
    public boolean textReferences(String label) {
        return body.functions().stream().anyMatch(f -> f.references(label));
    }

    @Override
    public AnswerableQuestion withTransitions(List<Transition> transitions) {
        return new AnswerableQuestion(toBuilder(), transitions);
    }

    /// Returns a copy carrying the given body, used to attach text functions.
    ///
    /// @param body the body, not null
    /// @return new question, never null
    public AnswerableQuestion withBody(QuestionBody body) {
        return new AnswerableQuestion(toBuilder().body(body), transitions);
    }

    private Builder toBuilder() {
        return new Builder()
                .label(label)
                .kind(kind)
                .answerKind(answerKind)
                .templateName(templateName)
                .body(body);
    }

    /// Builder for inline and template-based questions.
    ///
    /// Required fields: `label`, `kind`, `body`. `answerKind` defaults to `kind`.
    public static final class Builder {
        private String label;
        private QuestionKind kind;
        private QuestionKind answerKind;
        private String templateName;
        private QuestionBody body;

        private Builder() {}

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder kind(QuestionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder answerKind(QuestionKind answerKind) {
            this.answerKind = answerKind;
            return this;
        }

        public Builder templateName(String templateName) {
            this.templateName = templateName;
            return this;
        }

        public Builder body(QuestionBody body) {
            this.body = body;
            return this;
        }

        /// Builds the question without transitions.
        ///
        /// @return new question, never null
        /// @throws IllegalStateException if the kind is a loop marker or does not match
        /// the body
        public AnswerableQuestion build() {
            if (answerKind == null) {
                answerKind = kind;
            }
            if (kind == null || kind.isLoopMarker()) {
                throw new IllegalStateException("Answerable question needs a non-loop kind");
            }
            if (answerKind == QuestionKind.FROM_TEMPLATE || answerKind.isLoopMarker()) {
                throw new IllegalStateException("Answer kind must be an inline kind");
            }
            if (kind == QuestionKind.FROM_TEMPLATE && templateName == null) {
                throw new IllegalStateException("FromTemplate question needs a template name");
            }
            if (answerKind.hasOptions() != (body instanceof OptionsBody)) {
                throw new IllegalStateException(
                        "Body " + body + " does not match kind " + answerKind);
            }
            return new AnswerableQuestion(this, List.of());
        }
    }
}
