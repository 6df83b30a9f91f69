package io.interviews.core.execution;

import io.interviews.core.expression.ExpressionEvaluator;
import io.interviews.core.localization.QuestionnaireLocalization;
import io.interviews.core.questionnaire.Questionnaire;
import io.interviews.core.questionnaire.template.TemplateQuestionRepository;
import io.interviews.core.text.ParametricTextResolver;
import io.interviews.core.text.TextResolver;
import java.util.Objects;

/// Immutable bundle of everything an engine walk needs besides the mutable stack and
/// history: the compiled graph, the respondent's localization and the script runtime.
///
/// @implNote Thread-safe. Shared by every walk of interviews in the same language.
public final class ExecutionContext {

    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 1000;

    private final Questionnaire questionnaire;
    private final QuestionnaireLocalization localization;
    private final TemplateQuestionRepository templates;
    private final ExpressionEvaluator evaluator;
    private final TextResolver textResolver;
    private final int maxLoopIterations;

    private ExecutionContext(Builder builder) {
        this.questionnaire =
                Objects.requireNonNull(builder.questionnaire, "Questionnaire required");
        this.localization = Objects.requireNonNull(builder.localization, "Localization required");
        this.templates = Objects.requireNonNull(builder.templates, "Template repository required");
        this.evaluator = Objects.requireNonNull(builder.evaluator, "Evaluator required");
        this.textResolver = builder.textResolver != null
                ? builder.textResolver
                : new ParametricTextResolver();
        this.maxLoopIterations = builder.maxLoopIterations;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Questionnaire getQuestionnaire() {
        return questionnaire;
    }

    public QuestionnaireLocalization getLocalization() {
        return localization;
    }

    /// Returns the ISO 639-1 language of the localization.
    ///
    /// @return language code, never null
    public String getLanguage() {
        return localization.getLanguage();
    }

    public TemplateQuestionRepository getTemplates() {
        return templates;
    }

    public ExpressionEvaluator getEvaluator() {
        return evaluator;
    }

    public TextResolver getTextResolver() {
        return textResolver;
    }

    /// Returns the largest operand array a loop may iterate over.
    ///
    /// @return positive bound
    public int getMaxLoopIterations() {
        return maxLoopIterations;
    }

    public static final class Builder {
        private Questionnaire questionnaire;
        private QuestionnaireLocalization localization;
        private TemplateQuestionRepository templates;
        private ExpressionEvaluator evaluator;
        private TextResolver textResolver;
        private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;

        private Builder() {}

        public Builder questionnaire(Questionnaire questionnaire) {
            this.questionnaire = questionnaire;
            return this;
        }

        public Builder localization(QuestionnaireLocalization localization) {
            this.localization = localization;
            return this;
        }

        public Builder templates(TemplateQuestionRepository templates) {
            this.templates = templates;
            return this;
        }

        public Builder evaluator(ExpressionEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder textResolver(TextResolver textResolver) {
            this.textResolver = textResolver;
            return this;
        }

        public Builder maxLoopIterations(int maxLoopIterations) {
            if (maxLoopIterations <= 0) {
                throw new IllegalArgumentException("maxLoopIterations must be positive");
            }
            this.maxLoopIterations = maxLoopIterations;
            return this;
        }

        public ExecutionContext build() {
            return new ExecutionContext(this);
        }
    }
}
