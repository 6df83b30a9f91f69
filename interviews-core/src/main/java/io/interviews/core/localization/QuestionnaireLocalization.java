package io.interviews.core.localization;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.QuestionnaireValidationException;
import io.interviews.core.questionnaire.Questionnaire;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.Question;
import io.interviews.core.questionnaire.template.TemplateQuestion;
import io.interviews.core.questionnaire.template.TemplateQuestionRepository;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// All texts of a questionnaire in one language.
///
/// Questions from templates normally borrow the template's localization for the same
/// language; an entry here for such a question takes precedence.
///
/// ### Contracts
/// - **Invariant**: at most one localization per question label
/// - **Postcondition** of {@link #check}: every answerable question can be displayed in
///   this language
///
/// @implNote Immutable apart from the memoized check marker.
public final class QuestionnaireLocalization {

    private static final Logger logger =
            Logger.getLogger(QuestionnaireLocalization.class.getName());

    private final String questionnaireId;
    private final String language;
    private final String title;
    private final String name;
    private final Map<String, QuestionLocalization> questions;

    private long checkedAtChange = -1;

    private QuestionnaireLocalization(Builder builder) {
        this.questionnaireId =
                Objects.requireNonNull(builder.questionnaireId, "Questionnaire ID required");
        this.language = Objects.requireNonNull(builder.language, "Language required");
        this.title = builder.title == null ? "" : builder.title;
        this.name = Objects.requireNonNull(builder.name, "Name required");
        this.questions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.questions));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getQuestionnaireId() {
        return questionnaireId;
    }

    /// Returns the ISO 639-1 language code.
    ///
    /// @return language, never null
    public String getLanguage() {
        return language;
    }

    public String getTitle() {
        return title;
    }

    public String getName() {
        return name;
    }

    /// Returns the question localizations held directly by this localization.
    ///
    /// @return immutable map keyed by label, never null
    public Map<String, QuestionLocalization> getQuestions() {
        return questions;
    }

    /// Resolves the localization to display a question.
    ///
    /// @param question answerable question, not null
    /// @param templates template library consulted for FromTemplate questions, not null
    /// @return the localization, empty if missing
    public Optional<QuestionLocalization> findQuestionLocalization(
            AnswerableQuestion question, TemplateQuestionRepository templates) {
        QuestionLocalization own = questions.get(question.getLabel());
        if (own != null || !question.isFromTemplate()) {
            return Optional.ofNullable(own);
        }
        return templates
                .findByName(question.getTemplateName())
                .flatMap(t -> t.findLocalization(language));
    }

    /// Returns a copy of this localization attached to another questionnaire.
    ///
    /// @param newQuestionnaireId the target questionnaire id, not null
    /// @return new localization, never null
    public QuestionnaireLocalization copyFor(String newQuestionnaireId) {
        Builder b = builder().questionnaireId(newQuestionnaireId).language(language).title(title);
        b.name(name);
        b.questions.putAll(questions);
        return b.build();
    }

    /// Checks that this localization covers the questionnaire.
    ///
    /// Every answerable question must be localized here or, for template questions, in
    /// the template library. Each localization is checked against the question body.
    /// Loop markers need no text. The result is memoized by the questionnaire's change
    /// counter.
    ///
    /// @param questionnaire the localized questionnaire, not null
    /// @param templates template library, not null
    /// @throws QuestionnaireValidationException naming the first faulty question
    public synchronized void check(Questionnaire questionnaire, TemplateQuestionRepository templates)
            throws QuestionnaireValidationException {
        long change = questionnaire.getChangeCount();
        if (checkedAtChange == change) {
            return;
        }
        for (String label : questions.keySet()) {
            Optional<Question> q = questionnaire.findQuestion(label);
            if (q.isEmpty() || !(q.get() instanceof AnswerableQuestion)) {
                throw new QuestionnaireValidationException(
                        ErrorCode.QUESTION_LABEL_DOES_NOT_EXIST, label);
            }
        }
        for (Question q : questionnaire.getQuestions()) {
            if (!(q instanceof AnswerableQuestion aq)) {
                continue;
            }
            Optional<QuestionLocalization> ql = findQuestionLocalization(aq, templates);
            if (ql.isEmpty()) {
                throw new QuestionnaireValidationException(
                        aq.isFromTemplate() && !questions.containsKey(aq.getLabel())
                                ? ErrorCode.TEMPLATE_QUESTION_LOCALIZATION_DOES_NOT_EXIST
                                : ErrorCode.QUESTION_LOCALIZATION_DOES_NOT_EXIST,
                        aq.getLabel());
            }
            ql.get().check(aq.getLabel(), aq.getBody());
        }
        checkedAtChange = change;
        logger.fine(
                "Localization "
                        + language
                        + " of questionnaire "
                        + questionnaireId
                        + " checked at change "
                        + change);
    }

    /// Builder for localizations. Required fields: `questionnaireId`, `language`, `name`.
    public static final class Builder {
        private String questionnaireId;
        private String language;
        private String title;
        private String name;
        private final Map<String, QuestionLocalization> questions = new LinkedHashMap<>();

        private Builder() {}

        public Builder questionnaireId(String questionnaireId) {
            this.questionnaireId = questionnaireId;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /// Adds the localization of one question.
        ///
        /// @param label question label, not null
        /// @param localization the localization, not null
        /// @return this builder for chaining
        /// @throws QuestionnaireValidationException if the label is already localized
        public Builder question(String label, QuestionLocalization localization)
                throws QuestionnaireValidationException {
            if (questions.putIfAbsent(label, localization) != null) {
                throw new QuestionnaireValidationException(
                        ErrorCode.QUESTION_LOCALIZATION_IS_DUPLICATE, label);
            }
            return this;
        }

        public QuestionnaireLocalization build() {
            return new QuestionnaireLocalization(this);
        }
    }
}
