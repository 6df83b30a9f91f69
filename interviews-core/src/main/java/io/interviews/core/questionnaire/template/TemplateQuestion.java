package io.interviews.core.questionnaire.template;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.QuestionnaireValidationException;
import io.interviews.core.localization.QuestionLocalization;
import io.interviews.core.questionnaire.question.OptionsBody;
import io.interviews.core.questionnaire.question.QuestionBody;
import io.interviews.core.questionnaire.question.QuestionKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Reusable question definition shared across questionnaires.
///
/// A template has an inline kind, a body without text functions and one localization
/// per language. Questionnaires refer to it by name through FromTemplate questions.
///
/// @implNote Immutable. Adding a localization returns a copy; localizations can be
/// replaced but never removed, so a questionnaire localization that once checked
/// stays valid.
public final class TemplateQuestion {

    private final String name;
    private final String category;
    private final QuestionKind kind;
    private final QuestionBody body;
    private final Map<String, QuestionLocalization> localizations;

    private TemplateQuestion(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Template name required");
        this.category = Objects.requireNonNull(builder.category, "Template category required");
        this.kind = Objects.requireNonNull(builder.kind, "Template kind required");
        this.body = Objects.requireNonNull(builder.body, "Template body required");
        this.localizations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.localizations));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public String getCategory() {
        return category;
    }

    public QuestionKind getKind() {
        return kind;
    }

    public QuestionBody getBody() {
        return body;
    }

    public Map<String, QuestionLocalization> getLocalizations() {
        return localizations;
    }

    public Optional<QuestionLocalization> findLocalization(String language) {
        return Optional.ofNullable(localizations.get(language));
    }

    /// Returns a copy with a localization added or replaced.
    ///
    /// @param language ISO 639-1 code, not null
    /// @param localization the localization, not null
    /// @return new template, never null
    /// @throws QuestionnaireValidationException if the localization does not fit the body
    public TemplateQuestion withLocalization(String language, QuestionLocalization localization)
            throws QuestionnaireValidationException {
        localization.check(name, body);
        Builder b = toBuilder();
        b.localizations.put(language, localization);
        return b.build();
    }

    /// Validates the template's own structure.
    ///
    /// @throws QuestionnaireValidationException if the kind is not an inline answerable
    /// kind, the options are inconsistent, or a localization does not fit the body
    public void validate() throws QuestionnaireValidationException {
        if (kind == QuestionKind.FROM_TEMPLATE || kind.isLoopMarker()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.TEMPLATE_QUESTION_IS_INVALID, name);
        }
        if (kind.hasOptions() != (body instanceof OptionsBody)) {
            throw new QuestionnaireValidationException(
                    ErrorCode.QUESTION_HAS_INVALID_OPTIONS, name);
        }
        if (body instanceof OptionsBody ob) {
            int n = ob.options().size();
            if (n < 2 || (kind.isMultipleChoice() && (ob.limit() <= 1 || ob.limit() > n))) {
                throw new QuestionnaireValidationException(
                        ErrorCode.QUESTION_HAS_INVALID_OPTIONS, name);
            }
        }
        if (!body.functions().isEmpty()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.TEMPLATE_QUESTION_IS_INVALID, name);
        }
        for (QuestionLocalization ql : localizations.values()) {
            ql.check(name, body);
        }
    }

    private Builder toBuilder() {
        Builder b = builder().name(name).category(category).kind(kind).body(body);
        b.localizations.putAll(localizations);
        return b;
    }

    /// Builder for templates. Required fields: `name`, `category`, `kind`, `body`.
    public static final class Builder {
        private String name;
        private String category;
        private QuestionKind kind;
        private QuestionBody body;
        private final Map<String, QuestionLocalization> localizations = new LinkedHashMap<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder kind(QuestionKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder body(QuestionBody body) {
            this.body = body;
            return this;
        }

        public Builder localization(String language, QuestionLocalization localization) {
            this.localizations.put(language, localization);
            return this;
        }

        public TemplateQuestion build() {
            return new TemplateQuestion(this);
        }
    }
}
