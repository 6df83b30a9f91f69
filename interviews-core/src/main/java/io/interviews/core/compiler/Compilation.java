package io.interviews.core.compiler;

import io.interviews.core.localization.QuestionnaireLocalization;
import io.interviews.core.questionnaire.Questionnaire;
import java.util.Objects;

/// Result of a successful compilation.
///
/// @param questionnaire the compiled graph, not null
/// @param localization the localization in the source language, not null
public record Compilation(Questionnaire questionnaire, QuestionnaireLocalization localization) {

    public Compilation {
        Objects.requireNonNull(questionnaire, "questionnaire must not be null");
        Objects.requireNonNull(localization, "localization must not be null");
    }
}
