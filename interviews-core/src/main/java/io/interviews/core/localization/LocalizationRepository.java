package io.interviews.core.localization;

import java.util.List;
import java.util.Optional;

/// Storage for questionnaire localizations, keyed by questionnaire id and language.
///
/// @see InMemoryLocalizationRepository for the default implementation
public interface LocalizationRepository {

    /// Saves a localization, replacing any for the same questionnaire and language.
    ///
    /// @param localization the localization, not null
    void save(QuestionnaireLocalization localization);

    /// Finds the localization of a questionnaire in a language.
    ///
    /// @param questionnaireId questionnaire id, not null
    /// @param language ISO 639-1 code, not null
    /// @return the localization if found
    Optional<QuestionnaireLocalization> find(String questionnaireId, String language);

    /// Lists every localization of a questionnaire.
    ///
    /// @param questionnaireId questionnaire id, not null
    /// @return list, never null (may be empty)
    List<QuestionnaireLocalization> findAll(String questionnaireId);

    /// Deletes every localization of a questionnaire.
    ///
    /// @param questionnaireId questionnaire id, not null
    /// @return number of localizations deleted
    int deleteAll(String questionnaireId);
}
