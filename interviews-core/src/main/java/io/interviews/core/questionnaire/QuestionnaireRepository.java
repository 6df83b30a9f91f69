package io.interviews.core.questionnaire;

import java.util.List;
import java.util.Optional;

/// Storage for compiled questionnaires.
///
/// @see InMemoryQuestionnaireRepository for the default implementation
public interface QuestionnaireRepository {

    /// Saves a questionnaire, replacing any with the same id.
    ///
    /// @param questionnaire the questionnaire, not null
    void save(Questionnaire questionnaire);

    /// Finds a questionnaire by id.
    ///
    /// @param id questionnaire id, not null
    /// @return the questionnaire if found, empty otherwise
    Optional<Questionnaire> findById(String id);

    /// Lists all questionnaires.
    ///
    /// @return list, never null (may be empty)
    List<Questionnaire> findAll();

    /// Deletes a questionnaire.
    ///
    /// @param id questionnaire id, not null
    /// @return true if it existed
    boolean delete(String id);
}
