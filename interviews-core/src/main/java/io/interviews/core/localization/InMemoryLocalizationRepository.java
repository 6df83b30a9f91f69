package io.interviews.core.localization;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory localization repository (default implementation).
///
/// ### Storage Structure
/// Uses nested maps: questionnaireId -> language -> localization
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryLocalizationRepository implements LocalizationRepository {

    private final Map<String, Map<String, QuestionnaireLocalization>> storage =
            new ConcurrentHashMap<>();

    @Override
    public void save(QuestionnaireLocalization localization) {
        Objects.requireNonNull(localization, "localization must not be null");
        storage.computeIfAbsent(localization.getQuestionnaireId(), k -> new ConcurrentHashMap<>())
                .put(localization.getLanguage(), localization);
    }

    @Override
    public Optional<QuestionnaireLocalization> find(String questionnaireId, String language) {
        Objects.requireNonNull(questionnaireId, "questionnaireId must not be null");
        Objects.requireNonNull(language, "language must not be null");
        Map<String, QuestionnaireLocalization> byLanguage = storage.get(questionnaireId);
        if (byLanguage == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byLanguage.get(language));
    }

    @Override
    public List<QuestionnaireLocalization> findAll(String questionnaireId) {
        Objects.requireNonNull(questionnaireId, "questionnaireId must not be null");
        Map<String, QuestionnaireLocalization> byLanguage = storage.get(questionnaireId);
        if (byLanguage == null) {
            return List.of();
        }
        return List.copyOf(byLanguage.values());
    }

    @Override
    public int deleteAll(String questionnaireId) {
        Objects.requireNonNull(questionnaireId, "questionnaireId must not be null");
        Map<String, QuestionnaireLocalization> removed = storage.remove(questionnaireId);
        return removed == null ? 0 : removed.size();
    }
}
