package io.interviews.core.questionnaire;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory questionnaire repository (default implementation).
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryQuestionnaireRepository implements QuestionnaireRepository {

    private final Map<String, Questionnaire> storage = new ConcurrentHashMap<>();

    @Override
    public void save(Questionnaire questionnaire) {
        Objects.requireNonNull(questionnaire, "questionnaire must not be null");
        storage.put(questionnaire.getId(), questionnaire);
    }

    @Override
    public Optional<Questionnaire> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(storage.get(id));
    }

    @Override
    public List<Questionnaire> findAll() {
        return List.copyOf(storage.values());
    }

    @Override
    public boolean delete(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return storage.remove(id) != null;
    }
}
