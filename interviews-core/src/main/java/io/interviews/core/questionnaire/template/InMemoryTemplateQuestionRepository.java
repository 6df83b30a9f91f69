package io.interviews.core.questionnaire.template;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/// In-memory template library (default implementation).
///
/// @implNote Uses ConcurrentHashMap for thread-safety.
public final class InMemoryTemplateQuestionRepository implements TemplateQuestionRepository {

    private final Map<String, TemplateQuestion> templates = new ConcurrentHashMap<>();
    private final Map<String, TemplateQuestionCategory> categories = new ConcurrentHashMap<>();

    @Override
    public void save(TemplateQuestion template) {
        Objects.requireNonNull(template, "template must not be null");
        templates.put(template.getName(), template);
    }

    @Override
    public Optional<TemplateQuestion> findByName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(templates.get(name));
    }

    @Override
    public List<TemplateQuestion> findByCategory(String category) {
        Objects.requireNonNull(category, "category must not be null");
        return templates.values().stream()
                .filter(t -> t.getCategory().equals(category))
                .collect(Collectors.toList());
    }

    @Override
    public void saveCategory(TemplateQuestionCategory category) {
        Objects.requireNonNull(category, "category must not be null");
        categories.put(category.name(), category);
    }

    @Override
    public Optional<TemplateQuestionCategory> findCategory(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(categories.get(name));
    }
}
