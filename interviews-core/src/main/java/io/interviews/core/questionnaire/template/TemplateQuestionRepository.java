package io.interviews.core.questionnaire.template;

import java.util.List;
import java.util.Optional;

/// Storage for the template library: template questions by name and their categories.
///
/// @see InMemoryTemplateQuestionRepository for the default implementation
public interface TemplateQuestionRepository {

    /// Saves a template, replacing any with the same name.
    ///
    /// @param template the template, not null
    void save(TemplateQuestion template);

    /// Finds a template by name.
    ///
    /// @param name template name, not null
    /// @return the template if found
    Optional<TemplateQuestion> findByName(String name);

    /// Lists the templates of a category.
    ///
    /// @param category category name, not null
    /// @return list, never null (may be empty)
    List<TemplateQuestion> findByCategory(String category);

    /// Saves a category, replacing any with the same name.
    ///
    /// @param category the category, not null
    void saveCategory(TemplateQuestionCategory category);

    /// Finds a category by name.
    ///
    /// @param name category name, not null
    /// @return the category if found
    Optional<TemplateQuestionCategory> findCategory(String name);
}
