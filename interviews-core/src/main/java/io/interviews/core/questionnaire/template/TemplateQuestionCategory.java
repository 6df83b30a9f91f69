package io.interviews.core.questionnaire.template;

import java.util.Objects;

/// Named group of template questions, e.g. `"demographics"`.
///
/// @param name category name, not null
/// @param description free text, not null (may be empty)
public record TemplateQuestionCategory(String name, String description) {

    public TemplateQuestionCategory {
        Objects.requireNonNull(name, "name must not be null");
        description = description == null ? "" : description;
    }
}
