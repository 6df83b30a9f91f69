package io.interviews.core.compiler;

import java.util.List;

/// Flat, label-addressed questionnaire definition submitted for compilation.
///
/// @param name questionnaire name, not empty
/// @param language ISO 639-1 code of the inline texts
/// @param title title in that language, may be empty
/// @param questions questions in structural order, not empty
public record SourceQuestionnaire(
        String name, String language, String title, List<SourceQuestion> questions) {

    public SourceQuestionnaire {
        name = name == null ? "" : name;
        title = title == null ? "" : title;
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
