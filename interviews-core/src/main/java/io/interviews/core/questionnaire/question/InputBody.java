package io.interviews.core.questionnaire.question;

import io.interviews.core.questionnaire.transition.ScriptFunction;
import java.util.List;
import java.util.Objects;

/// Body of a free text question.
///
/// @param style display style, not null
/// @param hasComment whether a comment may accompany the input
/// @param optional whether an empty input is accepted
/// @param functions text functions, not null
public record InputBody(
        String style, boolean hasComment, boolean optional, List<ScriptFunction> functions)
        implements QuestionBody {

    public InputBody {
        Objects.requireNonNull(style, "style must not be null");
        functions = List.copyOf(functions);
    }

    public InputBody(String style, boolean hasComment, boolean optional) {
        this(style, hasComment, optional, List.of());
    }

    @Override
    public InputBody withFunctions(List<ScriptFunction> functions) {
        return new InputBody(style, hasComment, optional, functions);
    }
}
