package io.interviews.core.questionnaire.question;

import io.interviews.core.questionnaire.transition.ScriptFunction;
import java.util.List;
import java.util.Objects;

/// Body of a message. The only body that can end an interview.
///
/// @param style display style, not null
/// @param functions text functions, not null
public record MessageBody(String style, List<ScriptFunction> functions) implements QuestionBody {

    public MessageBody {
        Objects.requireNonNull(style, "style must not be null");
        functions = List.copyOf(functions);
    }

    public MessageBody(String style) {
        this(style, List.of());
    }

    @Override
    public boolean hasComment() {
        return false;
    }

    @Override
    public MessageBody withFunctions(List<ScriptFunction> functions) {
        return new MessageBody(style, functions);
    }
}
