package io.interviews.core.questionnaire.transition;

import java.util.List;
import java.util.Objects;

/// A script plus the labels of the questions whose answers it reads.
///
/// Used for transition conditions and for text functions. Before execution each
/// parameter is declared under its question label, bound to the most recent visible
/// answer data for that question, or `null` if unanswered.
///
/// @param code script source, not null
/// @param parameters question labels, not null
public record ScriptFunction(String code, List<String> parameters) {

    public ScriptFunction {
        Objects.requireNonNull(code, "code must not be null");
        parameters = List.copyOf(parameters);
    }

    public ScriptFunction(String code) {
        this(code, List.of());
    }

    /// Whether the function reads the answer to the given question.
    ///
    /// @param label question label, not null
    /// @return true if the label is a parameter
    public boolean references(String label) {
        return parameters.contains(label);
    }
}
