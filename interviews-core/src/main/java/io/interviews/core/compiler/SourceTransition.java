package io.interviews.core.compiler;

import java.util.List;

/// Source form of a transition.
///
/// The guard is given either as a `condition` expression or as a `code` body whose
/// completion value decides; both are executed the same way and giving both is an
/// error. With neither the transition is a catch-all.
///
/// @param destination destination label
/// @param condition guard expression, may be empty
/// @param code guard statements, may be empty
/// @param parameters labels of the questions whose answers the guard reads
public record SourceTransition(
        String destination, String condition, String code, List<String> parameters) {

    public SourceTransition {
        destination = destination == null ? "" : destination;
        condition = condition == null ? "" : condition;
        code = code == null ? "" : code;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    /// Creates a catch-all transition.
    ///
    /// @param destination destination label
    /// @return new transition, never null
    public static SourceTransition to(String destination) {
        return new SourceTransition(destination, "", "", List.of());
    }

    /// Creates a transition guarded by a condition expression.
    ///
    /// @param destination destination label
    /// @param condition guard expression
    /// @param parameters labels read by the guard
    /// @return new transition, never null
    public static SourceTransition when(
            String destination, String condition, String... parameters) {
        return new SourceTransition(destination, condition, "", List.of(parameters));
    }

    public boolean isCatchAll() {
        return condition.isEmpty() && code.isEmpty();
    }
}
