package io.interviews.core.questionnaire.transition;

import java.util.Objects;
import java.util.Optional;

/// Guarded edge from a question to a later question.
///
/// A transition without condition, or with empty condition code, is unconditional.
/// Transitions are evaluated in order and the first unconditional or truthy one wins.
public final class Transition {

    private final ScriptFunction condition;
    private final String destination;

    private Transition(ScriptFunction condition, String destination) {
        this.condition = condition;
        this.destination = Objects.requireNonNull(destination, "destination must not be null");
    }

    /// Creates a transition taken unconditionally.
    ///
    /// @param destination destination label, not null
    /// @return new transition, never null
    public static Transition to(String destination) {
        return new Transition(null, destination);
    }

    /// Creates a conditional transition.
    ///
    /// @param condition the condition, not null
    /// @param destination destination label, not null
    /// @return new transition, never null
    public static Transition when(ScriptFunction condition, String destination) {
        Objects.requireNonNull(condition, "condition must not be null");
        return new Transition(condition.code().isEmpty() ? null : condition, destination);
    }

    public Optional<ScriptFunction> getCondition() {
        return Optional.ofNullable(condition);
    }

    public String getDestination() {
        return destination;
    }

    public boolean isUnconditional() {
        return condition == null;
    }

    /// Whether the condition reads the answer to the given question.
    ///
    /// @param label question label, not null
    /// @return true if referenced
    public boolean references(String label) {
        return condition != null && condition.references(label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Transition that)) {
            return false;
        }
        return Objects.equals(condition, that.condition) && destination.equals(that.destination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, destination);
    }

    @Override
    public String toString() {
        return condition == null
                ? "Transition{-> " + destination + "}"
                : "Transition{" + condition.code() + " -> " + destination + "}";
    }
}
