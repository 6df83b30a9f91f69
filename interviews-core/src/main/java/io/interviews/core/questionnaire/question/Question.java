package io.interviews.core.questionnaire.question;

import io.interviews.core.questionnaire.transition.Transition;
import java.util.List;
import java.util.Objects;

/// Node of a compiled questionnaire graph.
///
/// Questions are addressed by label. Transitions name their destination by label and
/// are resolved through the owning {@link io.interviews.core.questionnaire.Questionnaire}.
///
/// ### Permitted Subtypes
/// - {@link AnswerableQuestion} - Message, Input, the option kinds and FromTemplate
/// - {@link BeginLoopQuestion} - opens a loop over an operand array
/// - {@link EndLoopQuestion} - closes the innermost open loop
///
/// @implNote Immutable and thread-safe. The compiler attaches transitions through
/// {@link #withTransitions(List)}, which returns a copy.
///
/// @see QuestionKind for the behavior table
public abstract sealed class Question
        permits AnswerableQuestion, BeginLoopQuestion, EndLoopQuestion {

    protected final String label;
    protected final List<Transition> transitions;

    protected Question(String label, List<Transition> transitions) {
        this.label = Objects.requireNonNull(label, "label must not be null");
        this.transitions = List.copyOf(transitions);
    }

    /// Returns the unique question label.
    ///
    /// @return label, never null
    public String getLabel() {
        return label;
    }

    /// Returns the structural kind.
    ///
    /// @return kind, never null
    public abstract QuestionKind getKind();

    /// Returns the ordered transitions.
    ///
    /// @return immutable list, never null (empty for final questions)
    public List<Transition> getTransitions() {
        return transitions;
    }

    /// Whether the kind allows the interview to end here.
    ///
    /// @return true for messages, directly or through a template
    public boolean canBeFinal() {
        return false;
    }

    /// Whether reaching this question completes the interview.
    ///
    /// @return true if final-capable and without transitions
    public boolean isFinal() {
        return canBeFinal() && transitions.isEmpty();
    }

    /// Returns a copy carrying the given transitions.
    ///
    /// @param transitions the transitions, not null
    /// @return new question, never null
    public abstract Question withTransitions(List<Transition> transitions);

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Question q)) return false;
        return label.equals(q.label) && getKind() == q.getKind();
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, getKind());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{label='" + label + "'}";
    }
}
