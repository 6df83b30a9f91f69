package io.interviews.core.questionnaire.question;

import io.interviews.core.questionnaire.transition.Transition;
import java.util.List;
import java.util.Objects;

/// Opens a loop iterating over an array derived from an earlier answer.
///
/// The operand script runs with the operand question's localized answer data declared
/// under the operand label and must assign the array to `R`. Each element is bound in
/// turn to the loop variable, visible to the loop body's texts.
public final class BeginLoopQuestion extends Question {

    private final String operandLabel;
    private final String operandCode;
    private final String variable;

    /// Creates a begin loop without transitions.
    ///
    /// @param label question label, not null
    /// @param operandLabel label of the question whose answer is iterated, not null
    /// @param operandCode script assigning the array to `R`, not null
    /// @param variable loop variable name, not null
    public BeginLoopQuestion(
            String label, String operandLabel, String operandCode, String variable) {
        this(label, operandLabel, operandCode, variable, List.of());
    }

    private BeginLoopQuestion(
            String label,
            String operandLabel,
            String operandCode,
            String variable,
            List<Transition> transitions) {
        super(label, transitions);
        this.operandLabel = Objects.requireNonNull(operandLabel, "operandLabel required");
        this.operandCode = Objects.requireNonNull(operandCode, "operandCode required");
        this.variable = Objects.requireNonNull(variable, "variable required");
    }

    @Override
    public QuestionKind getKind() {
        return QuestionKind.BEGIN_LOOP;
    }

    public String getOperandLabel() {
        return operandLabel;
    }

    public String getOperandCode() {
        return operandCode;
    }

    public String getVariable() {
        return variable;
    }

    @Override
    public BeginLoopQuestion withTransitions(List<Transition> transitions) {
        return new BeginLoopQuestion(label, operandLabel, operandCode, variable, transitions);
    }
}
