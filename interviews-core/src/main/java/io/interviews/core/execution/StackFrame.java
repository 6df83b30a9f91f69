package io.interviews.core.execution;

import io.interviews.core.interview.Answer;
import io.interviews.core.questionnaire.question.BeginLoopQuestion;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// One open loop: the begin loop, its operand array, the current iteration and the
/// answers recorded at this loop level.
///
/// The answer map keeps only the most recent answer per question, so an iteration sees
/// its own answers and, for questions it has not answered yet, those of the previous
/// iteration.
///
/// @implNote Mutable and not thread-safe; frames live in a {@link LoopStack}.
public final class StackFrame {

    private final BeginLoopQuestion beginLoop;
    private final ScopedAnswer operandAnswer;
    private final List<Object> operand;
    private final Map<String, ScopedAnswer> answers;
    private int index;

    /// Opens a frame at iteration 0.
    ///
    /// @param beginLoop the loop, not null
    /// @param operandAnswer the answer iterated over, may be null if resected
    /// @param operand the operand array, not null, not empty
    public StackFrame(
            BeginLoopQuestion beginLoop, ScopedAnswer operandAnswer, List<Object> operand) {
        this(beginLoop, operandAnswer, operand, new HashMap<>(), 0);
    }

    private StackFrame(
            BeginLoopQuestion beginLoop,
            ScopedAnswer operandAnswer,
            List<Object> operand,
            Map<String, ScopedAnswer> answers,
            int index) {
        this.beginLoop = Objects.requireNonNull(beginLoop, "beginLoop must not be null");
        this.operandAnswer = operandAnswer;
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
        this.answers = answers;
        this.index = index;
    }

    public BeginLoopQuestion getBeginLoop() {
        return beginLoop;
    }

    /// Returns the operand answer.
    ///
    /// @return the answer, or null if its entry was resected
    public ScopedAnswer getOperandAnswer() {
        return operandAnswer;
    }

    public List<Object> getOperand() {
        return operand;
    }

    public int getIndex() {
        return index;
    }

    void setIndex(int index) {
        if (index < 0 || index >= operand.size()) {
            throw new IllegalStateException(
                    "Iteration "
                            + index
                            + " out of range for loop "
                            + beginLoop.getLabel()
                            + " of size "
                            + operand.size());
        }
        this.index = index;
    }

    /// Moves to the next iteration.
    ///
    /// @return true if an iteration remains, false if the loop is exhausted
    boolean increment() {
        index++;
        return index < operand.size();
    }

    public boolean hasNext() {
        return index + 1 < operand.size();
    }

    public String getVariable() {
        return beginLoop.getVariable();
    }

    /// Returns the loop variable value of the current iteration.
    ///
    /// @return element of the operand, may be null
    public Object getVariableValue() {
        return index < operand.size() ? operand.get(index) : null;
    }

    ScopedAnswer findAnswer(String label) {
        return answers.get(label);
    }

    void record(String label, ScopedAnswer answer) {
        answers.put(label, answer);
    }

    StackFrame copy() {
        return new StackFrame(beginLoop, operandAnswer, operand, new HashMap<>(answers), index);
    }

    StackFrame copySubstituting(int position, Answer answer) {
        Map<String, ScopedAnswer> substituted = new HashMap<>(answers);
        substituted.replaceAll((label, a) -> substitute(a, position, answer));
        return new StackFrame(
                beginLoop,
                substitute(operandAnswer, position, answer),
                operand,
                substituted,
                index);
    }

    static ScopedAnswer substitute(ScopedAnswer scoped, int position, Answer answer) {
        return scoped != null && scoped.position() == position
                ? new ScopedAnswer(position, answer)
                : scoped;
    }

    @Override
    public String toString() {
        return "StackFrame{"
                + beginLoop.getLabel()
                + ", index="
                + index
                + "/"
                + operand.size()
                + ", answers="
                + answers.keySet()
                + "}";
    }
}
