package io.interviews.core.execution;

import io.interviews.core.exception.EvaluationException;
import io.interviews.core.execution.history.History;
import io.interviews.core.execution.history.HistoryEntry;
import io.interviews.core.execution.history.HistoryEntry.AnswerEntry;
import io.interviews.core.execution.history.HistoryEntry.BeginLoopMark;
import io.interviews.core.execution.history.HistoryEntry.EndLoopMark;
import io.interviews.core.interview.Answer;
import io.interviews.core.questionnaire.Questionnaire;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.BeginLoopQuestion;
import io.interviews.core.questionnaire.question.EndLoopQuestion;
import io.interviews.core.questionnaire.question.Question;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Walks a compiled questionnaire forward, skipping loop markers.
///
/// The respondent only ever sees answerable questions. Between two of them the engine
/// crosses any number of loop markers, recording each crossing in the history:
///
/// - entering a loop with a non-empty operand pushes a frame and records
///   `BeginLoopMark(0)`; an empty operand skips straight to the end loop's transitions
///   and records nothing
/// - reaching an end loop records `EndLoopMark`; if an iteration remains the engine
///   records `BeginLoopMark(n)` and runs the loop body again, otherwise it pops the frame
///   and follows the end loop's transitions
///
/// The loop stack is never stored. {@link #replay} rebuilds it from the history alone,
/// re-evaluating the loop operands.
///
/// ### Contracts
/// - **Precondition**: the questionnaire compiled successfully (acyclic, balanced loops,
///   a catch-all on every non-final question)
/// - **Postcondition** of every walk: the returned question is answerable and the stack
///   matches a replay of the history
///
/// @implNote Stateless; thread-safe. Callers own the {@link History} and
/// {@link LoopStack} they pass in.
/// @see RevisionEngine
public class InterviewEngine {

    private static final Logger logger = Logger.getLogger(InterviewEngine.class.getName());

    private final QuestionEvaluator evaluator;
    private final Questionnaire questionnaire;

    public InterviewEngine(QuestionEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.questionnaire = evaluator.getContext().getQuestionnaire();
    }

    public QuestionEvaluator getEvaluator() {
        return evaluator;
    }

    /// Positions a new interview on its first answerable question.
    ///
    /// @apiNote **Side effects**: records the loop marks crossed before that question
    ///
    /// @param history an empty history, not null
    /// @param stack an empty stack, not null
    /// @return first answerable question, never null
    /// @throws EvaluationException if a script fails
    public AnswerableQuestion start(History history, LoopStack stack) throws EvaluationException {
        return resolve(stack, history, skipEmptyLoops(stack, questionnaire.getFirstQuestion()));
    }

    /// Records an answer and moves to the next answerable question.
    ///
    /// @apiNote **Side effects**: appends the answer and the loop marks crossed
    ///
    /// @param history the interview history, not null
    /// @param stack stack matching the history, not null
    /// @param answer answer to the current question, already validated, not null
    /// @return next answerable question, never null
    /// @throws EvaluationException if a script fails
    public AnswerableQuestion submit(History history, LoopStack stack, Answer answer)
            throws EvaluationException {
        int position = history.append(new AnswerEntry(answer));
        stack.record(new ScopedAnswer(position, answer));
        logger.fine("Recorded answer to " + answer.label() + " at " + position);
        return advance(history, stack, questionnaire.getQuestion(answer.label()));
    }

    /// Moves from a question whose history entry was just recorded.
    ///
    /// @param history the interview history, not null
    /// @param stack stack matching the history, not null
    /// @param from the question of the last entry, not null
    /// @return next answerable question, never null
    /// @throws EvaluationException if a script fails
    public AnswerableQuestion advance(History history, LoopStack stack, Question from)
            throws EvaluationException {
        return resolve(stack, history, nextRecordable(stack, from));
    }

    /// Computes the question to display after a history without changing anything.
    ///
    /// @param history the interview history, not null
    /// @return the question and the stack at that question, never null
    /// @throws EvaluationException if a script fails
    public Cursor lookahead(History history) throws EvaluationException {
        LoopStack stack = replay(history, history.size());
        Question dest = history.isEmpty()
                ? skipEmptyLoops(stack, questionnaire.getFirstQuestion())
                : nextRecordable(stack, questionOf(history.get(history.size() - 1)));
        return new Cursor(resolve(stack, null, dest), stack);
    }

    /// Rebuilds the loop stack of a history prefix.
    ///
    /// @param history the history, not null
    /// @param end number of leading entries to replay
    /// @return new stack, never null
    /// @throws EvaluationException if a loop operand cannot be re-evaluated
    public LoopStack replay(History history, int end) throws EvaluationException {
        LoopStack stack = new LoopStack();
        for (int i = 0; i < end; i++) {
            apply(stack, history, history.get(i), i);
        }
        return stack;
    }

    /// Folds one history entry into a stack.
    ///
    /// A begin loop mark for the loop on top of the stack selects the iteration; any
    /// other begin loop mark opens a frame. An end loop mark moves to the next
    /// iteration, popping the frame once the operand is exhausted.
    ///
    /// @param stack the stack, not null
    /// @param history history the entry belongs to, null in lookahead
    /// @param entry the entry, not null
    /// @param position index of the entry
    /// @throws EvaluationException if a loop operand cannot be evaluated
    public void apply(LoopStack stack, History history, HistoryEntry entry, int position)
            throws EvaluationException {
        if (entry instanceof AnswerEntry ae) {
            stack.record(new ScopedAnswer(position, ae.answer()));
        } else if (entry instanceof BeginLoopMark mark) {
            BeginLoopQuestion beginLoop =
                    (BeginLoopQuestion) questionnaire.getQuestion(mark.label());
            Optional<StackFrame> top = stack.top();
            if (top.isPresent() && top.get().getBeginLoop().equals(beginLoop)) {
                top.get().setIndex(mark.iterationIndex());
                return;
            }
            ScopedAnswer operand = resolveOperand(stack, history, mark, beginLoop);
            List<Object> array = evaluator.computeLoopOperand(
                    stack, beginLoop, operand == null ? null : operand.answer());
            if (mark.iterationIndex() >= array.size()) {
                logger.severe(
                        "Begin loop mark "
                                + mark
                                + " does not fit an operand of size "
                                + array.size());
                throw new IllegalStateException("Inconsistent begin loop mark " + mark);
            }
            StackFrame frame = new StackFrame(beginLoop, operand, array);
            frame.setIndex(mark.iterationIndex());
            stack.push(frame);
        } else if (entry instanceof EndLoopMark mark) {
            EndLoopQuestion endLoop = (EndLoopQuestion) questionnaire.getQuestion(mark.label());
            BeginLoopQuestion beginLoop = questionnaire.getMatchingBeginLoop(endLoop);
            StackFrame frame = stack.top()
                    .filter(f -> f.getBeginLoop().equals(beginLoop))
                    .orElseThrow(() -> {
                        logger.severe("End loop mark " + mark + " without open loop in " + stack);
                        return new IllegalStateException("Unmatched end loop mark " + mark);
                    });
            if (!frame.increment()) {
                stack.pop();
            }
        }
    }

    /// Whether the loop on top of the stack is the given one, i.e. reaching the begin loop
    /// starts another iteration rather than entering the loop.
    ///
    /// @param stack the stack, not null
    /// @param beginLoop the loop, not null
    /// @return true if iterating
    public boolean isIterating(LoopStack stack, BeginLoopQuestion beginLoop) {
        return stack.top().map(f -> f.getBeginLoop().equals(beginLoop)).orElse(false);
    }

    /// Computes the next question to record after a question, without recording.
    ///
    /// An end loop whose loop has iterations left leads back to its begin loop. Loops
    /// with an empty operand are skipped.
    ///
    /// @param stack stack after the question's entry was folded in, not null
    /// @param from the question, not null
    /// @return the next answerable question or loop marker, never null
    /// @throws EvaluationException if a script fails
    public Question nextRecordable(LoopStack stack, Question from) throws EvaluationException {
        if (from instanceof EndLoopQuestion endLoop) {
            BeginLoopQuestion beginLoop = questionnaire.getMatchingBeginLoop(endLoop);
            if (isIterating(stack, beginLoop)) {
                return beginLoop;
            }
        }
        return skipEmptyLoops(stack, evaluator.runTransitions(stack, from));
    }

    /// Resolves a destination to an answerable question, recording loop marks.
    ///
    /// @param stack the stack, not null
    /// @param history history receiving the marks, null to record nothing
    /// @param destination a question returned by {@link #nextRecordable}, not null
    /// @return the answerable question reached, never null
    /// @throws EvaluationException if a script fails
    public AnswerableQuestion resolve(LoopStack stack, History history, Question destination)
            throws EvaluationException {
        Question current = destination;
        while (!(current instanceof AnswerableQuestion)) {
            HistoryEntry mark = markFor(stack, current);
            int position = history == null ? -1 : history.append(mark);
            logger.fine("Crossing " + mark);
            apply(stack, history, mark, position);
            current = nextRecordable(stack, current);
        }
        return (AnswerableQuestion) current;
    }

    /// Returns the question an entry records.
    ///
    /// @param entry history entry, not null
    /// @return the question, never null
    public Question questionOf(HistoryEntry entry) {
        return questionnaire.getQuestion(entry.label());
    }

    private Question skipEmptyLoops(LoopStack stack, Question destination)
            throws EvaluationException {
        Question dest = destination;
        while (dest instanceof BeginLoopQuestion beginLoop && !isIterating(stack, beginLoop)) {
            Answer operand = stack.findAnswer(beginLoop.getOperandLabel())
                    .map(ScopedAnswer::answer)
                    .orElse(null);
            if (!evaluator.computeLoopOperand(stack, beginLoop, operand).isEmpty()) {
                break;
            }
            logger.fine("Loop " + beginLoop.getLabel() + " has nothing to iterate over, skipped");
            dest = evaluator.runTransitions(stack, questionnaire.findMatchingEndLoop(beginLoop));
        }
        return dest;
    }

    private HistoryEntry markFor(LoopStack stack, Question marker) {
        if (marker instanceof EndLoopQuestion) {
            return new EndLoopMark(marker.getLabel());
        }
        BeginLoopQuestion beginLoop = (BeginLoopQuestion) marker;
        if (isIterating(stack, beginLoop)) {
            StackFrame frame = stack.top().orElseThrow();
            return new BeginLoopMark(
                    beginLoop.getLabel(),
                    operandPosition(frame.getOperandAnswer()),
                    frame.getIndex());
        }
        return new BeginLoopMark(
                beginLoop.getLabel(),
                operandPosition(stack.findAnswer(beginLoop.getOperandLabel()).orElse(null)),
                0);
    }

    private static int operandPosition(ScopedAnswer operand) {
        return operand == null ? BeginLoopMark.DANGLING : operand.position();
    }

    private ScopedAnswer resolveOperand(
            LoopStack stack, History history, BeginLoopMark mark, BeginLoopQuestion beginLoop) {
        Optional<ScopedAnswer> visible = stack.findAnswer(beginLoop.getOperandLabel());
        int ref = mark.operandAnswerIndex();
        if (visible.isPresent() && visible.get().position() == ref) {
            return visible.get();
        }
        if (history != null) {
            Optional<Answer> recorded = history.findAnswer(ref)
                    .filter(a -> a.label().equals(beginLoop.getOperandLabel()));
            if (recorded.isPresent()) {
                return new ScopedAnswer(ref, recorded.get());
            }
        }
        if (ref != BeginLoopMark.DANGLING) {
            logger.warning(
                    "Operand reference " + ref + " of " + mark + " does not designate an answer");
        } else {
            logger.fine("Dangling operand reference in " + mark + ", using the visible answer");
        }
        return visible.orElse(null);
    }

    /// A position in an interview: the question to display and the stack at it.
    ///
    /// @param question the answerable question, not null
    /// @param stack loop stack at that question, not null
    public record Cursor(AnswerableQuestion question, LoopStack stack) {}
}
