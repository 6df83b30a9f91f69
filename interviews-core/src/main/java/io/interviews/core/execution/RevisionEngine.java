package io.interviews.core.execution;

import io.interviews.core.exception.EvaluationException;
import io.interviews.core.execution.history.History;
import io.interviews.core.execution.history.HistoryEntry;
import io.interviews.core.execution.history.HistoryEntry.AnswerEntry;
import io.interviews.core.execution.history.HistoryEntry.BeginLoopMark;
import io.interviews.core.execution.history.HistoryEntry.EndLoopMark;
import io.interviews.core.interview.Answer;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.BeginLoopQuestion;
import io.interviews.core.questionnaire.question.Question;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Replaces a past answer while keeping as much of the recorded path as stays valid.
///
/// The new answer is grafted in place, then the engine walks forward from it and
/// compares, at each step, the entry the questionnaire now leads to with the recorded
/// one:
///
/// - same entry: kept, unless it is impacted by the edit and renders differently under
///   the old and the new answer, in which case the history is cut there
/// - different entry found further down: the entries in between are resected and the
///   walk resumes at the found entry
/// - no such entry: the history is cut and the walk ends
///
/// An entry is impacted when it is a loop entry iterating over the edited question, or
/// an answer whose question's text functions take the edited question as a parameter.
/// Once the history is exhausted the walk resolves the next answerable question,
/// recording the loop marks it crosses.
///
/// ### Contracts
/// - **Precondition**: `position` designates an answer entry and the new answer was
///   validated against its question
/// - **Postcondition**: the input history is untouched; the returned history is a
///   consistent replay target
/// - Revising to an identical answer resects nothing
///
/// @implNote Works on a copy. The caller commits with {@link History#replaceWith}.
public class RevisionEngine {

    private static final Logger logger = Logger.getLogger(RevisionEngine.class.getName());

    private final InterviewEngine engine;
    private final QuestionEvaluator evaluator;

    public RevisionEngine(InterviewEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.evaluator = engine.getEvaluator();
    }

    /// Revises the answer at a history index.
    ///
    /// @param history the committed history, not modified, not null
    /// @param position index of the revised answer entry
    /// @param revised the new answer, same question label, not null
    /// @return the revised history and the question to display next, never null
    /// @throws EvaluationException if a script fails during the walk
    /// @throws IllegalArgumentException if `position` is not an answer to that question
    public Revision revise(History history, int position, Answer revised)
            throws EvaluationException {
        Answer original = history.findAnswer(position)
                .filter(a -> a.label().equals(revised.label()))
                .orElseThrow(() -> new IllegalArgumentException(
                        "No answer to " + revised.label() + " at " + position));

        History work = history.copy();
        LoopStack stack = engine.replay(work, position);
        work.graft(position, revised);
        stack.record(new ScopedAnswer(position, revised));

        String edited = revised.label();
        Question current = engine.questionOf(work.get(position));
        int index = position + 1;
        int resected = 0;
        Question fresh;
        while (true) {
            fresh = engine.nextRecordable(stack, current);
            if (index >= work.size()) {
                break;
            }
            if (!matches(stack, work.get(index), fresh)) {
                int found = find(stack, work, index + 1, fresh);
                if (found < 0) {
                    resected += cut(work, index, "path diverges at " + fresh.getLabel());
                    break;
                }
                logger.fine(
                        "Resecting entries [" + index + ", " + found + ") to reach "
                                + fresh.getLabel());
                resected += found - index;
                work.delete(index, found);
            }
            HistoryEntry entry = work.get(index);
            if (isImpacted(stack, entry, edited)
                    && differs(stack.copySubstituting(position, original), stack, entry)) {
                resected += cut(work, index, entry.label() + " depends on " + edited);
                break;
            }
            engine.apply(stack, work, entry, index);
            current = fresh;
            index++;
        }

        AnswerableQuestion next = engine.resolve(stack, work, fresh);
        logger.info(
                "Revised answer to "
                        + edited
                        + " at "
                        + position
                        + ", "
                        + resected
                        + " entries resected, next question "
                        + next.getLabel());
        return new Revision(work, next, stack, resected);
    }

    private static int cut(History work, int index, String reason) {
        int removed = work.size() - index;
        logger.fine("Truncating history at " + index + ": " + reason);
        work.truncate(index);
        return removed;
    }

    private int find(LoopStack stack, History work, int from, Question fresh) {
        for (int i = from; i < work.size(); i++) {
            if (matches(stack, work.get(i), fresh)) {
                return i;
            }
        }
        return -1;
    }

    /// Whether a recorded entry is the one the walk would record at this point.
    private boolean matches(LoopStack stack, HistoryEntry entry, Question fresh) {
        if (!entry.label().equals(fresh.getLabel())) {
            return false;
        }
        if (entry instanceof AnswerEntry) {
            return fresh instanceof AnswerableQuestion;
        }
        if (entry instanceof BeginLoopMark mark && fresh instanceof BeginLoopQuestion bl) {
            int expected = engine.isIterating(stack, bl)
                    ? stack.top().orElseThrow().getIndex()
                    : 0;
            return mark.iterationIndex() == expected;
        }
        return entry instanceof EndLoopMark;
    }

    private boolean isImpacted(LoopStack stack, HistoryEntry entry, String edited) {
        if (entry instanceof BeginLoopMark mark) {
            BeginLoopQuestion bl = (BeginLoopQuestion) engine.questionOf(mark);
            return bl.getOperandLabel().equals(edited) && !engine.isIterating(stack, bl);
        }
        if (entry instanceof AnswerEntry ae) {
            return engine.questionOf(ae) instanceof AnswerableQuestion aq
                    && aq.textReferences(edited);
        }
        return false;
    }

    private boolean differs(LoopStack before, LoopStack after, HistoryEntry entry)
            throws EvaluationException {
        Question question = engine.questionOf(entry);
        if (question instanceof BeginLoopQuestion bl) {
            List<Object> was = evaluator.computeLoopOperand(before, bl, operand(before, bl));
            List<Object> now = evaluator.computeLoopOperand(after, bl, operand(after, bl));
            return !was.equals(now);
        }
        AnswerableQuestion aq = (AnswerableQuestion) question;
        return !evaluator.renderText(before, aq).equals(evaluator.renderText(after, aq));
    }

    private static Answer operand(LoopStack stack, BeginLoopQuestion bl) {
        return stack.findAnswer(bl.getOperandLabel()).map(ScopedAnswer::answer).orElse(null);
    }

    /// Outcome of a revision.
    ///
    /// @param history the revised history, to be committed by the caller
    /// @param next the question to display next
    /// @param stack loop stack at that question
    /// @param resected number of entries removed
    public record Revision(
            History history, AnswerableQuestion next, LoopStack stack, int resected) {}
}
