package io.interviews.core.execution.history;

import io.interviews.core.interview.Answer;
import java.util.Objects;

/// One recorded step of an interview.
///
/// ### Permitted Subtypes
/// - {@link AnswerEntry} - an accepted answer
/// - {@link BeginLoopMark} - entry into one iteration of a loop
/// - {@link EndLoopMark} - end of one iteration of a loop
///
/// Entries refer to questions by label and to other entries by history index.
public sealed interface HistoryEntry {

    /// Returns the label of the question this entry stands for.
    ///
    /// @return label, never null
    String label();

    /// An accepted answer.
    ///
    /// @param answer the answer, not null
    record AnswerEntry(Answer answer) implements HistoryEntry {
        public AnswerEntry {
            Objects.requireNonNull(answer, "answer must not be null");
        }

        @Override
        public String label() {
            return answer.label();
        }
    }

    /// Entry into iteration `iterationIndex` of a loop.
    ///
    /// The operand reference is a history index resolved through
    /// {@link History#findAnswer(int)}; it is {@link #DANGLING} once the operand entry
    /// has been resected.
    ///
    /// @param beginLoopLabel label of the begin loop, not null
    /// @param operandAnswerIndex index of the operand answer entry, or {@link #DANGLING}
    /// @param iterationIndex 0-based iteration
    record BeginLoopMark(String beginLoopLabel, int operandAnswerIndex, int iterationIndex)
            implements HistoryEntry {

        public static final int DANGLING = -1;

        public BeginLoopMark {
            Objects.requireNonNull(beginLoopLabel, "beginLoopLabel must not be null");
        }

        @Override
        public String label() {
            return beginLoopLabel;
        }

        BeginLoopMark withOperandAnswerIndex(int index) {
            return new BeginLoopMark(beginLoopLabel, index, iterationIndex);
        }
    }

    /// End of one loop iteration.
    ///
    /// @param endLoopLabel label of the end loop, not null
    record EndLoopMark(String endLoopLabel) implements HistoryEntry {
        public EndLoopMark {
            Objects.requireNonNull(endLoopLabel, "endLoopLabel must not be null");
        }

        @Override
        public String label() {
            return endLoopLabel;
        }
    }
}
