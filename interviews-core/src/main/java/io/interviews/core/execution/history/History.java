package io.interviews.core.execution.history;

import io.interviews.core.execution.history.HistoryEntry.AnswerEntry;
import io.interviews.core.execution.history.HistoryEntry.BeginLoopMark;
import io.interviews.core.interview.Answer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Ordered log of one interview: answers and loop marks.
///
/// ### Contracts
/// - Entries are appended at the end, replaced in place ({@link #graft}) or removed as
///   a range ({@link #delete}, {@link #truncate})
/// - **Invariant**: every non-dangling {@link BeginLoopMark} operand index designates an
///   earlier {@link AnswerEntry}; deletions shift or invalidate them atomically
///
/// @implNote Not thread-safe. An interview's history is confined to the single writer
/// holding the interview lock; revision works on a {@link #copy()}.
public final class History {

    private static final Logger logger = Logger.getLogger(History.class.getName());

    private final List<HistoryEntry> entries;

    public History() {
        this.entries = new ArrayList<>();
    }

    /// Creates a history from existing entries, e.g. when deserializing.
    ///
    /// @param entries the entries in order, not null
    public History(List<HistoryEntry> entries) {
        this.entries = new ArrayList<>(entries);
    }

    /// Returns a read-only view of the entries.
    ///
    /// @return entries in order, never null
    public List<HistoryEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// Returns the entry at an index.
    ///
    /// @param index 0-based index
    /// @return the entry, never null
    /// @throws IndexOutOfBoundsException if out of range
    public HistoryEntry get(int index) {
        return entries.get(index);
    }

    /// Appends an entry.
    ///
    /// @param entry the entry, not null
    /// @return index of the appended entry
    public int append(HistoryEntry entry) {
        entries.add(entry);
        return entries.size() - 1;
    }

    /// Resolves a weak reference to an answer entry.
    ///
    /// @param index history index, possibly dangling
    /// @return the answer if the index designates an answer entry
    public Optional<Answer> findAnswer(int index) {
        if (index < 0 || index >= entries.size()) {
            return Optional.empty();
        }
        return entries.get(index) instanceof AnswerEntry ae
                ? Optional.of(ae.answer())
                : Optional.empty();
    }

    /// Replaces the answer at an index, keeping every index reference valid.
    ///
    /// @param index index of an answer entry
    /// @param answer the new answer, for the same question, not null
    /// @throws IllegalArgumentException if the slot is not an answer for that question
    public void graft(int index, Answer answer) {
        if (!(entries.get(index) instanceof AnswerEntry ae)
                || !ae.answer().label().equals(answer.label())) {
            throw new IllegalArgumentException(
                    "History entry " + index + " is not an answer to " + answer.label());
        }
        entries.set(index, new AnswerEntry(answer));
    }

    /// Removes the entries in `[from, to)`.
    ///
    /// Operand references of later begin loop marks are shifted; references into the
    /// removed range become {@link BeginLoopMark#DANGLING}.
    ///
    /// @param from first removed index
    /// @param to index after the last removed one
    public void delete(int from, int to) {
        if (from < 0 || to > entries.size() || from > to) {
            throw new IndexOutOfBoundsException("Invalid range [" + from + ", " + to + ")");
        }
        if (from == to) {
            return;
        }
        int removed = to - from;
        entries.subList(from, to).clear();
        for (int i = from; i < entries.size(); i++) {
            if (entries.get(i) instanceof BeginLoopMark mark
                    && mark.operandAnswerIndex() >= from) {
                int ref = mark.operandAnswerIndex();
                if (ref < to) {
                    logger.fine(
                            "Operand of begin loop "
                                    + mark.beginLoopLabel()
                                    + " was resected, reference left dangling");
                    entries.set(i, mark.withOperandAnswerIndex(BeginLoopMark.DANGLING));
                } else {
                    entries.set(i, mark.withOperandAnswerIndex(ref - removed));
                }
            }
        }
    }

    /// Removes every entry from an index to the end.
    ///
    /// @param from first removed index
    public void truncate(int from) {
        delete(from, entries.size());
    }

    /// Returns an independent copy.
    ///
    /// @return new history with the same entries, never null
    public History copy() {
        return new History(entries);
    }

    /// Replaces this history's content with another's.
    ///
    /// @param other the committed history, not null
    public void replaceWith(History other) {
        if (other != this) {
            entries.clear();
            entries.addAll(other.entries);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof History h)) return false;
        return entries.equals(h.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "History" + entries;
    }
}
