package io.interviews.core.execution;

import io.interviews.core.interview.Answer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Open loops of an interview, outermost first, plus the answers given outside loops.
///
/// The stack is never persisted: it is rebuilt by replaying the history
/// (see {@link InterviewEngine#replay}). Answer lookup searches the innermost frame
/// first, so inner answers shadow outer ones.
///
/// @implNote Mutable and not thread-safe. {@link #copy()} gives an independent stack.
public final class LoopStack {

    private final List<StackFrame> frames;
    private final Map<String, ScopedAnswer> topLevel;

    public LoopStack() {
        this(new ArrayList<>(), new HashMap<>());
    }

    private LoopStack(List<StackFrame> frames, Map<String, ScopedAnswer> topLevel) {
        this.frames = frames;
        this.topLevel = topLevel;
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    /// Returns the innermost frame.
    ///
    /// @return the frame, empty at top level
    public Optional<StackFrame> top() {
        return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(frames.size() - 1));
    }

    void push(StackFrame frame) {
        frames.add(frame);
    }

    StackFrame pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Cannot pop an empty loop stack");
        }
        return frames.remove(frames.size() - 1);
    }

    /// Records an answer at the current loop level.
    ///
    /// @param answer the answer, not null
    public void record(ScopedAnswer answer) {
        String label = answer.answer().label();
        if (frames.isEmpty()) {
            topLevel.put(label, answer);
        } else {
            frames.get(frames.size() - 1).record(label, answer);
        }
    }

    /// Finds the most recent visible answer to a question.
    ///
    /// @param label question label, not null
    /// @return the answer, searching from the innermost frame outward
    public Optional<ScopedAnswer> findAnswer(String label) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            ScopedAnswer found = frames.get(i).findAnswer(label);
            if (found != null) {
                return Optional.of(found);
            }
        }
        return Optional.ofNullable(topLevel.get(label));
    }

    /// Returns the innermost frame declaring a loop variable.
    ///
    /// @param name variable name, not null
    /// @return the frame, empty if no open loop declares it
    public Optional<StackFrame> findVariable(String name) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            if (frames.get(i).getVariable().equals(name)) {
                return Optional.of(frames.get(i));
            }
        }
        return Optional.empty();
    }

    /// Returns loop variables with inner values shadowing outer ones.
    ///
    /// @return map in declaration order, outermost first, never null
    public Map<String, Object> loopVariables() {
        Map<String, Object> vars = new LinkedHashMap<>();
        for (StackFrame frame : frames) {
            vars.remove(frame.getVariable());
            vars.put(frame.getVariable(), frame.getVariableValue());
        }
        return vars;
    }

    /// Returns an independent deep copy.
    ///
    /// @return new stack, never null
    public LoopStack copy() {
        List<StackFrame> copied = new ArrayList<>(frames.size());
        for (StackFrame frame : frames) {
            copied.add(frame.copy());
        }
        return new LoopStack(copied, new HashMap<>(topLevel));
    }

    /// Returns a copy in which the answer recorded at a history index is replaced.
    ///
    /// Gives the context an interview would have had with another answer at that index,
    /// the rest of the history being equal.
    ///
    /// @param position history index of the replaced answer
    /// @param answer the substitute, not null
    /// @return new stack, never null
    public LoopStack copySubstituting(int position, Answer answer) {
        List<StackFrame> copied = new ArrayList<>(frames.size());
        for (StackFrame frame : frames) {
            copied.add(frame.copySubstituting(position, answer));
        }
        Map<String, ScopedAnswer> top = new HashMap<>(topLevel);
        top.replaceAll((label, a) -> StackFrame.substitute(a, position, answer));
        return new LoopStack(copied, top);
    }

    @Override
    public String toString() {
        return "LoopStack" + frames;
    }
}
