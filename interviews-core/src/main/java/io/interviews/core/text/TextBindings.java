package io.interviews.core.text;

import io.interviews.core.exception.EvaluationException;

/// Values a parametric text can reach while it is resolved.
public interface TextBindings {

    /// Returns the number of text functions attached to the question.
    ///
    /// @return function count, zero or more
    int functionCount();

    /// Calls a text function with its parameters bound.
    ///
    /// @param index function index, below {@link #functionCount()}
    /// @return JSON-like result, may be null
    /// @throws EvaluationException if the script fails
    Object call(int index) throws EvaluationException;

    /// Whether an enclosing loop declares the variable.
    ///
    /// @param name variable name, not null
    /// @return true if declared by some open frame
    boolean hasLoopVariable(String name);

    /// Returns the value of the innermost loop variable with that name.
    ///
    /// @param name variable name, declared per {@link #hasLoopVariable(String)}
    /// @return JSON-like value, may be null
    Object loopVariable(String name);
}
