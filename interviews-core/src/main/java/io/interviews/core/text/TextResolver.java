package io.interviews.core.text;

import io.interviews.core.exception.EvaluationException;

/// Renders parametric question texts.
///
/// @see ParametricTextResolver for the default implementation
public interface TextResolver {

    /// Resolves every marker of a text.
    ///
    /// @param label label of the question owning the text, used in errors, not null
    /// @param text the text, not null
    /// @param bindings functions and loop variables in scope, not null
    /// @return rendered text, never null
    /// @throws EvaluationException on an unknown loop variable, an out-of-bounds function
    /// index or a failing function
    String resolve(String label, String text, TextBindings bindings) throws EvaluationException;
}
