package io.interviews.core.expression;

import io.interviews.core.exception.EvaluationException;

/// Short-lived, call-isolated script environment.
///
/// A scope is opened for one evaluation: names are declared, one script runs and the
/// scope is closed. Nothing declared in one scope is visible in another.
///
/// ### Values
/// Declared and returned values are JSON-like Java trees: {@link java.util.Map} with
/// string keys, {@link java.util.List}, {@link String}, {@link Number},
/// {@link Boolean} and `null`. Script `undefined` and `null` both come back as `null`.
///
/// @see ExpressionEvaluator#openScope()
public interface EvaluationScope extends AutoCloseable {

    /// Declares a global name for the script about to run.
    ///
    /// @param name identifier, not null
    /// @param value JSON-like value, may be null
    void declare(String name, Object value);

    /// Runs a script and returns its completion value.
    ///
    /// @param code script source, not null
    /// @return JSON-like result, may be null
    /// @throws EvaluationException if the script fails or returns an unsupported value
    Object execute(String code) throws EvaluationException;

    /// Runs a script that assigns its result to `R`, initialized to `null`.
    ///
    /// This is the protocol of loop operands: `R = answer.options.map(o => o.label)`.
    ///
    /// @param code script source, not null
    /// @return value of `R` after the script, may be null
    /// @throws EvaluationException if the script fails
    default Object executeForResult(String code) throws EvaluationException {
        return execute("{let R=null;" + code + "\n;if(R==undefined){null}else R}");
    }

    /// Releases the scope. Never throws.
    @Override
    void close();
}
