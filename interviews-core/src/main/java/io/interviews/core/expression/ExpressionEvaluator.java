package io.interviews.core.expression;

/// Service provider interface for the script runtime behind conditions, text functions
/// and loop operands.
///
/// ### Registration
/// Implementations are discovered from
/// `META-INF/services/io.interviews.core.expression.ExpressionEvaluator` by
/// {@link ExpressionEvaluators#discover()} or passed explicitly to
/// {@link io.interviews.core.InterviewsFactory.Builder#expressionEvaluator}.
///
/// @implNote Implementations must be thread-safe: scopes are opened concurrently by
/// independent interviews. Scopes themselves are confined to one thread.
///
/// @see EvaluationScope for the per-call contract
public interface ExpressionEvaluator extends AutoCloseable {

    /// Returns the evaluator's display name for logging.
    ///
    /// @return name such as `"graaljs"`, never null
    String getName();

    /// Returns the priority used when several evaluators are discovered.
    ///
    /// @return priority, higher is preferred (default: 0)
    default int getPriority() {
        return 0;
    }

    /// Opens a fresh scope for one evaluation.
    ///
    /// @return new scope, never null
    EvaluationScope openScope();

    /// Releases shared runtime resources. Never throws.
    @Override
    default void close() {}
}
