package io.interviews.core.expression;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/// Discovers {@link ExpressionEvaluator} implementations with {@link ServiceLoader}.
public final class ExpressionEvaluators {

    private static final Logger logger = Logger.getLogger(ExpressionEvaluators.class.getName());

    private ExpressionEvaluators() {}

    /// Loads every evaluator on the class path.
    ///
    /// @return discovered evaluators, never null (may be empty)
    public static List<ExpressionEvaluator> loadAll() {
        List<ExpressionEvaluator> discovered = new ArrayList<>();
        for (ExpressionEvaluator evaluator : ServiceLoader.load(ExpressionEvaluator.class)) {
            discovered.add(evaluator);
            logger.fine("Discovered expression evaluator: " + evaluator.getName());
        }
        return discovered;
    }

    /// Returns the highest-priority evaluator on the class path.
    ///
    /// Evaluators that are not selected are closed.
    ///
    /// @return the evaluator, never null
    /// @throws IllegalStateException if none is available
    public static ExpressionEvaluator discover() {
        List<ExpressionEvaluator> all = loadAll();
        ExpressionEvaluator selected =
                all.stream()
                        .max(Comparator.comparingInt(ExpressionEvaluator::getPriority))
                        .orElseThrow(
                                () ->
                                        new IllegalStateException(
                                                "No ExpressionEvaluator found on the class path."
                                                        + " Add interviews-graaljs-adapter or"
                                                        + " pass an evaluator explicitly."));
        for (ExpressionEvaluator other : all) {
            if (other != selected) {
                other.close();
            }
        }
        logger.info("Using expression evaluator: " + selected.getName());
        return selected;
    }
}
