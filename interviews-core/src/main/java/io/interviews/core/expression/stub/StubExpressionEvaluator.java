package io.interviews.core.expression.stub;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.EvaluationException;
import io.interviews.core.expression.EvaluationScope;
import io.interviews.core.expression.ExpressionEvaluator;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Logger;

/// Evaluator answering scripts with registered Java functions, for tests without a script
/// runtime.
///
/// Each script source is registered with a function of the declared names. Loop
/// operands registered through {@link #register} are matched on their raw code, not on
/// the `R` wrapper.
///
/// ### Usage
/// {@snippet :
/// StubExpressionEvaluator evaluator = new StubExpressionEvaluator();
/// evaluator.register("q1.choice.index == 0", vars -> StubExpressionEvaluator
///         .path(vars, "q1", "choice", "index").equals(0));
/// }
///
/// @implNote Thread-safe. Scopes are independent.
public class StubExpressionEvaluator implements ExpressionEvaluator {

    private static final Logger logger = Logger.getLogger(StubExpressionEvaluator.class.getName());

    private final Map<String, Function<Map<String, Object>, Object>> scripts =
            new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "stub";
    }

    /// Returns -1 so that a real runtime on the class path is always preferred.
    @Override
    public int getPriority() {
        return -1;
    }

    /// Registers the behavior of a script.
    ///
    /// @apiNote **Side effects**: replaces any function registered for the same code
    ///
    /// @param code script source, not null
    /// @param function computes the result from the declared names, not null
    /// @return this evaluator for chaining
    public StubExpressionEvaluator register(
            String code, Function<Map<String, Object>, Object> function) {
        scripts.put(Objects.requireNonNull(code), Objects.requireNonNull(function));
        return this;
    }

    /// Registers a script returning a constant.
    ///
    /// @param code script source, not null
    /// @param value constant result, may be null
    /// @return this evaluator for chaining
    public StubExpressionEvaluator constant(String code, Object value) {
        return register(code, vars -> value);
    }

    @Override
    public EvaluationScope openScope() {
        return new StubScope();
    }

    /// Navigates a JSON-like tree of declared values.
    ///
    /// @param vars declared values, not null
    /// @param path name followed by object keys or list indices
    /// @return value found, or null if any step is missing
    public static Object path(Map<String, Object> vars, Object... path) {
        Object current = vars;
        for (Object step : path) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(step);
            } else if (current instanceof List<?> list && step instanceof Integer i) {
                current = i < list.size() ? list.get(i) : null;
            } else {
                return null;
            }
        }
        return current;
    }

    private final class StubScope implements EvaluationScope {

        private final Map<String, Object> declared = new HashMap<>();

        @Override
        public void declare(String name, Object value) {
            declared.put(name, value);
        }

        @Override
        public Object execute(String code) throws EvaluationException {
            Function<Map<String, Object>, Object> function = scripts.get(code);
            if (function == null) {
                logger.warning("No stub registered for script: " + code);
                throw new EvaluationException(ErrorCode.SCRIPT_FAILED);
            }
            return function.apply(Collections.unmodifiableMap(declared));
        }

        @Override
        public Object executeForResult(String code) throws EvaluationException {
            return execute(code);
        }

        @Override
        public void close() {
            declared.clear();
        }
    }
}
