package io.interviews.core.text;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.EvaluationException;
import io.interviews.core.util.JsonUtil;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Resolver splicing function results and loop variables into a text.
///
/// String values are spliced raw; any other value is spliced as JSON. Each function is
/// called at most once per resolution, however many times its marker appears.
public class ParametricTextResolver implements TextResolver {

    private static final Logger logger = Logger.getLogger(ParametricTextResolver.class.getName());

    @Override
    public String resolve(String label, String text, TextBindings bindings)
            throws EvaluationException {
        List<ParametricText.Token> tokens = ParametricText.scan(text);
        if (tokens.size() == 1 && tokens.get(0) instanceof ParametricText.Literal lit) {
            return lit.text();
        }

        Map<Integer, Object> calls = new HashMap<>();
        StringBuilder result = new StringBuilder(text.length());
        for (ParametricText.Token token : tokens) {
            if (token instanceof ParametricText.Literal lit) {
                result.append(lit.text());
            } else if (token instanceof ParametricText.Call call) {
                int index = call.index();
                if (index >= bindings.functionCount()) {
                    throw new EvaluationException(ErrorCode.FUNCTION_CALL_OUT_OF_BOUNDS, label);
                }
                if (!calls.containsKey(index)) {
                    calls.put(index, bindings.call(index));
                }
                splice(result, calls.get(index));
            } else if (token instanceof ParametricText.Variable variable) {
                if (!bindings.hasLoopVariable(variable.name())) {
                    logger.warning(
                            "Unknown loop variable '" + variable.name() + "' in question " + label);
                    throw new EvaluationException(ErrorCode.QUESTION_LOOP_VARIABLE_UNKNOWN, label);
                }
                splice(result, bindings.loopVariable(variable.name()));
            }
        }
        return result.toString();
    }

    private static void splice(StringBuilder result, Object value) {
        if (value instanceof String s) {
            result.append(s);
        } else {
            result.append(JsonUtil.toJson(value));
        }
    }
}
