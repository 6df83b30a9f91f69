package io.interviews.graaljs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.EvaluationException;
import io.interviews.core.expression.EvaluationScope;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Value;

/// One evaluation on its own GraalJS context.
///
/// ### Value conversion
/// Declared values enter the script through `JSON.parse`, so maps and lists become
/// plain JavaScript objects and arrays (`Array.isArray` holds, array methods work).
/// Results come back as:
///
/// | JavaScript | Java |
/// |---|---|
/// | `undefined`, `null` | `null` |
/// | boolean | {@link Boolean} |
/// | string | {@link String} |
/// | integral number | {@link Integer}, or {@link Long} when out of int range |
/// | other number | {@link Double} |
/// | array | {@link List} |
/// | object | {@link Map} with string keys, in property order |
///
/// Functions and other values have no JSON form and fail the evaluation.
///
/// @implNote **Not thread-safe**. Confined to the thread that opened it.
final class GraalJsEvaluationScope implements EvaluationScope {

    private static final Logger logger = Logger.getLogger(GraalJsEvaluationScope.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Context context;
    private final Value bindings;
    private final Value jsonParse;

    GraalJsEvaluationScope(Context context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.bindings = context.getBindings("js");
        this.jsonParse = context.eval("js", "JSON.parse");
    }

    @Override
    public void declare(String name, Object value) {
        Objects.requireNonNull(name, "name must not be null");
        String json;
        try {
            json = JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value of '" + name + "' is not JSON-like", e);
        }
        bindings.putMember(name, jsonParse.execute(json));
    }

    @Override
    public Object execute(String code) throws EvaluationException {
        Objects.requireNonNull(code, "code must not be null");
        Value result;
        try {
            result = context.eval("js", code);
        } catch (PolyglotException e) {
            logger.warning("Script failed: " + e.getMessage() + " in: " + code);
            throw new EvaluationException(ErrorCode.SCRIPT_FAILED, List.of(), e);
        }
        return toJava(result, code);
    }

    @Override
    public void close() {
        context.close(true);
    }

    private static Object toJava(Value value, String code) throws EvaluationException {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isString()) {
            return value.asString();
        }
        if (value.isNumber()) {
            if (value.fitsInInt()) {
                return value.asInt();
            }
            if (value.fitsInLong()) {
                return value.asLong();
            }
            return value.asDouble();
        }
        if (value.canExecute()) {
            logger.warning("Script returned a function: " + code);
            throw new EvaluationException(ErrorCode.SCRIPT_FAILED);
        }
        if (value.hasArrayElements()) {
            List<Object> list = new ArrayList<>((int) value.getArraySize());
            for (long i = 0; i < value.getArraySize(); i++) {
                list.add(toJava(value.getArrayElement(i), code));
            }
            return list;
        }
        if (value.hasMembers()) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : value.getMemberKeys()) {
                map.put(key, toJava(value.getMember(key), code));
            }
            return map;
        }
        logger.warning("Script returned a value without JSON form: " + code);
        throw new EvaluationException(ErrorCode.SCRIPT_FAILED);
    }
}
