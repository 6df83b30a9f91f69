package io.interviews.core.util;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/// Minimal JSON helpers for the JSON-like values exchanged with the expression evaluator.
///
/// Values are plain Java trees: {@link Map} with string keys, {@link List}, {@link String},
/// {@link Number}, {@link Boolean} and `null`. This is intentionally minimal to keep
/// interviews-core dependency-free; full (de)serialization lives in interviews-serialization.
public final class JsonUtil {

    private JsonUtil() {}

    /// Writes a JSON-like value as compact JSON text.
    ///
    /// Integral doubles are written without a fraction so that `2.0` coming back from a
    /// script renders as `2`.
    ///
    /// @param value the value, may be null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if the tree contains an unsupported type
    public static String toJson(Object value) {
        StringBuilder sb = new StringBuilder();
        write(sb, value);
        return sb.toString();
    }

    /// Applies the truthiness rule used for transition conditions.
    ///
    /// Only boolean `true` and non-zero numbers are truthy. Strings, arrays, objects and
    /// `null` are not.
    ///
    /// @param value script result, may be null
    /// @return true if the value selects its transition
    public static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0 && !Double.isNaN(n.doubleValue());
        }
        return false;
    }

    /// Quotes and escapes a string as a JSON string literal.
    ///
    /// @param s the string, not null
    /// @return quoted literal, never null
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        writeString(sb, s);
        return sb.toString();
    }

    private static void write(StringBuilder sb, Object value) {
        if (value == null) {
            sb.append("null");
        } else if (value instanceof String s) {
            writeString(sb, s);
        } else if (value instanceof Boolean b) {
            sb.append(b.booleanValue());
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                sb.append("null");
            } else if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                sb.append((long) d);
            } else {
                sb.append(d);
            }
        } else if (value instanceof Number n) {
            sb.append(n);
        } else if (value instanceof Map<?, ?> map) {
            sb.append('{');
            Iterator<? extends Map.Entry<?, ?>> it = map.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<?, ?> e = it.next();
                writeString(sb, String.valueOf(e.getKey()));
                sb.append(':');
                write(sb, e.getValue());
                if (it.hasNext()) {
                    sb.append(',');
                }
            }
            sb.append('}');
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                write(sb, list.get(i));
            }
            sb.append(']');
        } else {
            throw new IllegalArgumentException(
                    "Unsupported JSON value type: " + value.getClass().getName());
        }
    }

    private static void writeString(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
    }
}
