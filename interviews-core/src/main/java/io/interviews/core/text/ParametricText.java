package io.interviews.core.text;

import java.util.ArrayList;
import java.util.List;

/// Left-to-right scanner for parametric question texts.
///
/// Two markers are recognized:
/// - `@{n}` with `n` a decimal index: call of the n-th text function
/// - `@{name}`: value of the loop variable `name`
///
/// Anything else is literal text. A marker that is not terminated, such as a trailing
/// `@{12` or `@{name`, or a digit run followed by another character, is kept verbatim.
public final class ParametricText {

    static final char PREFIX = '@';
    static final char OPEN = '{';
    static final char CLOSE = '}';

    private ParametricText() {}

    /// A scanned piece of text.
    public sealed interface Token {}

    /// Verbatim text.
    ///
    /// @param text the text, not null
    public record Literal(String text) implements Token {}

    /// Call of a text function.
    ///
    /// @param index function index, saturated at {@link Integer#MAX_VALUE}
    public record Call(int index) implements Token {}

    /// Access to a loop variable.
    ///
    /// @param name variable name, not null
    public record Variable(String name) implements Token {}

    /// Scans a text into tokens. Adjacent literals are merged.
    ///
    /// @param text the text, not null
    /// @return tokens in order, never null
    public static List<Token> scan(String text) {
        List<Token> tokens = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c != PREFIX || i + 1 >= n || text.charAt(i + 1) != OPEN) {
                literal.append(c);
                i++;
                continue;
            }
            int start = i;
            i += 2;
            if (i >= n) {
                literal.append(text, start, n);
                break;
            }
            if (isAsciiDigit(text.charAt(i))) {
                long index = 0;
                while (i < n && isAsciiDigit(text.charAt(i))) {
                    index = Math.min(index * 10 + (text.charAt(i) - '0'), Integer.MAX_VALUE);
                    i++;
                }
                if (i < n && text.charAt(i) == CLOSE) {
                    flush(literal, tokens);
                    tokens.add(new Call((int) index));
                    i++;
                } else {
                    literal.append(text, start, i);
                }
            } else {
                int close = text.indexOf(CLOSE, i);
                if (close < 0) {
                    literal.append(text, start, n);
                    break;
                }
                flush(literal, tokens);
                tokens.add(new Variable(text.substring(i, close)));
                i = close + 1;
            }
        }
        flush(literal, tokens);
        return tokens;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static void flush(StringBuilder literal, List<Token> tokens) {
        if (literal.length() > 0) {
            tokens.add(new Literal(literal.toString()));
            literal.setLength(0);
        }
    }
}
