package io.interviews.core.compiler;

import java.util.List;

/// Source form of a question text with the functions its `@{n}` markers call.
///
/// @param value text in the source questionnaire's language
/// @param functions text functions, index `n` answering `@{n}`
public record SourceText(String value, List<SourceFunction> functions) {

    public SourceText {
        value = value == null ? "" : value;
        functions = functions == null ? List.of() : List.copyOf(functions);
    }

    public SourceText(String value) {
        this(value, List.of());
    }
}
