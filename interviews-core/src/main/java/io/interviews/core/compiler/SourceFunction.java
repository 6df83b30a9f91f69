package io.interviews.core.compiler;

import java.util.List;

/// Source form of a text function.
///
/// @param code script source
/// @param parameters labels of earlier questions whose answers the script reads
public record SourceFunction(String code, List<String> parameters) {

    public SourceFunction {
        code = code == null ? "" : code;
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }
}
