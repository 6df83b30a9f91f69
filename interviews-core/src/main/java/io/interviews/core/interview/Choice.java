package io.interviews.core.interview;

/// One chosen option.
///
/// @param index 0-based option index
/// @param comment comment on the option, empty unless the option takes a comment
public record Choice(int index, String comment) {

    public Choice {
        comment = comment == null ? "" : comment;
    }

    public Choice(int index) {
        this(index, "");
    }
}
