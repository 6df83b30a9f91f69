package io.interviews.core.compiler;

/// Source form of an option. A non-empty comment label gives the option a comment.
///
/// @param label option label
/// @param commentLabel comment field label, may be empty
public record SourceOption(String label, String commentLabel) {

    public SourceOption {
        label = label == null ? "" : label;
        commentLabel = commentLabel == null ? "" : commentLabel;
    }

    public SourceOption(String label) {
        this(label, "");
    }
}
