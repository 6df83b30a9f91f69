package io.interviews.core.localization;

import java.util.Objects;

/// Localized label of an option and, when the option takes a comment, of its comment field.
///
/// @param label option label, not null
/// @param commentLabel comment field label, empty when the option has no comment
public record OptionLocalization(String label, String commentLabel) {

    public OptionLocalization {
        Objects.requireNonNull(label, "label must not be null");
        commentLabel = commentLabel == null ? "" : commentLabel;
    }

    public OptionLocalization(String label) {
        this(label, "");
    }

    public boolean hasCommentLabel() {
        return !commentLabel.isEmpty();
    }
}
