package io.interviews.core.interview;

import io.interviews.core.localization.OptionLocalization;
import java.util.List;
import java.util.Objects;

/// A question as displayed to the respondent: localized, with its text rendered.
///
/// @param label question label, not null
/// @param kind wire name of the answer kind, e.g. `"select_at_most"`, not null
/// @param text rendered text, not null
/// @param style display style, not null
/// @param commentLabel comment field label, empty if the question takes no comment
/// @param options option labels in option order, empty for non-option kinds
/// @param randomize whether the client should shuffle the options
/// @param limit choice limit of multiple-choice kinds, 0 otherwise
/// @param optional whether an input may be left empty
/// @param progress completion estimate in percent
/// @param finalQuestion whether this question ends the interview
public record QuestionView(
        String label,
        String kind,
        String text,
        String style,
        String commentLabel,
        List<OptionLocalization> options,
        boolean randomize,
        int limit,
        boolean optional,
        int progress,
        boolean finalQuestion) {

    public QuestionView {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        style = style == null ? "" : style;
        commentLabel = commentLabel == null ? "" : commentLabel;
        options = options == null ? List.of() : List.copyOf(options);
    }

    /// Whether showing this question completes the interview.
    ///
    /// @return same as {@link #finalQuestion()}
    public boolean completed() {
        return finalQuestion;
    }
}
