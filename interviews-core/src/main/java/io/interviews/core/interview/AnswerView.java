package io.interviews.core.interview;

import java.util.Map;
import java.util.Objects;

/// A past answer as shown when the respondent browses the history.
///
/// @param data localized answer data, not null
/// @param index history index of the answer
/// @param more whether further answers exist in the browsing direction
public record AnswerView(Map<String, Object> data, int index, boolean more) {

    public AnswerView {
        Objects.requireNonNull(data, "data must not be null");
    }
}
