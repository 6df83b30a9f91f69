package io.interviews.core.execution;

import io.interviews.core.interview.Answer;
import java.util.Objects;

/// An answer together with the history index it was recorded at.
///
/// @param position history index of the answer entry
/// @param answer the answer, not null
public record ScopedAnswer(int position, Answer answer) {

    public ScopedAnswer {
        Objects.requireNonNull(answer, "answer must not be null");
    }
}
