package io.interviews.core.interview;

/// Navigation direction through recorded answers.
public enum Direction {
    PREVIOUS,
    NEXT
}
