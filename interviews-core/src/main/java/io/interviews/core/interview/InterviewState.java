package io.interviews.core.interview;

/// Lifecycle of an interview: created, answering, done.
public enum InterviewState {
    INITIATED,
    ONGOING,
    COMPLETED
}
