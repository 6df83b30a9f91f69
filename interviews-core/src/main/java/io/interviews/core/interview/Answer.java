package io.interviews.core.interview;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/// An answer recorded in an interview's history.
///
/// @param label label of the answered question, not null
/// @param body the answer content, not null
/// @param timestamp when the answer was accepted, not null
/// @param elapsed time spent on this question, not null
/// @param totalElapsed time since the interview started, not null
/// @param ipAddress caller IP address, not null (may be empty)
/// @param geolocation caller position, may be null
public record Answer(
        String label,
        AnswerBody body,
        Instant timestamp,
        Duration elapsed,
        Duration totalElapsed,
        String ipAddress,
        Geolocation geolocation) {

    public Answer {
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        totalElapsed = totalElapsed == null ? Duration.ZERO : totalElapsed;
        ipAddress = ipAddress == null ? "" : ipAddress;
    }

    /// Returns a copy with another body and timing, keeping the label.
    ///
    /// @param newBody the new body, not null
    /// @param newTimestamp acceptance time, not null
    /// @param newIp caller IP, may be null
    /// @param newGeolocation caller position, may be null
    /// @return new answer, never null
    public Answer revised(
            AnswerBody newBody, Instant newTimestamp, String newIp, Geolocation newGeolocation) {
        return new Answer(
                label, newBody, newTimestamp, elapsed, totalElapsed, newIp, newGeolocation);
    }
}
