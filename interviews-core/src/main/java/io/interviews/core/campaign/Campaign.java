package io.interviews.core.campaign;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.InterviewStateException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/// A period during which interviews of one questionnaire can be run.
///
/// Creating a campaign locks its questionnaire, so the graph every interview walks
/// never changes under it.
///
/// @param id campaign id, not null
/// @param questionnaireId id of the questionnaire, not null
/// @param start first instant interviews are accepted, not null
/// @param duration length of the campaign, null for an open-ended one
public record Campaign(String id, String questionnaireId, Instant start, Duration duration) {

    public Campaign {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(questionnaireId, "questionnaireId must not be null");
        Objects.requireNonNull(start, "start must not be null");
        if (duration != null && duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative");
        }
    }

    /// Returns the first instant the campaign no longer accepts interview operations.
    ///
    /// @return end instant, empty for an open-ended campaign
    public Optional<Instant> end() {
        return duration == null ? Optional.empty() : Optional.of(start.plus(duration));
    }

    /// Checks that interviews may run at an instant.
    ///
    /// @param now the instant, not null
    /// @throws InterviewStateException `cinact` before the start, `cexp` at or after the end
    public void checkActive(Instant now) throws InterviewStateException {
        if (now.isBefore(start)) {
            throw new InterviewStateException(ErrorCode.CAMPAIGN_IS_NOT_YET_ACTIVE);
        }
        Optional<Instant> end = end();
        if (end.isPresent() && !now.isBefore(end.get())) {
            throw new InterviewStateException(ErrorCode.CAMPAIGN_EXPIRED);
        }
    }
}
