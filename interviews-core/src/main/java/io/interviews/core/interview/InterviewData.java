package io.interviews.core.interview;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Export of an interview: header fields and the answer data of every answer, in
/// history order.
///
/// The answers carry the same data transition conditions see.
///
/// @param id interview id
/// @param campaignId campaign id
/// @param questionnaireId questionnaire id
/// @param state current state
/// @param language ISO 639-1 code, null if never started
/// @param intervieweeId respondent id
/// @param interviewerId interviewer id
/// @param startTimestamp start instant, null if never started
/// @param startIpAddress start IP
/// @param startGeolocation start position, may be null
/// @param answers answer data maps, never null
public record InterviewData(
        String id,
        String campaignId,
        String questionnaireId,
        InterviewState state,
        String language,
        String intervieweeId,
        String interviewerId,
        Instant startTimestamp,
        String startIpAddress,
        Geolocation startGeolocation,
        List<Map<String, Object>> answers) {

    public InterviewData {
        Objects.requireNonNull(id, "id must not be null");
        answers = answers == null ? List.of() : List.copyOf(answers);
    }
}
