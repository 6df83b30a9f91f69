package io.interviews.core.interview;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.InterviewStateException;
import io.interviews.core.execution.history.History;
import io.interviews.core.execution.history.HistoryEntry;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// One respondent's run through a campaign's questionnaire.
///
/// ### State machine
/// ```
/// INITIATED --start--> ONGOING --final question reached--> COMPLETED
///      \______________start on a final first question______/
/// ```
///
/// The history is the only record of the answers; the loop stack is rebuilt from it
/// on demand. `nextQuestion` names the question awaiting an answer, or the final
/// question once completed.
///
/// @implNote **Not thread-safe**. Mutated only by the
/// {@link io.interviews.core.service.InterviewService} under the interview's lock.
public final class Interview {

    private static final Logger logger = Logger.getLogger(Interview.class.getName());

    private final String id;
    private final String campaignId;
    private final String questionnaireId;
    private final History history;

    private InterviewState state = InterviewState.INITIATED;
    private String language;
    private String intervieweeId;
    private String interviewerId;
    private Instant startTimestamp;
    private String startIpAddress;
    private Geolocation startGeolocation;
    private String nextQuestion;

    /// Creates an interview in the INITIATED state.
    ///
    /// @param id interview id, not null
    /// @param campaignId owning campaign, not null
    /// @param questionnaireId questionnaire of the campaign, not null
    public Interview(String id, String campaignId, String questionnaireId) {
        this(id, campaignId, questionnaireId, new History());
    }

    /// Creates an interview around an existing history, e.g. when restoring it.
    ///
    /// @param id interview id, not null
    /// @param campaignId owning campaign, not null
    /// @param questionnaireId questionnaire of the campaign, not null
    /// @param history recorded history, not null
    public Interview(String id, String campaignId, String questionnaireId, History history) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.campaignId = Objects.requireNonNull(campaignId, "campaignId must not be null");
        this.questionnaireId =
                Objects.requireNonNull(questionnaireId, "questionnaireId must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
    }

    public String getId() {
        return id;
    }

    public String getCampaignId() {
        return campaignId;
    }

    public String getQuestionnaireId() {
        return questionnaireId;
    }

    public InterviewState getState() {
        return state;
    }

    /// Returns the respondent's language.
    ///
    /// @return ISO 639-1 code, null before the start
    public String getLanguage() {
        return language;
    }

    public String getIntervieweeId() {
        return intervieweeId;
    }

    public String getInterviewerId() {
        return interviewerId;
    }

    public Instant getStartTimestamp() {
        return startTimestamp;
    }

    public String getStartIpAddress() {
        return startIpAddress;
    }

    public Geolocation getStartGeolocation() {
        return startGeolocation;
    }

    /// Returns the recorded history.
    ///
    /// @return the live history, never null
    public History getHistory() {
        return history;
    }

    /// Returns the label of the question awaiting an answer.
    ///
    /// @return label, empty before the start
    public Optional<String> getNextQuestion() {
        return Optional.ofNullable(nextQuestion);
    }

    /// Moves the interview from INITIATED to ONGOING.
    ///
    /// @param language ISO 639-1 code, not null
    /// @param intervieweeId respondent id, may be empty
    /// @param interviewerId interviewer id, may be empty
    /// @param timestamp start instant, not null
    /// @param ipAddress caller IP, may be null
    /// @param geolocation caller position, may be null
    /// @throws InterviewStateException `intalst` if not INITIATED
    public void start(
            String language,
            String intervieweeId,
            String interviewerId,
            Instant timestamp,
            String ipAddress,
            Geolocation geolocation)
            throws InterviewStateException {
        if (state != InterviewState.INITIATED) {
            throw new InterviewStateException(ErrorCode.INTERVIEW_IS_ALREADY_STARTED);
        }
        this.language = Objects.requireNonNull(language, "language must not be null");
        this.intervieweeId = intervieweeId == null ? "" : intervieweeId;
        this.interviewerId = interviewerId == null ? "" : interviewerId;
        this.startTimestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.startIpAddress = ipAddress == null ? "" : ipAddress;
        this.startGeolocation = geolocation;
        this.state = InterviewState.ONGOING;
        logger.info("Interview " + id + " started in " + language);
    }

    /// Checks that answers can be submitted or revised.
    ///
    /// @throws InterviewStateException `intnotst` before the start, `intcompl` once
    ///     completed
    public void checkOngoing() throws InterviewStateException {
        if (state == InterviewState.INITIATED) {
            throw new InterviewStateException(ErrorCode.INTERVIEW_IS_NOT_STARTED);
        }
        if (state == InterviewState.COMPLETED) {
            throw new InterviewStateException(ErrorCode.INTERVIEW_IS_ALREADY_COMPLETED);
        }
    }

    /// Checks that the interview has been started, completed or not.
    ///
    /// @throws InterviewStateException `intnotst` before the start
    public void checkStarted() throws InterviewStateException {
        if (state == InterviewState.INITIATED) {
            throw new InterviewStateException(ErrorCode.INTERVIEW_IS_NOT_STARTED);
        }
    }

    /// Positions the interview on the next question, completing it on a final one.
    ///
    /// @param label label of the next question, not null
    /// @param isFinal whether that question ends the interview
    public void moveTo(String label, boolean isFinal) {
        this.nextQuestion = Objects.requireNonNull(label, "label must not be null");
        if (isFinal && state != InterviewState.COMPLETED) {
            state = InterviewState.COMPLETED;
            logger.info("Interview " + id + " completed at " + label);
        }
    }

    /// Returns when the respondent last acted: the latest answer, revised or not, or the
    /// start.
    ///
    /// @return instant, null before the start
    public Instant lastActivity() {
        Instant last = startTimestamp;
        for (HistoryEntry entry : history.entries()) {
            if (entry instanceof HistoryEntry.AnswerEntry ae
                    && (last == null || ae.answer().timestamp().isAfter(last))) {
                last = ae.answer().timestamp();
            }
        }
        return last;
    }

    @Override
    public String toString() {
        return "Interview{" + id + ", " + state + ", next=" + nextQuestion + "}";
    }
}
