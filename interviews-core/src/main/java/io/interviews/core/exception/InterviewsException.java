package io.interviews.core.exception;

import java.io.Serial;
import java.util.List;
import java.util.Objects;

/// Root of the checked exceptions raised by the interview engine.
///
/// Every instance carries an {@link ErrorCode} and the context that identifies the
/// offending input: up to two question labels (a question and, for transition errors,
/// its destination) or a history index. The exception message is the code's message
/// followed by that context, e.g. `Question label is a duplicate. At question with
/// label "q1".`
///
/// @see ErrorCode for the catalogue of codes
public class InterviewsException extends Exception {

    @Serial private static final long serialVersionUID = 2469713401658932075L;

    private final ErrorCode errorCode;
    private final List<String> labels;
    private final Integer answerIndex;

    /// Creates an exception without label context.
    ///
    /// @param errorCode the error code, not null
    public InterviewsException(ErrorCode errorCode) {
        this(errorCode, List.of(), null, null);
    }

    /// Creates an exception naming one or two question labels.
    ///
    /// @param errorCode the error code, not null
    /// @param labels offending labels; the second, if any, is a destination label
    public InterviewsException(ErrorCode errorCode, String... labels) {
        this(errorCode, List.of(labels), null, null);
    }

    /// Creates an exception naming a history index.
    ///
    /// @param errorCode the error code, not null
    /// @param answerIndex offending history index
    public InterviewsException(ErrorCode errorCode, int answerIndex) {
        this(errorCode, List.of(), answerIndex, null);
    }

    /// Creates an exception wrapping a lower level failure.
    ///
    /// @param errorCode the error code, not null
    /// @param labels offending labels, not null (may be empty)
    /// @param cause the underlying failure, may be null
    public InterviewsException(ErrorCode errorCode, List<String> labels, Throwable cause) {
        this(errorCode, labels, null, cause);
    }

    private InterviewsException(
            ErrorCode errorCode, List<String> labels, Integer answerIndex, Throwable cause) {
        super(formatMessage(errorCode, labels, answerIndex), cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
        this.labels = List.copyOf(labels);
        this.answerIndex = answerIndex;
    }

    /// Returns the error code.
    ///
    /// @return the code, never null
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /// Returns the short client-facing code, e.g. `"sqtlackcall"`.
    ///
    /// @return the code string, never null
    public String getCode() {
        return errorCode.getCode();
    }

    /// Returns the offending labels, question first and destination second.
    ///
    /// @return immutable list, never null (may be empty)
    public List<String> getLabels() {
        return labels;
    }

    /// Returns the offending history index, if any.
    ///
    /// @return index or null
    public Integer getAnswerIndex() {
        return answerIndex;
    }

    private static String formatMessage(
            ErrorCode errorCode, List<String> labels, Integer answerIndex) {
        StringBuilder sb = new StringBuilder(errorCode.getMessage());
        if (labels.size() == 1) {
            sb.append(" At question with label \"").append(labels.get(0)).append("\".");
        } else if (labels.size() >= 2) {
            sb.append(" At question with label \"")
                    .append(labels.get(0))
                    .append("\" and destination with label \"")
                    .append(labels.get(1))
                    .append("\".");
        }
        if (answerIndex != null) {
            sb.append(" Answer with index \"").append(answerIndex).append("\".");
        }
        return sb.toString();
    }
}
