package io.interviews.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when an operation is not allowed in the current interview, campaign or
/// questionnaire state.
public class InterviewStateException extends InterviewsException {

    @Serial private static final long serialVersionUID = -1948812043759316245L;

    public InterviewStateException(ErrorCode errorCode) {
        super(errorCode);
    }

    public InterviewStateException(ErrorCode errorCode, String... labels) {
        super(errorCode, labels);
    }

    public InterviewStateException(ErrorCode errorCode, int answerIndex) {
        super(errorCode, answerIndex);
    }

    public InterviewStateException(ErrorCode errorCode, List<String> labels, Throwable cause) {
        super(errorCode, labels, cause);
    }
}
