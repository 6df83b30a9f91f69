package io.interviews.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when an answer does not fit its question or a history index is unknown.
public class AnswerException extends InterviewsException {

    @Serial private static final long serialVersionUID = 5120874663394027317L;

    public AnswerException(ErrorCode errorCode) {
        super(errorCode);
    }

    public AnswerException(ErrorCode errorCode, String... labels) {
        super(errorCode, labels);
    }

    public AnswerException(ErrorCode errorCode, int answerIndex) {
        super(errorCode, answerIndex);
    }

    public AnswerException(ErrorCode errorCode, List<String> labels, Throwable cause) {
        super(errorCode, labels, cause);
    }
}
