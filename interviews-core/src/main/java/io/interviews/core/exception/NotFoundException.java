package io.interviews.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a questionnaire, campaign, interview, localization or template cannot be
/// found in its repository.
public class NotFoundException extends InterviewsException {

    @Serial private static final long serialVersionUID = 4415066817300274859L;

    public NotFoundException(ErrorCode errorCode) {
        super(errorCode);
    }

    public NotFoundException(ErrorCode errorCode, String... labels) {
        super(errorCode, labels);
    }

    public NotFoundException(ErrorCode errorCode, int answerIndex) {
        super(errorCode, answerIndex);
    }

    public NotFoundException(ErrorCode errorCode, List<String> labels, Throwable cause) {
        super(errorCode, labels, cause);
    }
}
