package io.interviews.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a source questionnaire, a localization or a template fails validation.
///
/// Compilation is all-or-nothing: when this is thrown nothing has been stored.
public class QuestionnaireValidationException extends InterviewsException {

    @Serial private static final long serialVersionUID = 7361049822515840127L;

    public QuestionnaireValidationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public QuestionnaireValidationException(ErrorCode errorCode, String... labels) {
        super(errorCode, labels);
    }

    public QuestionnaireValidationException(ErrorCode errorCode, int answerIndex) {
        super(errorCode, answerIndex);
    }

    public QuestionnaireValidationException(ErrorCode errorCode, List<String> labels, Throwable cause) {
        super(errorCode, labels, cause);
    }
}
