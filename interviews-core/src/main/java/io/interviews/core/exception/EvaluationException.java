package io.interviews.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown when a script or a text template cannot be evaluated.
///
/// Covers unknown loop variables, out-of-bounds text function indices and scripts
/// rejected by the {@link io.interviews.core.expression.ExpressionEvaluator}.
public class EvaluationException extends InterviewsException {

    @Serial private static final long serialVersionUID = -3050147361120795411L;

    public EvaluationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public EvaluationException(ErrorCode errorCode, String... labels) {
        super(errorCode, labels);
    }

    public EvaluationException(ErrorCode errorCode, int answerIndex) {
        super(errorCode, answerIndex);
    }

    public EvaluationException(ErrorCode errorCode, List<String> labels, Throwable cause) {
        super(errorCode, labels, cause);
    }
}
