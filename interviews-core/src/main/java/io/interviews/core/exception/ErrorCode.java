package io.interviews.core.exception;

/// Stable error codes reported by every {@link InterviewsException}.
///
/// Each code pairs a short machine-readable identifier, meant for API clients, with a
/// human-readable message. Exceptions append the offending label(s) or answer index
/// to the message.
///
/// Codes are grouped by the component that raises them. The identifiers are part of
/// the public contract and must not change once released.
public enum ErrorCode {

    // Source questionnaire
    QUESTIONNAIRE_HAS_NO_QUESTIONS("sqempty", "Source questionnaire has no questions."),
    QUESTIONNAIRE_NAME_IS_EMPTY("sqqname", "Source questionnaire name is empty."),
    LANGUAGE_IS_INVALID("langinv", "Language is invalid."),

    // Questions
    QUESTION_LABEL_IS_INVALID("qlabinv", "Question label is invalid."),
    QUESTION_LABEL_IS_A_DUPLICATE("qlabdup", "Question label is a duplicate."),
    QUESTION_LABEL_DOES_NOT_EXIST("qlnonexist", "Question label does not exist."),
    QUESTION_TEXT_IS_MISSING("sqtextmiss", "Source question's text is missing."),
    QUESTION_HAS_INVALID_OPTIONS("sqinvoptions", "Source question has invalid options."),
    QUESTION_OPTION_LABEL_IS_EMPTY("cllempt", "Question option localization's label is empty."),
    QUESTION_IS_ORPHAN("qorphan", "Question is an orphan."),
    QUESTION_LOOP_IS_NOT_BALANCED("qlnotbal", "Question loop is not balanced."),
    QUESTION_LOOP_IS_NOT_CLOSED("qlnotcl", "Question loop is not closed."),
    QUESTION_LOOP_LOGIC_ERROR("qllerr", "Question loop logic error."),
    QUESTION_LOOP_VARIABLE_UNKNOWN("qlvarun", "Question loop variable unknown."),
    BEGIN_LOOP_HAS_NO_OPERAND("qblnoop", "Question begin loop has no operand."),
    BEGIN_LOOP_VARIABLE_IS_INVALID("qblvarinv", "Question begin loop has invalid variable."),
    BEGIN_LOOP_REFERS_TO_UNKNOWN_QUESTION(
            "qblrtuq", "Question begin loop refers to unknown question."),
    BEGIN_LOOP_REFERS_TO_UNANSWERABLE_QUESTION(
            "qblrtaq", "Question begin loop refers to unanswerable question."),
    BEGIN_LOOP_REFERS_TO_QUESTION_WITH_DIFFERENT_LOOP_NEST(
            "qblrtqwdln", "Question begin loop refers to question with different loop nest."),

    // Transitions
    TRANSITION_IS_MISSING("sqtmiss", "Source question transition is missing."),
    TRANSITIONS_LACK_CATCH_ALL("sqtlackcall", "Source question transitions lack a final catch-all."),
    TRANSITION_CATCH_ALL_IS_NOT_LAST(
            "sqtcallnotl",
            "Source question has a transition with a catch-all and the transition is not the last"
                    + " one."),
    TRANSITION_DOES_NOT_EXIST("sqtnonex", "Source question transition does not exist."),
    TRANSITIONS_TO_ITSELF("sqtself", "Source question transitions to itself."),
    TRANSITIONS_TO_PREVIOUS_QUESTION(
            "sqtprev", "Source question transitions to previous question instead of subsequent."),
    TRANSITIONS_ACROSS_LOOP("sqtxloop", "Source question transitions across a loop."),
    BEGIN_LOOP_TRANSITIONS_TO_BEGIN_LOOP(
            "sqblttbl", "Source question begin loop transitions to another begin loop."),
    TRANSITION_HAS_BOTH_CONDITION_AND_CODE(
            "trhbcac", "Transition has both a condition and code specified."),
    ARGUMENT_DOES_NOT_EXIST("sqanonex", "Source question argument does not exist."),
    ARGUMENT_IS_NOT_PREVIOUS("sqanprev", "Source question argument does not precede the question."),
    ARGUMENT_HAS_DIFFERENT_LOOP_NEST(
            "sqanxloop", "Source question argument refers to question with different loop nest."),

    // Text functions
    FUNCTION_CALL_OUT_OF_BOUNDS(
            "funcoob", "Function call's index is out of bounds. No corresponding function."),
    FUNCTION_HAS_NO_CODE("funcnoc", "Function has no code."),
    FUNCTION_PARAMETER_DOES_NOT_EXIST("funcpmiss", "Function parameter does not exist."),
    FUNCTION_PARAMETER_REFERS_TO_SELF(
            "funcpself", "Function parameter refers to the question bearing it."),
    FUNCTION_PARAMETER_REFERS_TO_SUBSEQUENT_QUESTION(
            "funcpsubseq", "Function parameter refers to a subsequent question."),
    FUNCTION_PARAMETER_REFERS_TO_QUESTION_WITH_DIFFERENT_LOOP_NEST(
            "funcprtqwdln", "Function parameter refers to question with different loop nest."),
    SCRIPT_FAILED("scriptfail", "Script evaluation failed."),

    // Templates
    TEMPLATE_QUESTION_DOES_NOT_EXIST("tqmissl", "Template question does not exist."),
    TEMPLATE_QUESTION_ALREADY_EXISTS("tqexist", "A template question with that label already exists."),
    TEMPLATE_QUESTION_CATEGORY_DOES_NOT_EXIST(
            "tqcmiss", "Template question category does not exist."),
    TEMPLATE_QUESTION_IS_INVALID("tqinv", "Template question is invalid. It points at a template."),
    TEMPLATE_QUESTION_LOCALIZATION_DOES_NOT_EXIST(
            "tqlmiss", "Template question localization does not exist."),

    // Localizations
    QUESTION_LOCALIZATION_DOES_NOT_EXIST("qlmiss", "Question localization is missing."),
    QUESTION_LOCALIZATION_IS_DUPLICATE("qldup", "Question localization is duplicated."),
    QUESTION_LOCALIZATION_TEXT_IS_MISSING("qltmiss", "Question localization text is missing."),
    QUESTION_LOCALIZATION_OPTIONS_SIZE_IS_INCORRECT(
            "qloszinco", "Question localization number of options localizations is incorrect."),
    QUESTION_LOCALIZATION_COMMENT_IS_MISSING(
            "qlcmiss", "Question localization comment label localization is missing."),
    QUESTION_LOCALIZATION_COMMENT_IS_PRESENT(
            "qlcpres", "Question localization comment label must not be supplied."),
    OPTION_LOCALIZATION_COMMENT_DOES_NOT_EXIST(
            "clcmiss", "Question option localization comment is missing."),
    OPTION_LOCALIZATION_COMMENT_IS_PRESENT(
            "clcpres", "Question option localization comment must not be supplied."),
    QUESTIONNAIRE_LOCALIZATION_DOES_NOT_EXIST("qqlmiss", "Language not supported."),

    // Repositories
    QUESTIONNAIRE_DOES_NOT_EXIST("qqnonexist", "Questionnaire does not exist."),
    QUESTIONNAIRE_IS_LOCKED("qqlocked", "Questionnaire is locked, a campaign has been created."),
    CAMPAIGN_DOES_NOT_EXIST("cmiss", "Campaign does not exist."),
    INTERVIEW_DOES_NOT_EXIST("intmiss", "Interview does not exist."),

    // Interview state
    CAMPAIGN_IS_NOT_YET_ACTIVE("cinact", "Campaign is not yet active."),
    CAMPAIGN_EXPIRED("cexp", "Campaign expired."),
    INTERVIEW_IS_ALREADY_COMPLETED("intcompl", "Interview is already completed."),
    INTERVIEW_IS_ALREADY_STARTED("intalst", "Interview is already started."),
    INTERVIEW_IS_NOT_STARTED("intnotst", "Interview is not started."),

    // Answers
    ANSWER_INDEX_DOES_NOT_EXIST("aimiss", "Answer index does not exist."),
    ANSWER_IS_INCORRECT("abincorr", "Answer body is incorrect."),
    ANSWER_IS_MISSING("abmiss", "Answer body is missing.");

    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    /// Returns the short identifier sent to clients.
    ///
    /// @return code such as `"qlabdup"`, never null
    public String getCode() {
        return code;
    }

    /// Returns the human-readable message without any label suffix.
    ///
    /// @return message, never null
    public String getMessage() {
        return message;
    }
}
