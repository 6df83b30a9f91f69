package io.interviews.core.questionnaire.question;

/// Closed set of question kinds with their behavior table.
///
/// | Kind | Final | Answer | Loop marker | Options | Multiple choice |
/// |---|---|---|---|---|---|
/// | MESSAGE | yes | yes | no | no | no |
/// | INPUT | no | yes | no | no | no |
/// | SELECT | no | yes | no | yes | no |
/// | SELECT_AT_MOST, SELECT_LIMIT, RANK_AT_MOST, RANK_LIMIT | no | yes | no | yes | yes |
/// | FROM_TEMPLATE | template's | yes | no | template's | template's |
/// | BEGIN_LOOP, END_LOOP | no | no | yes | no | no |
///
/// A Message is answered by an acknowledgement. `FROM_TEMPLATE` defers every answer
/// related property to the kind of its template, see
/// {@link AnswerableQuestion#getAnswerKind()}.
public enum QuestionKind {
    MESSAGE("message", true, true, false, false, false),
    INPUT("input", false, true, false, false, false),
    SELECT("select", false, true, false, true, false),
    SELECT_AT_MOST("select_at_most", false, true, false, true, true),
    SELECT_LIMIT("select_limit", false, true, false, true, true),
    RANK_AT_MOST("rank_at_most", false, true, false, true, true),
    RANK_LIMIT("rank_limit", false, true, false, true, true),
    FROM_TEMPLATE("from_template", false, true, false, false, false),
    BEGIN_LOOP("begin_loop", false, false, true, false, false),
    END_LOOP("end_loop", false, false, true, false, false);

    private final String wireName;
    private final boolean canBeFinal;
    private final boolean takesAnswer;
    private final boolean loopMarker;
    private final boolean hasOptions;
    private final boolean multipleChoice;

    QuestionKind(
            String wireName,
            boolean canBeFinal,
            boolean takesAnswer,
            boolean loopMarker,
            boolean hasOptions,
            boolean multipleChoice) {
        this.wireName = wireName;
        this.canBeFinal = canBeFinal;
        this.takesAnswer = takesAnswer;
        this.loopMarker = loopMarker;
        this.hasOptions = hasOptions;
        this.multipleChoice = multipleChoice;
    }

    /// Returns the lowercase name used in JSON payloads.
    ///
    /// @return name such as `"select_at_most"`, never null
    public String getWireName() {
        return wireName;
    }

    public boolean canBeFinal() {
        return canBeFinal;
    }

    public boolean takesAnswer() {
        return takesAnswer;
    }

    public boolean isLoopMarker() {
        return loopMarker;
    }

    public boolean hasOptions() {
        return hasOptions;
    }

    public boolean isMultipleChoice() {
        return multipleChoice;
    }

    /// Whether the number of choices must equal the limit rather than not exceed it.
    ///
    /// @return true for SELECT_LIMIT and RANK_LIMIT
    public boolean isExactLimit() {
        return this == SELECT_LIMIT || this == RANK_LIMIT;
    }

    /// Resolves a kind from its wire name.
    ///
    /// @param wireName lowercase name, not null
    /// @return the kind, never null
    /// @throws IllegalArgumentException if the name is unknown
    public static QuestionKind fromWireName(String wireName) {
        for (QuestionKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown question kind: " + wireName);
    }
}
