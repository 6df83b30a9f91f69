package io.interviews.core.questionnaire.question;

import io.interviews.core.questionnaire.transition.ScriptFunction;
import java.util.List;

/// Kind-specific, language-independent part of an answerable question.
///
/// Every body carries a display style and the ordered text functions that the
/// question's localized text calls through `@{n}` markers.
///
/// ### Permitted Subtypes
/// - {@link MessageBody} - text only, acknowledged by the respondent
/// - {@link InputBody} - free text input
/// - {@link OptionsBody} - single or multiple choice among options
public sealed interface QuestionBody permits MessageBody, InputBody, OptionsBody {

    /// Returns the display style hint passed through to clients.
    ///
    /// @return style, never null (may be empty)
    String style();

    /// Returns the text functions in call order.
    ///
    /// @return immutable list, never null
    List<ScriptFunction> functions();

    /// Whether the body allows a free comment next to the answer.
    ///
    /// @return true if a comment is allowed
    boolean hasComment();

    /// Returns a copy of this body with the given text functions.
    ///
    /// @param functions the functions, not null
    /// @return new body, never null
    QuestionBody withFunctions(List<ScriptFunction> functions);
}
