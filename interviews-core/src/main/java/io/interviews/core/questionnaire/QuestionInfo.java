package io.interviews.core.questionnaire;

import java.util.List;

/// Structural position of a question, computed once at compile time.
///
/// The loop nest lists the enclosing begin loop labels, outermost first. A begin loop
/// is not part of its own nest and an end loop's nest excludes its matching begin
/// loop, so a loop's two markers share the same nest.
///
/// @param rank 0-based position in the questionnaire
/// @param loopNest enclosing begin loop labels, outermost first, not null
/// @param matchingBeginLoop label of the matching begin loop for end loops, else null
public record QuestionInfo(int rank, List<String> loopNest, String matchingBeginLoop) {

    public QuestionInfo {
        loopNest = List.copyOf(loopNest);
    }

    /// Returns the innermost enclosing begin loop.
    ///
    /// @return label, or null at top level
    public String parentBeginLoop() {
        return loopNest.isEmpty() ? null : loopNest.get(loopNest.size() - 1);
    }
}
