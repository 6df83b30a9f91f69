package io.interviews.core.questionnaire.question;

import io.interviews.core.questionnaire.transition.Transition;
import java.util.List;

/// Closes the innermost open loop. Its transitions run once the loop is exhausted.
public final class EndLoopQuestion extends Question {

    public EndLoopQuestion(String label) {
        this(label, List.of());
    }

    private EndLoopQuestion(String label, List<Transition> transitions) {
        super(label, transitions);
    }

    @Override
    public QuestionKind getKind() {
        return QuestionKind.END_LOOP;
    }

    @Override
    public EndLoopQuestion withTransitions(List<Transition> transitions) {
        return new EndLoopQuestion(label, transitions);
    }
}
