package io.interviews.core.compiler;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.QuestionnaireValidationException;
import io.interviews.core.localization.OptionLocalization;
import io.interviews.core.localization.QuestionLocalization;
import io.interviews.core.localization.QuestionnaireLocalization;
import io.interviews.core.questionnaire.Questionnaire;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.BeginLoopQuestion;
import io.interviews.core.questionnaire.question.InputBody;
import io.interviews.core.questionnaire.question.MessageBody;
import io.interviews.core.questionnaire.question.OptionsBody;
import io.interviews.core.questionnaire.question.Question;
import io.interviews.core.questionnaire.transition.ScriptFunction;
import io.interviews.core.questionnaire.transition.Transition;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Rebuilds the source form of a compiled questionnaire in one language.
///
/// Submitting the result to {@link QuestionnaireCompiler} yields the same graph. Implicit
/// transitions the compiler added are written out explicitly, and a condition is always
/// written as `condition`, never as `code`.
public final class QuestionnaireDecompiler {

    private static final Logger logger =
            Logger.getLogger(QuestionnaireDecompiler.class.getName());

    private QuestionnaireDecompiler() {}

    /// Decompiles a questionnaire.
    ///
    /// @param questionnaire the compiled graph, not null
    /// @param localization its localization in the wanted language, not null
    /// @return the source questionnaire, never null
    /// @throws QuestionnaireValidationException if an inline question has no
    ///     text in that localization
    public static SourceQuestionnaire decompile(
            Questionnaire questionnaire, QuestionnaireLocalization localization)
            throws QuestionnaireValidationException {
        Objects.requireNonNull(questionnaire, "questionnaire must not be null");
        Objects.requireNonNull(localization, "localization must not be null");

        List<SourceQuestion> questions = new ArrayList<>(questionnaire.size());
        for (Question q : questionnaire.getQuestions()) {
            questions.add(decompile(q, localization));
        }
        logger.fine(
                "Decompiled questionnaire "
                        + questionnaire.getId()
                        + " in "
                        + localization.getLanguage());
        return new SourceQuestionnaire(
                localization.getName(), localization.getLanguage(), localization.getTitle(),
                questions);
    }

    private static SourceQuestion decompile(Question q, QuestionnaireLocalization localization)
            throws QuestionnaireValidationException {
        String label = q.getLabel();
        List<SourceTransition> transitions = transitions(q);
        if (q instanceof BeginLoopQuestion bl) {
            return new SourceQuestion.BeginLoop(
                    label, bl.getOperandLabel(), bl.getOperandCode(), bl.getVariable(),
                    transitions);
        }
        if (!(q instanceof AnswerableQuestion aq)) {
            return new SourceQuestion.EndLoop(label, transitions);
        }
        if (aq.isFromTemplate()) {
            return new SourceQuestion.FromTemplate(label, aq.getTemplateName(), transitions);
        }

        QuestionLocalization ql = localization.getQuestions().get(label);
        if (ql == null) {
            throw new QuestionnaireValidationException(
                    ErrorCode.QUESTION_LOCALIZATION_DOES_NOT_EXIST, label);
        }
        SourceText text = new SourceText(ql.text(), functions(aq.getBody().functions()));
        if (aq.getBody() instanceof MessageBody mb) {
            return new SourceQuestion.Message(label, text, mb.style(), transitions);
        }
        if (aq.getBody() instanceof InputBody ib) {
            return new SourceQuestion.Input(
                    label, text, ib.style(), ql.commentLabel(), ib.optional(), transitions);
        }
        OptionsBody ob = (OptionsBody) aq.getBody();
        List<SourceOption> options = new ArrayList<>(ql.options().size());
        for (OptionLocalization ol : ql.options()) {
            options.add(new SourceOption(ol.label(), ol.commentLabel()));
        }
        return new SourceQuestion.WithOptions(
                label,
                aq.getKind(),
                text,
                ob.style(),
                ql.commentLabel(),
                ob.randomize(),
                aq.getKind().isMultipleChoice() ? ob.limit() : 0,
                options,
                transitions);
    }

    private static List<SourceTransition> transitions(Question q) {
        List<SourceTransition> result = new ArrayList<>(q.getTransitions().size());
        for (Transition t : q.getTransitions()) {
            String destination = t.getDestination();
            result.add(t.getCondition()
                    .map(c -> new SourceTransition(destination, c.code(), "", c.parameters()))
                    .orElseGet(() -> SourceTransition.to(destination)));
        }
        return result;
    }

    private static List<SourceFunction> functions(List<ScriptFunction> functions) {
        List<SourceFunction> result = new ArrayList<>(functions.size());
        for (ScriptFunction f : functions) {
            result.add(new SourceFunction(f.code(), f.parameters()));
        }
        return result;
    }
}
