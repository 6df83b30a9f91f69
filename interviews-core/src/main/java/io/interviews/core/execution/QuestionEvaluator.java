package io.interviews.core.execution;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.EvaluationException;
import io.interviews.core.expression.EvaluationScope;
import io.interviews.core.interview.Answer;
import io.interviews.core.interview.QuestionView;
import io.interviews.core.localization.OptionLocalization;
import io.interviews.core.localization.QuestionLocalization;
import io.interviews.core.questionnaire.Questionnaire;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.BeginLoopQuestion;
import io.interviews.core.questionnaire.question.InputBody;
import io.interviews.core.questionnaire.question.MessageBody;
import io.interviews.core.questionnaire.question.OptionsBody;
import io.interviews.core.questionnaire.question.Question;
import io.interviews.core.questionnaire.question.QuestionBody;
import io.interviews.core.questionnaire.transition.ScriptFunction;
import io.interviews.core.questionnaire.transition.Transition;
import io.interviews.core.text.TextBindings;
import io.interviews.core.util.JsonUtil;
import io.interviews.core.util.Labels;
import io.interviews.core.util.Languages;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs the scripts of a questionnaire against a loop stack.
///
/// Three kinds of scripts exist and each sees different data:
///
/// | Script | Declared names | Answer view |
/// |---|---|---|
/// | transition condition | loop variables, parameters | answer data |
/// | text function | loop variables, parameters, `language`, `language_str2` | localized |
/// | loop operand | the operand question | localized |
///
/// A parameter whose question was skipped is declared as `null`. Every call opens a
/// fresh {@link EvaluationScope}, so scripts never share state.
///
/// @implNote Stateless apart from the immutable {@link ExecutionContext}; thread-safe.
public class QuestionEvaluator {

    private static final Logger logger = Logger.getLogger(QuestionEvaluator.class.getName());

    private final ExecutionContext context;

    public QuestionEvaluator(ExecutionContext context) {
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    public ExecutionContext getContext() {
        return context;
    }

    /// Selects the destination of a question's outgoing transitions.
    ///
    /// Transitions are tried in order; the first unconditional one or the first whose
    /// condition is truthy wins.
    ///
    /// @param stack current loop stack, not null
    /// @param question source question, not final
    /// @return the destination, never null
    /// @throws EvaluationException if a condition fails to evaluate
    /// @throws IllegalStateException if no transition is taken
    public Question runTransitions(LoopStack stack, Question question) throws EvaluationException {
        Questionnaire questionnaire = context.getQuestionnaire();
        for (Transition transition : question.getTransitions()) {
            if (transition.isUnconditional()) {
                return questionnaire.getQuestion(transition.getDestination());
            }
            ScriptFunction condition = transition.getCondition().orElseThrow();
            if (evaluateCondition(stack, question.getLabel(), condition)) {
                logger.fine(
                        "Transition " + question.getLabel() + " -> " + transition.getDestination());
                return questionnaire.getQuestion(transition.getDestination());
            }
        }
        logger.severe("No transition taken from question " + question.getLabel());
        throw new IllegalStateException("No transition taken from " + question.getLabel());
    }

    /// Evaluates a transition condition.
    ///
    /// @param stack current loop stack, not null
    /// @param label label of the question owning the condition, used in errors
    /// @param condition the condition, not null
    /// @return true if the result is boolean true or a non-zero number
    /// @throws EvaluationException if the script fails
    public boolean evaluateCondition(LoopStack stack, String label, ScriptFunction condition)
            throws EvaluationException {
        try (EvaluationScope scope = context.getEvaluator().openScope()) {
            declareLoopVariables(scope, stack);
            for (String parameter : condition.parameters()) {
                scope.declare(
                        parameter,
                        stack.findAnswer(parameter)
                                .map(a -> (Object) AnswerDataFactory.answerData(a.answer()))
                                .orElse(null));
            }
            return JsonUtil.isTruthy(execute(scope, label, condition.code(), false));
        }
    }

    /// Computes the array a loop iterates over.
    ///
    /// The operand answer is declared under its question's label as localized answer
    /// data and the operand code assigns the array to `R`. A result that is not an array
    /// yields no iteration.
    ///
    /// @param stack loop stack at the begin loop, not null
    /// @param beginLoop the loop, not null
    /// @param operandAnswer the answer iterated over, null if the question was skipped
    /// @return the operand array, never null
    /// @throws EvaluationException if the script fails or the array exceeds the
    ///     iteration guard
    public List<Object> computeLoopOperand(
            LoopStack stack, BeginLoopQuestion beginLoop, Answer operandAnswer)
            throws EvaluationException {
        Object result;
        try (EvaluationScope scope = context.getEvaluator().openScope()) {
            scope.declare(
                    beginLoop.getOperandLabel(),
                    operandAnswer == null ? null : localizedAnswerData(stack, operandAnswer));
            result = execute(scope, beginLoop.getLabel(), beginLoop.getOperandCode(), true);
        }
        if (!(result instanceof List<?> list)) {
            logger.fine("Operand of loop " + beginLoop.getLabel() + " is not an array");
            return List.of();
        }
        if (list.size() > context.getMaxLoopIterations()) {
            logger.warning(
                    "Operand of loop "
                            + beginLoop.getLabel()
                            + " has "
                            + list.size()
                            + " elements, more than the allowed "
                            + context.getMaxLoopIterations());
            throw new EvaluationException(
                    ErrorCode.QUESTION_LOOP_LOGIC_ERROR, beginLoop.getLabel());
        }
        return new ArrayList<>(list);
    }

    /// Renders the localized text of a question.
    ///
    /// @param stack current loop stack, not null
    /// @param question the question, not null
    /// @return rendered text, never null
    /// @throws EvaluationException on unknown loop variables or failing functions
    public String renderText(LoopStack stack, AnswerableQuestion question)
            throws EvaluationException {
        QuestionLocalization localization = localizationOf(question);
        return context.getTextResolver()
                .resolve(
                        question.getLabel(),
                        localization.text(),
                        new StackBindings(stack, question));
    }

    /// Builds the display view of an answer.
    ///
    /// Holds the rendered question text, comment label, option labels and the answer
    /// fields, but no timing or network data.
    ///
    /// @param stack loop stack used to render the question text, not null
    /// @param answer the answer, not null
    /// @return mutable JSON-like map, never null
    /// @throws EvaluationException if the question text cannot be rendered
    public Map<String, Object> localizedAnswerData(LoopStack stack, Answer answer)
            throws EvaluationException {
        Question question = context.getQuestionnaire().getQuestion(answer.label());
        if (!(question instanceof AnswerableQuestion aq)) {
            logger.severe("Answer recorded for loop marker " + answer.label());
            throw new IllegalStateException("Answer to a loop marker: " + answer.label());
        }
        QuestionLocalization localization = localizationOf(aq);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("label", answer.label());
        data.put("text", renderText(stack, aq));
        if (!(aq.getBody() instanceof MessageBody)) {
            data.put("comment_label", localization.commentLabel());
        }
        if (aq.getBody() instanceof OptionsBody) {
            List<Object> options = new ArrayList<>(localization.options().size());
            for (OptionLocalization ol : localization.options()) {
                Map<String, Object> option = new LinkedHashMap<>();
                option.put("label", ol.label());
                option.put("comment_label", ol.commentLabel());
                options.add(option);
            }
            data.put("options", options);
        }
        AnswerDataFactory.putBody(data, answer.body());
        return data;
    }

    /// Builds the display view of the next question.
    ///
    /// @param stack loop stack at the question, not null
    /// @param question the question, not null
    /// @return the view, never null
    /// @throws EvaluationException if the text cannot be rendered
    public QuestionView questionView(LoopStack stack, AnswerableQuestion question)
            throws EvaluationException {
        QuestionLocalization localization = localizationOf(question);
        QuestionBody body = question.getBody();
        boolean randomize = false;
        int limit = 0;
        boolean optional = false;
        if (body instanceof OptionsBody ob) {
            randomize = ob.randomize();
            limit = question.getAnswerKind().isMultipleChoice() ? ob.limit() : 0;
        } else if (body instanceof InputBody ib) {
            optional = ib.optional();
        }
        return new QuestionView(
                question.getLabel(),
                question.getAnswerKind().getWireName(),
                renderText(stack, question),
                body.style(),
                localization.commentLabel(),
                localization.options(),
                randomize,
                limit,
                optional,
                context.getQuestionnaire().progress(question),
                question.isFinal());
    }

    private QuestionLocalization localizationOf(AnswerableQuestion question) {
        return context.getLocalization()
                .findQuestionLocalization(question, context.getTemplates())
                .orElseThrow(() -> {
                    logger.severe(
                            "No "
                                    + context.getLanguage()
                                    + " localization for question "
                                    + question.getLabel());
                    return new IllegalStateException(
                            "Missing localization for " + question.getLabel());
                });
    }

    private Object callFunction(LoopStack stack, AnswerableQuestion question, ScriptFunction f)
            throws EvaluationException {
        try (EvaluationScope scope = context.getEvaluator().openScope()) {
            declareLoopVariables(scope, stack);
            for (String parameter : f.parameters()) {
                ScopedAnswer answer = stack.findAnswer(parameter).orElse(null);
                scope.declare(
                        parameter,
                        answer == null ? null : localizedAnswerData(stack, answer.answer()));
            }
            scope.declare(Labels.LANGUAGE, Languages.toIso3(context.getLanguage()));
            scope.declare(Labels.LANGUAGE_STR2, context.getLanguage());
            return execute(scope, question.getLabel(), f.code(), false);
        }
    }

    private static void declareLoopVariables(EvaluationScope scope, LoopStack stack) {
        for (Map.Entry<String, Object> e : stack.loopVariables().entrySet()) {
            scope.declare(e.getKey(), e.getValue());
        }
    }

    private static Object execute(EvaluationScope scope, String label, String code, boolean forR)
            throws EvaluationException {
        try {
            return forR ? scope.executeForResult(code) : scope.execute(code);
        } catch (EvaluationException e) {
            if (!e.getLabels().isEmpty()) {
                throw e;
            }
            throw new EvaluationException(e.getErrorCode(), List.of(label), e);
        }
    }

    private final class StackBindings implements TextBindings {

        private final LoopStack stack;
        private final AnswerableQuestion question;

        private StackBindings(LoopStack stack, AnswerableQuestion question) {
            this.stack = stack;
            this.question = question;
        }

        @Override
        public int functionCount() {
            return question.getBody().functions().size();
        }

        @Override
        public Object call(int index) throws EvaluationException {
            return callFunction(stack, question, question.getBody().functions().get(index));
        }

        @Override
        public boolean hasLoopVariable(String name) {
            return stack.findVariable(name).isPresent();
        }

        @Override
        public Object loopVariable(String name) {
            return stack.findVariable(name).map(StackFrame::getVariableValue).orElse(null);
        }
    }
}
