package io.interviews.core.compiler;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.QuestionnaireValidationException;
import io.interviews.core.localization.OptionLocalization;
import io.interviews.core.localization.QuestionLocalization;
import io.interviews.core.localization.QuestionnaireLocalization;
import io.interviews.core.questionnaire.QuestionInfo;
import io.interviews.core.questionnaire.Questionnaire;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.BeginLoopQuestion;
import io.interviews.core.questionnaire.question.EndLoopQuestion;
import io.interviews.core.questionnaire.question.InputBody;
import io.interviews.core.questionnaire.question.MessageBody;
import io.interviews.core.questionnaire.question.Option;
import io.interviews.core.questionnaire.question.OptionsBody;
import io.interviews.core.questionnaire.question.Question;
import io.interviews.core.questionnaire.question.QuestionBody;
import io.interviews.core.questionnaire.question.QuestionKind;
import io.interviews.core.questionnaire.template.TemplateQuestion;
import io.interviews.core.questionnaire.template.TemplateQuestionRepository;
import io.interviews.core.questionnaire.transition.ScriptFunction;
import io.interviews.core.questionnaire.transition.Transition;
import io.interviews.core.text.ParametricText;
import io.interviews.core.util.Labels;
import io.interviews.core.util.Languages;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Turns a flat {@link SourceQuestionnaire} into a checked {@link Questionnaire} graph.
///
/// ### Passes
/// 1. **Nodes**: label syntax and uniqueness, kind-specific bodies, begin loop
///    operands, templates. Assigns ranks and computes loop nests with a stack.
/// 2. **Operand scoping**: a begin loop iterates over an answer at its own loop level.
/// 3. **Transitions and text functions**: catch-all rules, forward-only destinations,
///    cross-loop legality, parameter scoping.
/// 4. **Orphans**: every question but the first is reachable from an earlier one.
///
/// ### Contracts
/// - **Postcondition**: every transition goes to a strictly higher rank
/// - **Postcondition**: loop markers are balanced and properly nested
/// - Compilation is all-or-nothing; this class stores nothing
///
/// @implNote Stateless apart from the template library reference; thread-safe.
public class QuestionnaireCompiler {

    private static final Logger logger = Logger.getLogger(QuestionnaireCompiler.class.getName());

    private final TemplateQuestionRepository templates;

    /// Creates a compiler resolving FromTemplate questions against a template library.
    ///
    /// @param templates template library, not null
    public QuestionnaireCompiler(TemplateQuestionRepository templates) {
        this.templates = Objects.requireNonNull(templates, "templates must not be null");
    }

    /// Compiles a source questionnaire.
    ///
    /// @param source the source, not null
    /// @param questionnaireId id of the questionnaire to create, not null
    /// @return the graph and the localization in the source language, never null
    /// @throws QuestionnaireValidationException naming the offending label(s)
    public Compilation compile(SourceQuestionnaire source, String questionnaireId)
            throws QuestionnaireValidationException {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(questionnaireId, "questionnaireId must not be null");

        if (source.name().isBlank()) {
            throw new QuestionnaireValidationException(ErrorCode.QUESTIONNAIRE_NAME_IS_EMPTY);
        }
        if (source.questions().isEmpty()) {
            throw new QuestionnaireValidationException(ErrorCode.QUESTIONNAIRE_HAS_NO_QUESTIONS);
        }
        if (!Languages.isValid(source.language())) {
            throw new QuestionnaireValidationException(ErrorCode.LANGUAGE_IS_INVALID);
        }

        logger.fine("Compiling questionnaire '" + source.name() + "'");

        QuestionnaireLocalization.Builder localization =
                QuestionnaireLocalization.builder()
                        .questionnaireId(questionnaireId)
                        .language(source.language())
                        .title(source.title())
                        .name(source.name());

        // Pass 1
        Map<String, QuestionInfo> infos = new LinkedHashMap<>();
        Map<String, Question> nodes = new LinkedHashMap<>();
        List<String> loopNest = new ArrayList<>();
        int rank = 0;
        for (SourceQuestion sq : source.questions()) {
            if (!Labels.isValidLabel(sq.label())) {
                throw new QuestionnaireValidationException(
                        ErrorCode.QUESTION_LABEL_IS_INVALID, String.valueOf(sq.label()));
            }
            if (nodes.containsKey(sq.label())) {
                throw new QuestionnaireValidationException(
                        ErrorCode.QUESTION_LABEL_IS_A_DUPLICATE, sq.label());
            }
            Question q = compileNode(sq, nodes, localization);
            if (q instanceof EndLoopQuestion) {
                if (loopNest.isEmpty()) {
                    throw new QuestionnaireValidationException(
                            ErrorCode.QUESTION_LOOP_IS_NOT_BALANCED, q.getLabel());
                }
                String matching = loopNest.remove(loopNest.size() - 1);
                infos.put(q.getLabel(), new QuestionInfo(rank, loopNest, matching));
            } else {
                infos.put(q.getLabel(), new QuestionInfo(rank, loopNest, null));
                if (q instanceof BeginLoopQuestion) {
                    loopNest.add(q.getLabel());
                }
            }
            nodes.put(q.getLabel(), q);
            rank++;
        }
        if (!loopNest.isEmpty()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.QUESTION_LOOP_IS_NOT_CLOSED, loopNest.get(loopNest.size() - 1));
        }

        // Pass 2
        for (Question q : nodes.values()) {
            if (q instanceof BeginLoopQuestion bl
                    && !infos.get(bl.getLabel())
                            .loopNest()
                            .equals(infos.get(bl.getOperandLabel()).loopNest())) {
                throw new QuestionnaireValidationException(
                        ErrorCode.BEGIN_LOOP_REFERS_TO_QUESTION_WITH_DIFFERENT_LOOP_NEST,
                        bl.getLabel());
            }
        }

        // Pass 3
        List<Question> sourceOrder = new ArrayList<>(nodes.values());
        List<Question> compiled = new ArrayList<>(sourceOrder.size());
        for (int i = 0; i < sourceOrder.size(); i++) {
            SourceQuestion sq = source.questions().get(i);
            Question q = sourceOrder.get(i);
            Question next = i + 1 < sourceOrder.size() ? sourceOrder.get(i + 1) : null;
            List<Transition> transitions = compileTransitions(sq, q, next, nodes, infos);
            q = q.withTransitions(transitions);
            SourceText text = inlineText(sq);
            if (q instanceof AnswerableQuestion aq && text != null) {
                q = aq.withBody(compileFunctions(aq, text, infos));
            }
            compiled.add(q);
        }

        Questionnaire questionnaire =
                Questionnaire.builder()
                        .id(questionnaireId)
                        .name(source.name())
                        .questions(compiled)
                        .infos(infos)
                        .build();

        // Pass 4
        questionnaire.checkOrphans();

        QuestionnaireLocalization built = localization.build();
        built.check(questionnaire, templates);

        logger.info(
                "Compiled questionnaire "
                        + questionnaireId
                        + " with "
                        + compiled.size()
                        + " questions");
        return new Compilation(questionnaire, built);
    }

    // Text of the kinds defined inline, null for templates and loop markers.
    private static SourceText inlineText(SourceQuestion sq) {
        if (sq instanceof SourceQuestion.Message m) {
            return m.text();
        }
        if (sq instanceof SourceQuestion.Input in) {
            return in.text();
        }
        if (sq instanceof SourceQuestion.WithOptions wo) {
            return wo.text();
        }
        return null;
    }

    private Question compileNode(
            SourceQuestion sq,
            Map<String, Question> earlier,
            QuestionnaireLocalization.Builder localization)
            throws QuestionnaireValidationException {
        String label = sq.label();
        if (sq instanceof SourceQuestion.Message m) {
            requireText(label, m.text());
            localization.question(label, new QuestionLocalization(m.text().value()));
            return AnswerableQuestion.builder()
                    .label(label)
                    .kind(QuestionKind.MESSAGE)
                    .body(new MessageBody(m.style()))
                    .build();
        }
        if (sq instanceof SourceQuestion.Input in) {
            requireText(label, in.text());
            localization.question(
                    label,
                    new QuestionLocalization(in.text().value(), in.commentLabel(), List.of()));
            return AnswerableQuestion.builder()
                    .label(label)
                    .kind(QuestionKind.INPUT)
                    .body(new InputBody(in.style(), !in.commentLabel().isEmpty(), in.optional()))
                    .build();
        }
        if (sq instanceof SourceQuestion.WithOptions wo) {
            return compileOptions(wo, localization);
        }
        if (sq instanceof SourceQuestion.FromTemplate ft) {
            TemplateQuestion template =
                    templates
                            .findByName(ft.templateName())
                            .orElseThrow(
                                    () ->
                                            new QuestionnaireValidationException(
                                                    ErrorCode.TEMPLATE_QUESTION_DOES_NOT_EXIST,
                                                    label));
            return AnswerableQuestion.builder()
                    .label(label)
                    .kind(QuestionKind.FROM_TEMPLATE)
                    .answerKind(template.getKind())
                    .templateName(template.getName())
                    .body(template.getBody())
                    .build();
        }
        if (sq instanceof SourceQuestion.BeginLoop bl) {
            if (!Labels.isValidLabel(bl.variable())) {
                throw new QuestionnaireValidationException(
                        ErrorCode.BEGIN_LOOP_VARIABLE_IS_INVALID, label);
            }
            if (bl.operandCode().isBlank()) {
                throw new QuestionnaireValidationException(
                        ErrorCode.BEGIN_LOOP_HAS_NO_OPERAND, label);
            }
            Question operand = earlier.get(bl.operandLabel());
            if (operand == null) {
                throw new QuestionnaireValidationException(
                        ErrorCode.BEGIN_LOOP_REFERS_TO_UNKNOWN_QUESTION, label);
            }
            if (!(operand instanceof AnswerableQuestion)) {
                throw new QuestionnaireValidationException(
                        ErrorCode.BEGIN_LOOP_REFERS_TO_UNANSWERABLE_QUESTION, label);
            }
            return new BeginLoopQuestion(
                    label, bl.operandLabel(), bl.operandCode(), bl.variable());
        }
        return new EndLoopQuestion(label);
    }

    private static AnswerableQuestion compileOptions(
            SourceQuestion.WithOptions wo, QuestionnaireLocalization.Builder localization)
            throws QuestionnaireValidationException {
        String label = wo.label();
        requireText(label, wo.text());
        int count = wo.options().size();
        int limit;
        if (wo.kind() == QuestionKind.SELECT) {
            if (count <= 1) {
                throw new QuestionnaireValidationException(
                        ErrorCode.QUESTION_HAS_INVALID_OPTIONS, label);
            }
            limit = 1;
        } else {
            limit = wo.limit() == 0 ? count : wo.limit();
            if (limit <= 1 || count < limit) {
                throw new QuestionnaireValidationException(
                        ErrorCode.QUESTION_HAS_INVALID_OPTIONS, label);
            }
        }

        List<Option> options = new ArrayList<>(count);
        List<OptionLocalization> optionTexts = new ArrayList<>(count);
        for (SourceOption so : wo.options()) {
            options.add(new Option(!so.commentLabel().isEmpty()));
            optionTexts.add(new OptionLocalization(so.label(), so.commentLabel()));
        }
        localization.question(
                label, new QuestionLocalization(wo.text().value(), wo.commentLabel(), optionTexts));
        return AnswerableQuestion.builder()
                .label(label)
                .kind(wo.kind())
                .body(
                        new OptionsBody(
                                wo.style(),
                                options,
                                wo.randomize(),
                                !wo.commentLabel().isEmpty(),
                                limit))
                .build();
    }

    private static void requireText(String label, SourceText text)
            throws QuestionnaireValidationException {
        if (text == null || text.value().isEmpty()) {
            throw new QuestionnaireValidationException(ErrorCode.QUESTION_TEXT_IS_MISSING, label);
        }
    }

    private static List<Transition> compileTransitions(
            SourceQuestion sq,
            Question q,
            Question next,
            Map<String, Question> nodes,
            Map<String, QuestionInfo> infos)
            throws QuestionnaireValidationException {
        String label = q.getLabel();
        List<SourceTransition> sts = sq.transitions();

        if (sts.isEmpty()) {
            if (q.canBeFinal()) {
                return List.of();
            }
            if (next == null) {
                throw new QuestionnaireValidationException(ErrorCode.TRANSITION_IS_MISSING, label);
            }
            return List.of(checkDestination(q, next.getLabel(), nodes, infos));
        }

        SourceTransition last = sts.get(sts.size() - 1);
        if (!last.isCatchAll()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.TRANSITIONS_LACK_CATCH_ALL, label, last.destination());
        }

        QuestionInfo info = infos.get(label);
        List<Transition> transitions = new ArrayList<>(sts.size());
        for (int i = 0; i < sts.size(); i++) {
            SourceTransition st = sts.get(i);
            if (i < sts.size() - 1 && st.isCatchAll()) {
                throw new QuestionnaireValidationException(
                        ErrorCode.TRANSITION_CATCH_ALL_IS_NOT_LAST, label, st.destination());
            }
            Transition destinationOnly = checkDestination(q, st.destination(), nodes, infos);
            if (!st.condition().isEmpty() && !st.code().isEmpty()) {
                throw new QuestionnaireValidationException(
                        ErrorCode.TRANSITION_HAS_BOTH_CONDITION_AND_CODE, label);
            }
            for (String parameter : st.parameters()) {
                QuestionInfo pi = infos.get(parameter);
                if (pi == null) {
                    throw new QuestionnaireValidationException(
                            ErrorCode.ARGUMENT_DOES_NOT_EXIST, label);
                }
                if (pi.rank() > info.rank()) {
                    throw new QuestionnaireValidationException(
                            ErrorCode.ARGUMENT_IS_NOT_PREVIOUS, label);
                }
                if (!pi.loopNest().equals(info.loopNest())) {
                    throw new QuestionnaireValidationException(
                            ErrorCode.ARGUMENT_HAS_DIFFERENT_LOOP_NEST, label);
                }
            }
            String code = st.condition().isEmpty() ? st.code() : st.condition();
            transitions.add(
                    code.isEmpty()
                            ? destinationOnly
                            : Transition.when(
                                    new ScriptFunction(code, st.parameters()),
                                    destinationOnly.getDestination()));
        }
        return transitions;
    }

    private static Transition checkDestination(
            Question q, String destination, Map<String, Question> nodes, Map<String, QuestionInfo> infos)
            throws QuestionnaireValidationException {
        String label = q.getLabel();
        Question dq = nodes.get(destination);
        if (dq == null) {
            throw new QuestionnaireValidationException(
                    ErrorCode.TRANSITION_DOES_NOT_EXIST, label, destination);
        }
        QuestionInfo qi = infos.get(label);
        QuestionInfo di = infos.get(destination);
        if (qi.rank() == di.rank()) {
            throw new QuestionnaireValidationException(ErrorCode.TRANSITIONS_TO_ITSELF, label);
        }
        if (qi.rank() > di.rank()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.TRANSITIONS_TO_PREVIOUS_QUESTION, label, destination);
        }

        if (q instanceof BeginLoopQuestion) {
            if (dq instanceof BeginLoopQuestion) {
                throw new QuestionnaireValidationException(
                        ErrorCode.BEGIN_LOOP_TRANSITIONS_TO_BEGIN_LOOP, label, destination);
            }
            boolean legal =
                    dq instanceof EndLoopQuestion
                            ? label.equals(di.matchingBeginLoop())
                            : label.equals(di.parentBeginLoop());
            if (!legal) {
                throw new QuestionnaireValidationException(
                        ErrorCode.TRANSITIONS_ACROSS_LOOP, label, destination);
            }
        } else {
            String parent = qi.parentBeginLoop();
            boolean legal =
                    dq instanceof EndLoopQuestion
                            ? Objects.equals(parent, di.matchingBeginLoop())
                            : Objects.equals(parent, di.parentBeginLoop());
            if (!legal) {
                throw new QuestionnaireValidationException(
                        ErrorCode.TRANSITIONS_ACROSS_LOOP, label, destination);
            }
        }
        return Transition.to(destination);
    }

    private static QuestionBody compileFunctions(
            AnswerableQuestion q, SourceText text, Map<String, QuestionInfo> infos)
            throws QuestionnaireValidationException {
        String label = q.getLabel();
        QuestionInfo info = infos.get(label);
        List<ScriptFunction> functions = new ArrayList<>(text.functions().size());
        for (SourceFunction sf : text.functions()) {
            if (sf.code().isBlank()) {
                throw new QuestionnaireValidationException(ErrorCode.FUNCTION_HAS_NO_CODE, label);
            }
            for (String parameter : sf.parameters()) {
                QuestionInfo pi = infos.get(parameter);
                if (pi == null) {
                    throw new QuestionnaireValidationException(
                            ErrorCode.FUNCTION_PARAMETER_DOES_NOT_EXIST, label);
                }
                if (pi.rank() == info.rank()) {
                    throw new QuestionnaireValidationException(
                            ErrorCode.FUNCTION_PARAMETER_REFERS_TO_SELF, label);
                }
                if (pi.rank() > info.rank()) {
                    throw new QuestionnaireValidationException(
                            ErrorCode.FUNCTION_PARAMETER_REFERS_TO_SUBSEQUENT_QUESTION, label);
                }
                if (!pi.loopNest().equals(info.loopNest())) {
                    throw new QuestionnaireValidationException(
                            ErrorCode.FUNCTION_PARAMETER_REFERS_TO_QUESTION_WITH_DIFFERENT_LOOP_NEST,
                            label);
                }
            }
            functions.add(new ScriptFunction(sf.code(), sf.parameters()));
        }

        for (ParametricText.Token token : ParametricText.scan(text.value())) {
            if (token instanceof ParametricText.Call call && call.index() >= functions.size()) {
                throw new QuestionnaireValidationException(
                        ErrorCode.FUNCTION_CALL_OUT_OF_BOUNDS, label);
            }
        }
        return q.getBody().withFunctions(functions);
    }
}
