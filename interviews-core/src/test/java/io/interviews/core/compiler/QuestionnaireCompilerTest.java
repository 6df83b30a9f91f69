package io.interviews.core.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.interviews.core.QuestionnaireFixtures;
import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.QuestionnaireValidationException;
import io.interviews.core.localization.OptionLocalization;
import io.interviews.core.localization.QuestionLocalization;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.BeginLoopQuestion;
import io.interviews.core.questionnaire.question.Option;
import io.interviews.core.questionnaire.question.OptionsBody;
import io.interviews.core.questionnaire.question.QuestionKind;
import io.interviews.core.questionnaire.template.InMemoryTemplateQuestionRepository;
import io.interviews.core.questionnaire.template.TemplateQuestion;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("QuestionnaireCompiler")
class QuestionnaireCompilerTest {

    private InMemoryTemplateQuestionRepository templates;
    private QuestionnaireCompiler compiler;

    @BeforeEach
    void setUp() {
        templates = new InMemoryTemplateQuestionRepository();
        compiler = new QuestionnaireCompiler(templates);
    }

    private static SourceQuestion.Input input(String label, SourceTransition... transitions) {
        return new SourceQuestion.Input(
                label, new SourceText("Text of " + label), "", "", false, List.of(transitions));
    }

    private static SourceQuestion.Message end(String label) {
        return new SourceQuestion.Message(label, new SourceText("Bye"), "", List.of());
    }

    private static SourceQuestionnaire source(SourceQuestion... questions) {
        return new SourceQuestionnaire("test", "en", "Test", List.of(questions));
    }

    private void assertRejected(SourceQuestionnaire source, ErrorCode code) {
        assertThatThrownBy(() -> compiler.compile(source, "qq"))
                .isInstanceOf(QuestionnaireValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", code);
    }

    @Nested
    @DisplayName("valid sources")
    class Valid {

        @Test
        @DisplayName("compiles a branching questionnaire with its localization")
        void shouldCompileBranching() throws Exception {
            Compilation compilation = compiler.compile(QuestionnaireFixtures.branching(true), "qq");

            var questionnaire = compilation.questionnaire();
            assertThat(questionnaire.getId()).isEqualTo("qq");
            assertThat(questionnaire.size()).isEqualTo(4);
            assertThat(questionnaire.getFirstQuestion().getLabel()).isEqualTo("q1");
            assertThat(questionnaire.getQuestion("q2").getTransitions())
                    .extracting(t -> t.getDestination())
                    .containsExactly("q3");
            assertThat(questionnaire.getQuestion("q4").isFinal()).isTrue();
            assertThat(((AnswerableQuestion) questionnaire.getQuestion("q3")).textReferences("q1"))
                    .isTrue();
            assertThat(compilation.localization().getLanguage()).isEqualTo("en");
            assertThat(compilation.localization().getQuestions()).containsOnlyKeys(
                    "q1", "q2", "q3", "q4");
        }

        @Test
        @DisplayName("computes loop structure")
        void shouldCompileLoop() throws Exception {
            var questionnaire = compiler.compile(QuestionnaireFixtures.loop(), "qq").questionnaire();

            var beginLoop = (BeginLoopQuestion) questionnaire.getQuestion("people");
            assertThat(beginLoop.getOperandLabel()).isEqualTo("names");
            assertThat(beginLoop.getVariable()).isEqualTo("who");
            assertThat(questionnaire.getInfo("age").loopNest()).containsExactly("people");
            assertThat(questionnaire.getInfo("people_end").matchingBeginLoop())
                    .isEqualTo("people");
            assertThat(questionnaire.getInfo("people_end").loopNest()).isEmpty();
        }

        @Test
        @DisplayName("lets a transition read the answer of its own question")
        void shouldAcceptSelfArgument() throws Exception {
            var questionnaire = compiler.compile(
                            source(
                                    input(
                                            "a",
                                            SourceTransition.when("bye", "a.input == 'x'", "a"),
                                            SourceTransition.to("b")),
                                    input("b"),
                                    end("bye")),
                            "qq")
                    .questionnaire();

            assertThat(questionnaire.getQuestion("a").getTransitions().get(0).getCondition())
                    .hasValueSatisfying(c -> assertThat(c.parameters()).containsExactly("a"));
        }

        @Test
        @DisplayName("resolves template questions against the library")
        void shouldResolveTemplate() throws Exception {
            templates.save(TemplateQuestion.builder()
                    .name("yesno")
                    .category("general")
                    .kind(QuestionKind.SELECT)
                    .body(new OptionsBody(
                            "", List.of(new Option(false), new Option(false)), false, false, 1))
                    .localization(
                            "en",
                            new QuestionLocalization("Yes or no?", "", List.of(
                                    new OptionLocalization("yes"),
                                    new OptionLocalization("no"))))
                    .build());

            var questionnaire = compiler.compile(
                            source(new SourceQuestion.FromTemplate("t", "yesno", List.of()),
                                    end("bye")),
                            "qq")
                    .questionnaire();

            var question = (AnswerableQuestion) questionnaire.getQuestion("t");
            assertThat(question.isFromTemplate()).isTrue();
            assertThat(question.getAnswerKind()).isEqualTo(QuestionKind.SELECT);
        }
    }

    @Nested
    @DisplayName("invalid sources")
    class Invalid {

        @Test
        @DisplayName("rejects an empty questionnaire")
        void shouldRejectEmpty() {
            assertRejected(source(), ErrorCode.QUESTIONNAIRE_HAS_NO_QUESTIONS);
        }

        @Test
        @DisplayName("rejects an unknown language")
        void shouldRejectLanguage() {
            assertRejected(
                    new SourceQuestionnaire("test", "xx", "", List.of(end("bye"))),
                    ErrorCode.LANGUAGE_IS_INVALID);
        }

        @Test
        @DisplayName("rejects invalid and reserved labels")
        void shouldRejectLabels() {
            assertRejected(source(input("1abc"), end("bye")), ErrorCode.QUESTION_LABEL_IS_INVALID);
            assertRejected(
                    source(input("language"), end("bye")), ErrorCode.QUESTION_LABEL_IS_INVALID);
        }

        @Test
        @DisplayName("rejects duplicate labels")
        void shouldRejectDuplicates() {
            assertRejected(
                    source(input("a"), input("a"), end("bye")),
                    ErrorCode.QUESTION_LABEL_IS_A_DUPLICATE);
        }

        @Test
        @DisplayName("rejects conditional transitions without a final catch-all")
        void shouldRejectMissingCatchAll() {
            assertRejected(
                    source(
                            input("a", SourceTransition.when("bye", "true", "a")),
                            end("bye")),
                    ErrorCode.TRANSITIONS_LACK_CATCH_ALL);
        }

        @Test
        @DisplayName("rejects a catch-all before the last transition")
        void shouldRejectEarlyCatchAll() {
            assertRejected(
                    source(
                            input("a", SourceTransition.to("b"), SourceTransition.to("bye")),
                            input("b"),
                            end("bye")),
                    ErrorCode.TRANSITION_CATCH_ALL_IS_NOT_LAST);
        }

        @Test
        @DisplayName("rejects backward transitions")
        void shouldRejectBackwardTransitions() {
            assertRejected(
                    source(input("a"), input("b", SourceTransition.to("a")), end("bye")),
                    ErrorCode.TRANSITIONS_TO_PREVIOUS_QUESTION);
        }

        @Test
        @DisplayName("rejects a transition to its own question")
        void shouldRejectSelfTransition() {
            assertRejected(
                    source(input("a", SourceTransition.to("a")), end("bye")),
                    ErrorCode.TRANSITIONS_TO_ITSELF);
        }

        @Test
        @DisplayName("rejects a begin loop transitioning to another begin loop")
        void shouldRejectBeginLoopToBeginLoop() {
            assertRejected(
                    source(
                            input("a"),
                            new SourceQuestion.BeginLoop(
                                    "outer", "a", "R = []", "v",
                                    List.of(SourceTransition.to("inner"))),
                            input("b"),
                            new SourceQuestion.BeginLoop("inner", "b", "R = []", "w", List.of()),
                            input("c"),
                            new SourceQuestion.EndLoop("inner_end", List.of()),
                            new SourceQuestion.EndLoop("outer_end", List.of()),
                            end("bye")),
                    ErrorCode.BEGIN_LOOP_TRANSITIONS_TO_BEGIN_LOOP);
        }

        @Test
        @DisplayName("rejects a begin loop transitioning out of its body")
        void shouldRejectBeginLoopLeavingBody() {
            List<SourceQuestion> questions = new ArrayList<>(QuestionnaireFixtures.loop().questions());
            questions.set(
                    1,
                    new SourceQuestion.BeginLoop(
                            "people",
                            "names",
                            QuestionnaireFixtures.SPLIT,
                            "who",
                            List.of(SourceTransition.to("done"))));

            assertRejected(
                    new SourceQuestionnaire("test", "en", "", questions),
                    ErrorCode.TRANSITIONS_ACROSS_LOOP);
        }

        @Test
        @DisplayName("rejects a transition to an unknown question")
        void shouldRejectUnknownDestination() {
            assertRejected(
                    source(input("a", SourceTransition.to("nowhere")), end("bye")),
                    ErrorCode.TRANSITION_DOES_NOT_EXIST);
        }

        @Test
        @DisplayName("rejects a non-final question without successor")
        void shouldRejectMissingTransition() {
            assertRejected(source(end("bye"), input("a")), ErrorCode.TRANSITION_IS_MISSING);
        }

        @Test
        @DisplayName("rejects unreachable questions")
        void shouldRejectOrphans() {
            assertRejected(
                    source(input("a", SourceTransition.to("c")), input("b"), end("c")),
                    ErrorCode.QUESTION_IS_ORPHAN);
        }

        @Test
        @DisplayName("rejects unbalanced loops")
        void shouldRejectUnbalancedLoops() {
            assertRejected(
                    source(input("a"), new SourceQuestion.EndLoop("e", List.of()), end("bye")),
                    ErrorCode.QUESTION_LOOP_IS_NOT_BALANCED);
            assertRejected(
                    source(
                            input("a"),
                            new SourceQuestion.BeginLoop("l", "a", "R = []", "v", List.of()),
                            input("b"),
                            end("bye")),
                    ErrorCode.QUESTION_LOOP_IS_NOT_CLOSED);
        }

        @Test
        @DisplayName("rejects a transition jumping out of a loop body")
        void shouldRejectCrossLoopTransition() {
            List<SourceQuestion> questions = new ArrayList<>(QuestionnaireFixtures.loop().questions());
            questions.set(
                    2,
                    new SourceQuestion.Input(
                            "age",
                            new SourceText("How old?"),
                            "",
                            "",
                            false,
                            List.of(SourceTransition.to("done"))));

            assertRejected(
                    new SourceQuestionnaire("test", "en", "", questions),
                    ErrorCode.TRANSITIONS_ACROSS_LOOP);
        }

        @Test
        @DisplayName("rejects a loop over an unknown question")
        void shouldRejectUnknownOperand() {
            assertRejected(
                    source(
                            input("a"),
                            new SourceQuestion.BeginLoop("l", "zz", "R = []", "v", List.of()),
                            input("b"),
                            new SourceQuestion.EndLoop("e", List.of()),
                            end("bye")),
                    ErrorCode.BEGIN_LOOP_REFERS_TO_UNKNOWN_QUESTION);
        }

        @Test
        @DisplayName("rejects a loop over a question of another loop nest")
        void shouldRejectOperandOutsideNest() {
            assertRejected(
                    source(
                            input("a"),
                            new SourceQuestion.BeginLoop("outer", "a", "R = []", "v", List.of()),
                            input("b"),
                            new SourceQuestion.BeginLoop("inner", "a", "R = []", "w", List.of()),
                            input("c"),
                            new SourceQuestion.EndLoop("inner_end", List.of()),
                            new SourceQuestion.EndLoop("outer_end", List.of()),
                            end("bye")),
                    ErrorCode.BEGIN_LOOP_REFERS_TO_QUESTION_WITH_DIFFERENT_LOOP_NEST);
        }

        @Test
        @DisplayName("rejects a transition reading a question of another loop nest")
        void shouldRejectParameterOutsideNest() {
            List<SourceQuestion> questions = new ArrayList<>(QuestionnaireFixtures.loop().questions());
            questions.add(
                    4,
                    input(
                            "after",
                            SourceTransition.when("done", "age.input == '1'", "age"),
                            SourceTransition.to("done")));

            assertRejected(
                    new SourceQuestionnaire("test", "en", "", questions),
                    ErrorCode.ARGUMENT_HAS_DIFFERENT_LOOP_NEST);
        }

        @Test
        @DisplayName("rejects a transition reading a later question")
        void shouldRejectForwardArgument() {
            assertRejected(
                    source(
                            input(
                                    "a",
                                    SourceTransition.when("bye", "b.input == 'x'", "b"),
                                    SourceTransition.to("b")),
                            input("b"),
                            end("bye")),
                    ErrorCode.ARGUMENT_IS_NOT_PREVIOUS);
        }

        @Test
        @DisplayName("rejects a text marker beyond the declared functions")
        void shouldRejectOutOfBoundsCall() {
            assertRejected(
                    source(
                            input("a"),
                            new SourceQuestion.Input(
                                    "b", new SourceText("Hi @{0}"), "", "", false, List.of()),
                            end("bye")),
                    ErrorCode.FUNCTION_CALL_OUT_OF_BOUNDS);
        }

        @Test
        @DisplayName("rejects a text function reading a later question")
        void shouldRejectForwardParameter() {
            assertRejected(
                    source(
                            new SourceQuestion.Input(
                                    "a",
                                    new SourceText(
                                            "Hi @{0}",
                                            List.of(new SourceFunction("b.input", List.of("b")))),
                                    "",
                                    "",
                                    false,
                                    List.of()),
                            input("b"),
                            end("bye")),
                    ErrorCode.FUNCTION_PARAMETER_REFERS_TO_SUBSEQUENT_QUESTION);
        }

        @Test
        @DisplayName("rejects a select with fewer than two options")
        void shouldRejectSingleOptionSelect() {
            assertRejected(
                    source(
                            new SourceQuestion.WithOptions(
                                    "a",
                                    QuestionKind.SELECT,
                                    new SourceText("Pick"),
                                    "",
                                    "",
                                    false,
                                    0,
                                    List.of(new SourceOption("only")),
                                    List.of()),
                            end("bye")),
                    ErrorCode.QUESTION_HAS_INVALID_OPTIONS);
        }

        @Test
        @DisplayName("rejects a template that does not exist")
        void shouldRejectMissingTemplate() {
            assertRejected(
                    source(new SourceQuestion.FromTemplate("t", "nope", List.of()), end("bye")),
                    ErrorCode.TEMPLATE_QUESTION_DOES_NOT_EXIST);
        }
    }
}
