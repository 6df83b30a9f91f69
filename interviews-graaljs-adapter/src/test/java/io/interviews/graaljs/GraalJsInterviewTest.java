package io.interviews.graaljs;

import static org.assertj.core.api.Assertions.assertThat;

import io.interviews.core.InterviewsEnvironment;
import io.interviews.core.InterviewsFactory;
import io.interviews.core.compiler.SourceFunction;
import io.interviews.core.compiler.SourceOption;
import io.interviews.core.compiler.SourceQuestion;
import io.interviews.core.compiler.SourceQuestionnaire;
import io.interviews.core.compiler.SourceText;
import io.interviews.core.compiler.SourceTransition;
import io.interviews.core.interview.AnswerBody;
import io.interviews.core.interview.InterviewState;
import io.interviews.core.questionnaire.question.QuestionKind;
import io.interviews.core.service.InterviewService;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/// Runs a whole interview with conditions, a loop operand and text functions written in
/// JavaScript.
class GraalJsInterviewTest {

    private InterviewsEnvironment env;
    private InterviewService service;

    @BeforeEach
    void setUp() {
        env = InterviewsFactory.createEnvironment();
        service = env.getInterviewService();
    }

    @AfterEach
    void tearDown() {
        env.close();
    }

    private static SourceQuestionnaire colors() {
        return new SourceQuestionnaire(
                "colors",
                "en",
                "Colors",
                List.of(
                        new SourceQuestion.WithOptions(
                                "colors",
                                QuestionKind.SELECT_AT_MOST,
                                new SourceText("Which colors do you like?"),
                                "",
                                "",
                                false,
                                0,
                                List.of(
                                        new SourceOption("Red"),
                                        new SourceOption("Green"),
                                        new SourceOption("Blue")),
                                List.of(
                                        SourceTransition.when(
                                                "bye", "colors.choices.length === 0", "colors"),
                                        SourceTransition.to("each"))),
                        new SourceQuestion.BeginLoop(
                                "each",
                                "colors",
                                "R = itvSelected(colors.options, colors.choices)",
                                "color",
                                List.of()),
                        new SourceQuestion.Input(
                                "why", new SourceText("Why @{color}?"), "", "", true, List.of()),
                        new SourceQuestion.EndLoop("each_end", List.of()),
                        new SourceQuestion.Message(
                                "bye",
                                new SourceText(
                                        "You picked @{0}.",
                                        List.of(new SourceFunction(
                                                "itvSelected(colors.options, colors.choices)"
                                                        + ".length",
                                                List.of("colors")))),
                                "",
                                List.of())));
    }

    private String startedInterview() throws Exception {
        String questionnaireId = service.compile(colors()).questionnaire().getId();
        var campaign = service.createCampaign(
                questionnaireId, Instant.now().minus(Duration.ofHours(1)), null);
        String id = service.createInterview(campaign.id()).getId();
        service.start(id, "en", "", "", "127.0.0.1", null);
        return id;
    }

    @Test
    void interview_loopsOverSelectedOptions() throws Exception {
        // Given
        String id = startedInterview();

        // When
        var first = service.submitAnswer(id, AnswerBody.MultipleChoiceAnswer.of(2, 0), "", null);
        var second = service.submitAnswer(id, new AnswerBody.InputAnswer("warm"), "", null);
        var last = service.submitAnswer(id, new AnswerBody.InputAnswer("calm"), "", null);

        // Then
        assertThat(first.text()).isEqualTo("Why Red?");
        assertThat(second.text()).isEqualTo("Why Blue?");
        assertThat(last.text()).isEqualTo("You picked 2.");
        assertThat(last.finalQuestion()).isTrue();
        assertThat(env.getInterviewRepository().findById(id).orElseThrow().getState())
                .isEqualTo(InterviewState.COMPLETED);
    }

    @Test
    void interview_conditionSkipsLoop() throws Exception {
        String id = startedInterview();

        var last = service.submitAnswer(id, AnswerBody.MultipleChoiceAnswer.of(), "", null);

        assertThat(last.label()).isEqualTo("bye");
        assertThat(last.text()).isEqualTo("You picked 0.");
    }

    @Test
    void revision_changedOperandRestartsLoop() throws Exception {
        String id = startedInterview();
        service.submitAnswer(id, AnswerBody.MultipleChoiceAnswer.of(0, 1), "", null);
        service.submitAnswer(id, new AnswerBody.InputAnswer("warm"), "", null);

        var next = service.reviseAnswer(id, 0, AnswerBody.MultipleChoiceAnswer.of(1), "", null);

        assertThat(next.text()).isEqualTo("Why Green?");
        assertThat(env.getInterviewRepository().findById(id).orElseThrow().getHistory().size())
                .isEqualTo(2);
    }
}
