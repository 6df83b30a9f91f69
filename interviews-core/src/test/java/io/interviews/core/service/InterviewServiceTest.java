package io.interviews.core.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.interviews.core.InterviewsConfig;
import io.interviews.core.InterviewsEnvironment;
import io.interviews.core.InterviewsFactory;
import io.interviews.core.QuestionnaireFixtures;
import io.interviews.core.compiler.SourceQuestion;
import io.interviews.core.compiler.SourceQuestionnaire;
import io.interviews.core.compiler.SourceText;
import io.interviews.core.exception.AnswerException;
import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.InterviewStateException;
import io.interviews.core.exception.NotFoundException;
import io.interviews.core.exception.QuestionnaireValidationException;
import io.interviews.core.expression.stub.StubExpressionEvaluator;
import io.interviews.core.interview.AnswerBody;
import io.interviews.core.interview.Direction;
import io.interviews.core.interview.InterviewData;
import io.interviews.core.interview.InterviewState;
import io.interviews.core.interview.QuestionView;
import io.interviews.core.localization.OptionLocalization;
import io.interviews.core.localization.QuestionLocalization;
import io.interviews.core.localization.QuestionnaireLocalization;
import io.interviews.core.questionnaire.question.Option;
import io.interviews.core.questionnaire.question.OptionsBody;
import io.interviews.core.questionnaire.question.QuestionKind;
import io.interviews.core.questionnaire.template.TemplateQuestion;
import io.interviews.core.questionnaire.template.TemplateQuestionCategory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InterviewService")
class InterviewServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private static final String PETS = "R = pets.input.split(',')";

    /// `names` -> loop over the names asking `pets` -> inner loop over the pets asking
    /// `kind` -> `done`.
    private static SourceQuestionnaire households() {
        return new SourceQuestionnaire(
                "households",
                "en",
                "Households",
                List.of(
                        new SourceQuestion.Input(
                                "names", new SourceText("Who lives here?"), "", "", true,
                                List.of()),
                        new SourceQuestion.BeginLoop(
                                "people", "names", QuestionnaireFixtures.SPLIT, "who", List.of()),
                        new SourceQuestion.Input(
                                "pets", new SourceText("Pets of @{who}?"), "", "", false,
                                List.of()),
                        new SourceQuestion.BeginLoop("animals", "pets", PETS, "pet", List.of()),
                        new SourceQuestion.Input(
                                "kind", new SourceText("What is @{pet}?"), "", "", false,
                                List.of()),
                        new SourceQuestion.EndLoop("animals_end", List.of()),
                        new SourceQuestion.EndLoop("people_end", List.of()),
                        new SourceQuestion.Message(
                                "done", new SourceText("Thank you"), "", List.of())));
    }

    private InterviewsEnvironment env;
    private InterviewService service;

    @BeforeEach
    void setUp() {
        env = InterviewsFactory.builder()
                .config(InterviewsConfig.builder()
                        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                        .build())
                .expressionEvaluator(QuestionnaireFixtures.evaluator())
                .build();
        service = env.getInterviewService();
    }

    @AfterEach
    void tearDown() {
        env.close();
    }

    private String questionnaire(boolean loop) throws Exception {
        var source = loop ? QuestionnaireFixtures.loop() : QuestionnaireFixtures.branching(false);
        return service.compile(source).questionnaire().getId();
    }

    private String interview(String questionnaireId) throws Exception {
        var campaign = service.createCampaign(
                questionnaireId, NOW.minus(Duration.ofDays(1)), Duration.ofDays(30));
        return service.createInterview(campaign.id()).getId();
    }

    private String started(boolean loop) throws Exception {
        String id = interview(questionnaire(loop));
        service.start(id, null, "resp-1", "", "10.0.0.1", null);
        return id;
    }

    private QuestionView submit(String id, AnswerBody body) throws Exception {
        return service.submitAnswer(id, body, "10.0.0.1", null);
    }

    @Nested
    @DisplayName("authoring")
    class Authoring {

        @Test
        @DisplayName("locks a questionnaire once a campaign uses it")
        void shouldLockOnCampaign() throws Exception {
            String id = questionnaire(false);
            service.renameQuestionnaire(id, "Renamed");

            service.createCampaign(id, NOW, null);

            assertThatThrownBy(() -> service.renameQuestionnaire(id, "Again"))
                    .isInstanceOf(InterviewStateException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.QUESTIONNAIRE_IS_LOCKED);
        }

        @Test
        @DisplayName("clones a locked questionnaire into an editable copy")
        void shouldCloneQuestionnaire() throws Exception {
            String id = questionnaire(false);
            service.createCampaign(id, NOW, null);

            var copy = service.cloneQuestionnaire(id);
            service.renameQuestionnaire(copy.getId(), "Copy");

            assertThat(copy.getId()).isNotEqualTo(id);
            assertThat(copy.isLocked()).isFalse();
            assertThat(copy.getName()).isEqualTo("Copy");
            assertThat(env.getLocalizationRepository().find(copy.getId(), "en")).isPresent();
        }

        @Test
        @DisplayName("rejects a template in an unknown category")
        void shouldRejectTemplateWithoutCategory() throws Exception {
            var template = TemplateQuestion.builder()
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
                    .build();

            assertThatThrownBy(() -> service.addTemplate(template))
                    .isInstanceOf(QuestionnaireValidationException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.TEMPLATE_QUESTION_CATEGORY_DOES_NOT_EXIST);

            service.addTemplateCategory(new TemplateQuestionCategory("general", "General"));
            service.addTemplate(template);

            assertThatThrownBy(() -> service.addTemplate(template))
                    .isInstanceOf(QuestionnaireValidationException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.TEMPLATE_QUESTION_ALREADY_EXISTS);
        }

        @Test
        @DisplayName("reports an unknown questionnaire")
        void shouldReportUnknownQuestionnaire() {
            assertThatThrownBy(() -> service.createCampaign("nope", NOW, null))
                    .isInstanceOf(NotFoundException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.QUESTIONNAIRE_DOES_NOT_EXIST);
        }
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("returns the first question in the default language")
        void shouldStart() throws Exception {
            String id = interview(questionnaire(false));

            QuestionView first = service.start(id, null, "resp-1", "int-1", "10.0.0.1", null);

            assertThat(first.label()).isEqualTo("q1");
            assertThat(first.kind()).isEqualTo("select");
            assertThat(first.text()).isEqualTo("Do you agree?");
            assertThat(first.options()).extracting(OptionLocalization::label)
                    .containsExactly("yes", "no");
            var interview = env.getInterviewRepository().findById(id).orElseThrow();
            assertThat(interview.getState()).isEqualTo(InterviewState.ONGOING);
            assertThat(interview.getLanguage()).isEqualTo("en");
            assertThat(interview.getStartTimestamp()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("refuses a second start")
        void shouldRefuseSecondStart() throws Exception {
            String id = started(false);

            assertThatThrownBy(() -> service.start(id, null, "", "", "", null))
                    .isInstanceOf(InterviewStateException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.INTERVIEW_IS_ALREADY_STARTED);
        }

        @Test
        @DisplayName("refuses a language without localization and stays initiated")
        void shouldRefuseMissingLanguage() throws Exception {
            String id = interview(questionnaire(false));

            assertThatThrownBy(() -> service.start(id, "fr", "", "", "", null))
                    .isInstanceOf(InterviewStateException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.QUESTIONNAIRE_LOCALIZATION_DOES_NOT_EXIST);
            assertThat(env.getInterviewRepository().findById(id).orElseThrow().getState())
                    .isEqualTo(InterviewState.INITIATED);
        }

        @Test
        @DisplayName("refuses a campaign that has not begun")
        void shouldRefuseInactiveCampaign() throws Exception {
            var campaign = service.createCampaign(
                    questionnaire(false), NOW.plus(Duration.ofDays(1)), null);
            String id = service.createInterview(campaign.id()).getId();

            assertThatThrownBy(() -> service.start(id, null, "", "", "", null))
                    .isInstanceOf(InterviewStateException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.CAMPAIGN_IS_NOT_YET_ACTIVE);
        }
    }

    @Nested
    @DisplayName("answers")
    class Answers {

        @Test
        @DisplayName("walks a loop to completion")
        void shouldCompleteLoop() throws Exception {
            String id = started(true);

            assertThat(submit(id, new AnswerBody.InputAnswer("a,b")).text())
                    .isEqualTo("How old is a?");
            assertThat(submit(id, new AnswerBody.InputAnswer("30")).text())
                    .isEqualTo("How old is b?");
            QuestionView last = submit(id, new AnswerBody.InputAnswer("40"));

            assertThat(last.label()).isEqualTo("done");
            assertThat(last.completed()).isTrue();
            assertThat(env.getInterviewRepository().findById(id).orElseThrow().getState())
                    .isEqualTo(InterviewState.COMPLETED);
            assertThatThrownBy(() -> submit(id, new AnswerBody.MessageAnswer()))
                    .isInstanceOf(InterviewStateException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.INTERVIEW_IS_ALREADY_COMPLETED);
        }

        @Test
        @DisplayName("rejects an invalid answer without touching the history")
        void shouldRejectInvalidAnswer() throws Exception {
            String id = started(false);

            assertThatThrownBy(() -> submit(id, new AnswerBody.SelectAnswer(5)))
                    .isInstanceOf(AnswerException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.ANSWER_IS_INCORRECT);
            assertThat(env.getInterviewRepository().findById(id).orElseThrow()
                            .getHistory().size())
                    .isZero();
        }

        @Test
        @DisplayName("recomputes the pending question from the history")
        void shouldAdvanceFromHistory() throws Exception {
            String id = started(false);
            submit(id, new AnswerBody.SelectAnswer(1));

            assertThat(service.advanceFromHistory(id).label()).isEqualTo("q2");
        }

        @Test
        @DisplayName("refuses to advance an interview that is not started")
        void shouldRefuseAdvanceBeforeStart() throws Exception {
            String id = interview(questionnaire(false));

            assertThatThrownBy(() -> service.advanceFromHistory(id))
                    .isInstanceOf(InterviewStateException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INTERVIEW_IS_NOT_STARTED);
        }

        @Test
        @DisplayName("revises an answer and resects the abandoned branch")
        void shouldReviseAnswer() throws Exception {
            String id = started(false);
            submit(id, new AnswerBody.SelectAnswer(1));
            submit(id, new AnswerBody.InputAnswer("because"));

            QuestionView next = service.reviseAnswer(
                    id, 0, new AnswerBody.SelectAnswer(0), "10.0.0.2", null);

            assertThat(next.label()).isEqualTo("q3");
            var history = env.getInterviewRepository().findById(id).orElseThrow().getHistory();
            assertThat(history.size()).isEqualTo(1);
            assertThat(history.findAnswer(0).orElseThrow().ipAddress()).isEqualTo("10.0.0.2");
        }

        @Test
        @DisplayName("refuses to revise a completed interview")
        void shouldRefuseRevisionAfterCompletion() throws Exception {
            String id = started(false);
            submit(id, new AnswerBody.SelectAnswer(0));
            submit(id, new AnswerBody.InputAnswer("nothing"));

            assertThatThrownBy(() -> service.reviseAnswer(
                            id, 0, new AnswerBody.SelectAnswer(1), "", null))
                    .isInstanceOf(InterviewStateException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.INTERVIEW_IS_ALREADY_COMPLETED);
            assertThat(env.getInterviewRepository().findById(id).orElseThrow()
                            .getHistory().findAnswer(0).orElseThrow().body())
                    .isEqualTo(new AnswerBody.SelectAnswer(0));
        }

        @Test
        @DisplayName("releases the interview lock once the interview completes")
        void shouldReleaseLockOnCompletion() throws Exception {
            String id = started(false);
            submit(id, new AnswerBody.SelectAnswer(1));

            assertThat(service.lockCount()).isEqualTo(1);

            submit(id, new AnswerBody.InputAnswer("because"));
            submit(id, new AnswerBody.InputAnswer("nothing"));

            assertThat(service.lockCount()).isZero();
        }

        @Test
        @DisplayName("runs a loop nested in another loop")
        void shouldRunNestedLoops() throws Exception {
            // given
            var evaluator = QuestionnaireFixtures.evaluator()
                    .register(
                            PETS,
                            vars -> {
                                Object input = StubExpressionEvaluator.path(vars, "pets", "input");
                                return new ArrayList<Object>(
                                        Arrays.asList(((String) input).split(",")));
                            });
            try (var nested = InterviewsFactory.builder()
                    .config(InterviewsConfig.builder()
                            .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                            .build())
                    .expressionEvaluator(evaluator)
                    .build()) {
                var s = nested.getInterviewService();
                String qid = s.compile(households()).questionnaire().getId();
                var campaign = s.createCampaign(qid, NOW, null);
                String id = s.createInterview(campaign.id()).getId();
                s.start(id, null, "", "", "", null);

                // when
                List<String> texts = new ArrayList<>();
                for (String input : List.of("a,b", "x,y", "cat", "dog", "z", "fish")) {
                    texts.add(s.submitAnswer(id, new AnswerBody.InputAnswer(input), "", null)
                            .text());
                }

                // then
                assertThat(texts).containsExactly(
                        "Pets of a?",
                        "What is x?",
                        "What is y?",
                        "Pets of b?",
                        "What is z?",
                        "Thank you");
                assertThat(nested.getInterviewRepository().findById(id).orElseThrow()
                                .getState())
                        .isEqualTo(InterviewState.COMPLETED);
            }
        }

        @Test
        @DisplayName("refuses to revise a position that is not an answer")
        void shouldRefuseMissingRevision() throws Exception {
            String id = started(false);
            submit(id, new AnswerBody.SelectAnswer(1));

            assertThatThrownBy(() -> service.reviseAnswer(
                            id, 4, new AnswerBody.SelectAnswer(0), "", null))
                    .isInstanceOf(AnswerException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.ANSWER_INDEX_DOES_NOT_EXIST);
        }
    }

    @Nested
    @DisplayName("catalog")
    class Catalog {

        private TemplateQuestion yesNo(String name) throws Exception {
            return TemplateQuestion.builder()
                    .name(name)
                    .category("general")
                    .kind(QuestionKind.SELECT)
                    .body(new OptionsBody(
                            "", List.of(new Option(false), new Option(false)), false, false, 1))
                    .localization(
                            "en",
                            new QuestionLocalization("Yes or no?", "", List.of(
                                    new OptionLocalization("yes"),
                                    new OptionLocalization("no"))))
                    .build();
        }

        @Test
        @DisplayName("downloads a source that compiles to the same questions")
        void shouldDownloadQuestionnaire() throws Exception {
            String id = questionnaire(false);

            var source = service.downloadQuestionnaire(id, "en");
            var recompiled = service.compile(source).questionnaire();

            assertThat(source.name()).isEqualTo("branching");
            assertThat(recompiled.getQuestions())
                    .extracting(q -> q.getLabel())
                    .containsExactly("q1", "q2", "q3", "q4");
            assertThat(recompiled.findQuestion("q1").orElseThrow().getTransitions())
                    .isEqualTo(env.getQuestionnaireRepository().findById(id).orElseThrow()
                            .findQuestion("q1").orElseThrow().getTransitions());
        }

        @Test
        @DisplayName("refuses to download a language without localization")
        void shouldRefuseDownloadInMissingLanguage() throws Exception {
            String id = questionnaire(false);

            assertThatThrownBy(() -> service.downloadQuestionnaire(id, "fr"))
                    .isInstanceOf(InterviewStateException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.QUESTIONNAIRE_LOCALIZATION_DOES_NOT_EXIST);
        }

        @Test
        @DisplayName("lists the languages of an interview in alphabetical order")
        void shouldListLanguages() throws Exception {
            // given
            var compilation = service.compile(QuestionnaireFixtures.branching(false));
            String qid = compilation.questionnaire().getId();
            var fr = QuestionnaireLocalization.builder()
                    .questionnaireId(qid)
                    .language("fr")
                    .name("branchement")
                    .title("Branchement");
            for (var e : compilation.localization().getQuestions().entrySet()) {
                fr.question(e.getKey(), e.getValue());
            }
            service.addLocalization(fr.build());

            // when
            List<String> languages = service.getLanguages(interview(qid));

            // then
            assertThat(languages).containsExactly("en", "fr");
        }

        @Test
        @DisplayName("lists the campaigns of a questionnaire by start")
        void shouldListCampaigns() throws Exception {
            String id = questionnaire(false);
            var later = service.createCampaign(id, NOW.plus(Duration.ofDays(2)), null);
            var earlier = service.createCampaign(id, NOW, null);
            service.createCampaign(questionnaire(true), NOW, null);

            assertThat(service.getCampaigns(id)).containsExactly(earlier, later);
        }

        @Test
        @DisplayName("lists the templates of a category by name")
        void shouldListTemplates() throws Exception {
            service.addTemplateCategory(new TemplateQuestionCategory("general", "General"));
            service.addTemplate(yesNo("zz"));
            service.addTemplate(yesNo("aa"));

            assertThat(service.getTemplates("general"))
                    .extracting(TemplateQuestion::getName)
                    .containsExactly("aa", "zz");
            assertThatThrownBy(() -> service.getTemplates("other"))
                    .isInstanceOf(NotFoundException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.TEMPLATE_QUESTION_CATEGORY_DOES_NOT_EXIST);
        }

        @Test
        @DisplayName("updates only an existing template category")
        void shouldUpdateTemplateCategory() throws Exception {
            service.addTemplateCategory(new TemplateQuestionCategory("general", "General"));

            service.updateTemplateCategory(new TemplateQuestionCategory("general", "Misc"));

            assertThat(env.getTemplateQuestionRepository().findCategory("general").orElseThrow()
                            .description())
                    .isEqualTo("Misc");
            assertThatThrownBy(() -> service.updateTemplateCategory(
                            new TemplateQuestionCategory("other", "Other")))
                    .isInstanceOf(NotFoundException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.TEMPLATE_QUESTION_CATEGORY_DOES_NOT_EXIST);
        }

        @Test
        @DisplayName("localizes a stored template")
        void shouldLocalizeTemplate() throws Exception {
            service.addTemplateCategory(new TemplateQuestionCategory("general", "General"));
            service.addTemplate(yesNo("yesno"));

            var updated = service.addTemplateLocalization(
                    "yesno",
                    "fr",
                    new QuestionLocalization("Oui ou non ?", "", List.of(
                            new OptionLocalization("oui"), new OptionLocalization("non"))));

            assertThat(updated.getLocalizations()).containsOnlyKeys("en", "fr");
            assertThat(env.getTemplateQuestionRepository().findByName("yesno").orElseThrow()
                            .findLocalization("fr"))
                    .isPresent();
            assertThatThrownBy(() -> service.addTemplateLocalization(
                            "missing", "fr", new QuestionLocalization("?")))
                    .isInstanceOf(NotFoundException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.TEMPLATE_QUESTION_DOES_NOT_EXIST);
        }
    }

    @Nested
    @DisplayName("browsing and export")
    class Browsing {

        private String answered() throws Exception {
            String id = started(false);
            submit(id, new AnswerBody.SelectAnswer(0));
            submit(id, new AnswerBody.InputAnswer("nothing"));
            return id;
        }

        @Test
        @DisplayName("returns the last answer when browsing back from the start")
        void shouldBrowseBackFromStart() throws Exception {
            String id = answered();

            var view = service.getAnswerAt(id, 0, Direction.PREVIOUS);

            assertThat(view.index()).isEqualTo(1);
            assertThat(view.more()).isTrue();
            assertThat(view.data()).containsEntry("label", "q3").containsEntry("input", "nothing");
        }

        @Test
        @DisplayName("browses forward and reports the end")
        void shouldBrowseForward() throws Exception {
            String id = answered();

            var view = service.getAnswerAt(id, 0, Direction.NEXT);

            assertThat(view.index()).isEqualTo(1);
            assertThat(view.more()).isFalse();
            assertThatThrownBy(() -> service.getAnswerAt(id, 1, Direction.NEXT))
                    .isInstanceOf(AnswerException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.ANSWER_INDEX_DOES_NOT_EXIST);
        }

        @Test
        @DisplayName("returns a localized answer at an exact index")
        void shouldReturnExactAnswer() throws Exception {
            String id = answered();

            var view = service.getAnswerAt(id, 0);

            assertThat(view.more()).isTrue();
            assertThat(view.data()).containsEntry("text", "Do you agree?");
            assertThat(QuestionnaireFixtures.map(view.data().get("choice")))
                    .containsEntry("index", 0);
        }

        @Test
        @DisplayName("exports every answer with its timing and network data")
        void shouldExport() throws Exception {
            String id = answered();

            var data = service.exportInterview(id);

            assertThat(data.state()).isEqualTo(InterviewState.COMPLETED);
            assertThat(data.intervieweeId()).isEqualTo("resp-1");
            assertThat(data.answers()).hasSize(2);
            assertThat(data.answers().get(0))
                    .containsEntry("label", "q1")
                    .containsEntry("ip_address", "10.0.0.1")
                    .containsEntry("timestamp", NOW.getEpochSecond())
                    .containsEntry("elapsed", 0L);
        }

        @Test
        @DisplayName("exports every interview of a campaign")
        void shouldExportCampaign() throws Exception {
            var campaign = service.createCampaign(questionnaire(false), NOW, null);
            String first = service.createInterview(campaign.id()).getId();
            String second = service.createInterview(campaign.id()).getId();
            service.start(first, null, "resp-1", "", "", null);

            var data = service.exportCampaign(campaign.id());

            assertThat(data).extracting(InterviewData::id).containsExactlyInAnyOrder(first, second);
            assertThat(data).extracting(InterviewData::state)
                    .containsExactlyInAnyOrder(InterviewState.ONGOING, InterviewState.INITIATED);
        }

        @Test
        @DisplayName("removes an interview and its lock")
        void shouldRemoveInterview() throws Exception {
            String id = started(false);
            submit(id, new AnswerBody.SelectAnswer(0));

            service.removeInterview(id);

            assertThat(env.getInterviewRepository().findById(id)).isEmpty();
            assertThat(service.lockCount()).isZero();
            assertThatThrownBy(() -> service.removeInterview(id))
                    .isInstanceOf(NotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.INTERVIEW_DOES_NOT_EXIST);
        }
    }
}
