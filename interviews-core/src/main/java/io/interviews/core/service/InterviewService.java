package io.interviews.core.service;

import io.interviews.core.InterviewsConfig;
import io.interviews.core.campaign.Campaign;
import io.interviews.core.campaign.CampaignRepository;
import io.interviews.core.compiler.Compilation;
import io.interviews.core.compiler.QuestionnaireCompiler;
import io.interviews.core.compiler.QuestionnaireDecompiler;
import io.interviews.core.compiler.SourceQuestionnaire;
import io.interviews.core.exception.AnswerException;
import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.InterviewStateException;
import io.interviews.core.exception.InterviewsException;
import io.interviews.core.exception.NotFoundException;
import io.interviews.core.exception.QuestionnaireValidationException;
import io.interviews.core.execution.AnswerDataFactory;
import io.interviews.core.execution.ExecutionContext;
import io.interviews.core.execution.InterviewEngine;
import io.interviews.core.execution.LoopStack;
import io.interviews.core.execution.QuestionEvaluator;
import io.interviews.core.execution.RevisionEngine;
import io.interviews.core.execution.history.History;
import io.interviews.core.execution.history.HistoryEntry;
import io.interviews.core.expression.ExpressionEvaluator;
import io.interviews.core.interview.Answer;
import io.interviews.core.interview.AnswerBody;
import io.interviews.core.interview.AnswerValidator;
import io.interviews.core.interview.AnswerView;
import io.interviews.core.interview.Direction;
import io.interviews.core.interview.Geolocation;
import io.interviews.core.interview.Interview;
import io.interviews.core.interview.InterviewData;
import io.interviews.core.interview.InterviewRepository;
import io.interviews.core.interview.InterviewState;
import io.interviews.core.interview.QuestionView;
import io.interviews.core.localization.LocalizationRepository;
import io.interviews.core.localization.QuestionLocalization;
import io.interviews.core.localization.QuestionnaireLocalization;
import io.interviews.core.questionnaire.Questionnaire;
import io.interviews.core.questionnaire.QuestionnaireRepository;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.Question;
import io.interviews.core.questionnaire.template.TemplateQuestion;
import io.interviews.core.questionnaire.template.TemplateQuestionCategory;
import io.interviews.core.questionnaire.template.TemplateQuestionRepository;
import io.interviews.core.text.TextResolver;
import io.interviews.core.util.Languages;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/// Entry point for authoring questionnaires and running interviews.
///
/// ### Authoring
/// Compile a source questionnaire, add localizations and templates, clone a
/// questionnaire to edit a locked one, download it back in source form.
///
/// ### Running
/// Create a campaign (locking its questionnaire), create interviews in it, then drive
/// each interview with {@link #start}, {@link #submitAnswer}, {@link #reviseAnswer},
/// {@link #advanceFromHistory} and {@link #getAnswerAt}. Export single interviews or whole
/// campaigns.
///
/// ### Contracts
/// - Operations on one interview are serialized; distinct interviews run concurrently
/// - A failed submit or revision leaves the interview untouched
///
/// @implNote Thread-safe. Per-interview locks live in a {@link ConcurrentHashMap} and are
/// dropped once the interview is completed or deleted. The compiled questionnaires are
/// immutable once locked and shared by every walk.
public class InterviewService {

    private static final Logger logger = Logger.getLogger(InterviewService.class.getName());

    private final QuestionnaireRepository questionnaires;
    private final LocalizationRepository localizations;
    private final TemplateQuestionRepository templates;
    private final CampaignRepository campaigns;
    private final InterviewRepository interviews;
    private final ExpressionEvaluator evaluator;
    private final TextResolver textResolver;
    private final InterviewsConfig config;
    private final QuestionnaireCompiler compiler;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /// Creates a service over the given collaborators.
    ///
    /// @param questionnaires questionnaire storage, not null
    /// @param localizations localization storage, not null
    /// @param templates template library, not null
    /// @param campaigns campaign storage, not null
    /// @param interviews interview storage, not null
    /// @param evaluator script runtime, not null
    /// @param textResolver parametric text resolver, not null
    /// @param config configuration, not null
    public InterviewService(
            QuestionnaireRepository questionnaires,
            LocalizationRepository localizations,
            TemplateQuestionRepository templates,
            CampaignRepository campaigns,
            InterviewRepository interviews,
            ExpressionEvaluator evaluator,
            TextResolver textResolver,
            InterviewsConfig config) {
        this.questionnaires = Objects.requireNonNull(questionnaires, "questionnaires");
        this.localizations = Objects.requireNonNull(localizations, "localizations");
        this.templates = Objects.requireNonNull(templates, "templates");
        this.campaigns = Objects.requireNonNull(campaigns, "campaigns");
        this.interviews = Objects.requireNonNull(interviews, "interviews");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.textResolver = Objects.requireNonNull(textResolver, "textResolver");
        this.config = Objects.requireNonNull(config, "config");
        this.compiler = new QuestionnaireCompiler(templates);
    }

    // --- Authoring ---

    /// Compiles and stores a questionnaire with its first localization.
    ///
    /// @param source the source questionnaire, not null
    /// @return the stored graph and localization, never null
    /// @throws QuestionnaireValidationException if the source is invalid; nothing is
    ///     stored then
    public Compilation compile(SourceQuestionnaire source)
            throws QuestionnaireValidationException {
        Compilation compilation = compiler.compile(source, UUID.randomUUID().toString());
        questionnaires.save(compilation.questionnaire());
        localizations.save(compilation.localization());
        logger.info(
                "Stored questionnaire "
                        + compilation.questionnaire().getId()
                        + " ("
                        + source.name()
                        + ")");
        return compilation;
    }

    /// Adds or replaces a localization of a questionnaire.
    ///
    /// @param localization the localization, not null
    /// @throws NotFoundException if the questionnaire does not exist
    /// @throws QuestionnaireValidationException if the localization is incomplete or
    ///     does not fit the questions
    public void addLocalization(QuestionnaireLocalization localization)
            throws NotFoundException, QuestionnaireValidationException {
        if (!Languages.isValid(localization.getLanguage())) {
            throw new QuestionnaireValidationException(ErrorCode.LANGUAGE_IS_INVALID);
        }
        Questionnaire questionnaire = questionnaire(localization.getQuestionnaireId());
        localization.check(questionnaire, templates);
        localizations.save(localization);
        logger.info(
                "Stored "
                        + localization.getLanguage()
                        + " localization of questionnaire "
                        + questionnaire.getId());
    }

    /// Renames a questionnaire that no campaign uses yet.
    ///
    /// @param questionnaireId questionnaire id, not null
    /// @param name new name, not blank
    /// @throws NotFoundException if the questionnaire does not exist
    /// @throws InterviewStateException `qqlocked` if a campaign uses it
    public void renameQuestionnaire(String questionnaireId, String name)
            throws NotFoundException, InterviewStateException {
        questionnaire(questionnaireId).rename(name);
    }

    /// Copies a questionnaire and its localizations under a new id, unlocked.
    ///
    /// @param questionnaireId source questionnaire id, not null
    /// @return the copy, never null
    /// @throws NotFoundException if the questionnaire does not exist
    public Questionnaire cloneQuestionnaire(String questionnaireId) throws NotFoundException {
        Questionnaire source = questionnaire(questionnaireId);
        Questionnaire copy = source.copy(UUID.randomUUID().toString());
        questionnaires.save(copy);
        for (QuestionnaireLocalization l : localizations.findAll(questionnaireId)) {
            localizations.save(l.copyFor(copy.getId()));
        }
        logger.info("Cloned questionnaire " + questionnaireId + " into " + copy.getId());
        return copy;
    }

    /// Rebuilds the source form of a questionnaire in one language.
    ///
    /// Uploading the result again compiles to the same graph.
    ///
    /// @param questionnaireId questionnaire id, not null
    /// @param language ISO 639-1 code, not null
    /// @return the source questionnaire, never null
    /// @throws NotFoundException if the questionnaire does not exist
    /// @throws InterviewStateException `qqlmiss` if it is not localized in that language
    /// @throws QuestionnaireValidationException if the localization lacks a question
    public SourceQuestionnaire downloadQuestionnaire(String questionnaireId, String language)
            throws InterviewsException {
        Questionnaire questionnaire = questionnaire(questionnaireId);
        QuestionnaireLocalization localization = localizations
                .find(questionnaireId, language)
                .orElseThrow(() -> new InterviewStateException(
                        ErrorCode.QUESTIONNAIRE_LOCALIZATION_DOES_NOT_EXIST));
        return QuestionnaireDecompiler.decompile(questionnaire, localization);
    }

    /// Lists the campaigns running a questionnaire.
    ///
    /// @param questionnaireId questionnaire id, not null
    /// @return campaigns ordered by start, never null
    /// @throws NotFoundException if the questionnaire does not exist
    public List<Campaign> getCampaigns(String questionnaireId) throws NotFoundException {
        questionnaire(questionnaireId);
        List<Campaign> result = new ArrayList<>(campaigns.findByQuestionnaire(questionnaireId));
        result.sort(Comparator.comparing(Campaign::start));
        return result;
    }

    /// Adds a template category.
    ///
    /// @param category the category, not null
    public void addTemplateCategory(TemplateQuestionCategory category) {
        templates.saveCategory(category);
    }

    /// Adds a template question to the library.
    ///
    /// @param template the template, not null
    /// @throws QuestionnaireValidationException if the template is invalid, its category
    ///     does not exist or its name is taken
    public void addTemplate(TemplateQuestion template) throws QuestionnaireValidationException {
        template.validate();
        if (templates.findCategory(template.getCategory()).isEmpty()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.TEMPLATE_QUESTION_CATEGORY_DOES_NOT_EXIST, template.getName());
        }
        if (templates.findByName(template.getName()).isPresent()) {
            throw new QuestionnaireValidationException(
                    ErrorCode.TEMPLATE_QUESTION_ALREADY_EXISTS, template.getName());
        }
        templates.save(template);
    }

    /// Replaces the description of an existing template category.
    ///
    /// @param category the category, not null
    /// @throws NotFoundException `tqcmiss` if no category has that name
    public void updateTemplateCategory(TemplateQuestionCategory category)
            throws NotFoundException {
        templateCategory(category.name());
        templates.saveCategory(category);
    }

    /// Lists the templates of a category.
    ///
    /// @param category category name, not null
    /// @return templates ordered by name, never null
    /// @throws NotFoundException `tqcmiss` if the category does not exist
    public List<TemplateQuestion> getTemplates(String category) throws NotFoundException {
        templateCategory(category);
        List<TemplateQuestion> result = new ArrayList<>(templates.findByCategory(category));
        result.sort(Comparator.comparing(TemplateQuestion::getName));
        return result;
    }

    /// Adds or replaces the localization of a template in one language.
    ///
    /// @param templateName template name, not null
    /// @param language ISO 639-1 code, not null
    /// @param localization texts of the template, not null
    /// @return the updated template, never null
    /// @throws NotFoundException `tqmissl` if the template does not exist
    /// @throws QuestionnaireValidationException if the language is invalid or the
    ///     localization does not fit the template body
    public TemplateQuestion addTemplateLocalization(
            String templateName, String language, QuestionLocalization localization)
            throws InterviewsException {
        if (!Languages.isValid(language)) {
            throw new QuestionnaireValidationException(ErrorCode.LANGUAGE_IS_INVALID);
        }
        TemplateQuestion template = templates
                .findByName(templateName)
                .orElseThrow(() -> new NotFoundException(
                        ErrorCode.TEMPLATE_QUESTION_DOES_NOT_EXIST, templateName));
        TemplateQuestion updated = template.withLocalization(language, localization);
        templates.save(updated);
        logger.info(
                "Template "
                        + templateName
                        + " localized in "
                        + updated.getLocalizations().keySet());
        return updated;
    }

    // --- Campaigns and interviews ---

    /// Creates a campaign and locks its questionnaire.
    ///
    /// @param questionnaireId questionnaire id, not null
    /// @param start first active instant, not null
    /// @param duration campaign length, null for open-ended
    /// @return the campaign, never null
    /// @throws NotFoundException if the questionnaire does not exist
    public Campaign createCampaign(String questionnaireId, Instant start, Duration duration)
            throws NotFoundException {
        Questionnaire questionnaire = questionnaire(questionnaireId);
        questionnaire.lock();
        Campaign campaign =
                new Campaign(UUID.randomUUID().toString(), questionnaireId, start, duration);
        campaigns.save(campaign);
        logger.info("Created campaign " + campaign.id() + " on questionnaire " + questionnaireId);
        return campaign;
    }

    /// Creates an interview in a campaign.
    ///
    /// @param campaignId campaign id, not null
    /// @return the interview in the INITIATED state, never null
    /// @throws NotFoundException if the campaign does not exist
    public Interview createInterview(String campaignId) throws NotFoundException {
        Campaign campaign = campaign(campaignId);
        Interview interview =
                new Interview(UUID.randomUUID().toString(), campaignId, campaign.questionnaireId());
        interviews.save(interview);
        return interview;
    }

    /// Lists the languages an interview can be conducted in.
    ///
    /// @param interviewId interview id, not null
    /// @return ISO 639-1 codes in alphabetical order, never null
    /// @throws NotFoundException if the interview does not exist
    public List<String> getLanguages(String interviewId) throws NotFoundException {
        Interview interview = interview(interviewId);
        List<String> languages = new ArrayList<>();
        for (QuestionnaireLocalization l : localizations.findAll(interview.getQuestionnaireId())) {
            languages.add(l.getLanguage());
        }
        languages.sort(Comparator.naturalOrder());
        return languages;
    }

    /// Deletes an interview.
    ///
    /// @param interviewId interview id, not null
    /// @throws NotFoundException if the interview does not exist
    public void removeInterview(String interviewId) throws InterviewsException {
        locked(interviewId, () -> {
            interview(interviewId);
            interviews.delete(interviewId);
            logger.info("Removed interview " + interviewId);
            return null;
        });
    }

    // --- Running ---

    /// Starts an interview.
    ///
    /// @param interviewId interview id, not null
    /// @param language ISO 639-1 code, null for the configured default
    /// @param intervieweeId respondent id, may be null
    /// @param interviewerId interviewer id, may be null
    /// @param ipAddress caller IP, may be null
    /// @param geolocation caller position, may be null
    /// @return the first question, completed if it is final, never null
    /// @throws NotFoundException if the interview or its campaign does not exist
    /// @throws InterviewStateException if already started, the campaign is inactive or
    ///     the language is not available
    /// @throws InterviewsException if the localization is incomplete or a script fails
    public QuestionView start(
            String interviewId,
            String language,
            String intervieweeId,
            String interviewerId,
            String ipAddress,
            Geolocation geolocation)
            throws InterviewsException {
        return locked(interviewId, () -> {
            Interview interview = interview(interviewId);
            if (interview.getState() != InterviewState.INITIATED) {
                throw new InterviewStateException(ErrorCode.INTERVIEW_IS_ALREADY_STARTED);
            }
            Instant now = config.getClock().instant();
            campaign(interview.getCampaignId()).checkActive(now);
            String lang = language == null ? config.getDefaultLanguage() : language;
            QuestionEvaluator questionEvaluator =
                    questionEvaluator(questionnaire(interview.getQuestionnaireId()), lang);
            InterviewEngine engine = new InterviewEngine(questionEvaluator);

            History work = interview.getHistory().copy();
            LoopStack stack = new LoopStack();
            AnswerableQuestion first = engine.start(work, stack);
            QuestionView view = questionEvaluator.questionView(stack, first);

            interview.start(lang, intervieweeId, interviewerId, now, ipAddress, geolocation);
            interview.getHistory().replaceWith(work);
            interview.moveTo(first.getLabel(), first.isFinal());
            interviews.save(interview);
            return view;
        });
    }

    /// Recomputes the question awaiting an answer from the history, changing nothing.
    ///
    /// @param interviewId interview id, not null
    /// @return the current question, never null
    /// @throws InterviewsException if the interview is unknown or not started, or a
    ///     script fails
    public QuestionView advanceFromHistory(String interviewId) throws InterviewsException {
        return locked(interviewId, () -> {
            Interview interview = interview(interviewId);
            interview.checkStarted();
            QuestionEvaluator questionEvaluator = questionEvaluator(interview);
            InterviewEngine.Cursor cursor =
                    new InterviewEngine(questionEvaluator).lookahead(interview.getHistory());
            return questionEvaluator.questionView(cursor.stack(), cursor.question());
        });
    }

    /// Answers the question awaiting an answer and moves on.
    ///
    /// @param interviewId interview id, not null
    /// @param body the answer, not null
    /// @param ipAddress caller IP, may be null
    /// @param geolocation caller position, may be null
    /// @return the next question, never null
    /// @throws AnswerException if the body does not fit the question
    /// @throws InterviewStateException if the interview is not ongoing or the campaign
    ///     is inactive
    /// @throws InterviewsException if a script fails
    public QuestionView submitAnswer(
            String interviewId, AnswerBody body, String ipAddress, Geolocation geolocation)
            throws InterviewsException {
        return locked(interviewId, () -> {
            Interview interview = interview(interviewId);
            interview.checkOngoing();
            Instant now = config.getClock().instant();
            campaign(interview.getCampaignId()).checkActive(now);
            QuestionEvaluator questionEvaluator = questionEvaluator(interview);
            InterviewEngine engine = new InterviewEngine(questionEvaluator);

            Question current = questionEvaluator.getContext()
                    .getQuestionnaire()
                    .getQuestion(interview.getNextQuestion().orElseThrow());
            AnswerValidator.validate((AnswerableQuestion) current, body);
            Answer answer = new Answer(
                    current.getLabel(),
                    body,
                    now,
                    Duration.between(interview.lastActivity(), now),
                    Duration.between(interview.getStartTimestamp(), now),
                    ipAddress,
                    geolocation);

            History work = interview.getHistory().copy();
            LoopStack stack = engine.replay(work, work.size());
            AnswerableQuestion next = engine.submit(work, stack, answer);
            QuestionView view = questionEvaluator.questionView(stack, next);

            interview.getHistory().replaceWith(work);
            interview.moveTo(next.getLabel(), next.isFinal());
            interviews.save(interview);
            return view;
        });
    }

    /// Replaces a past answer, resecting the part of the history it invalidates.
    ///
    /// @param interviewId interview id, not null
    /// @param index history index of the answer to revise
    /// @param body the new answer, not null
    /// @param ipAddress caller IP, may be null
    /// @param geolocation caller position, may be null
    /// @return the question awaiting an answer after the revision, never null
    /// @throws AnswerException `aimiss` if `index` is not an answer, or if the body
    ///     does not fit the question
    /// @throws InterviewStateException if the interview is not ongoing or the campaign
    ///     is inactive
    /// @throws InterviewsException if a script fails
    public QuestionView reviseAnswer(
            String interviewId,
            int index,
            AnswerBody body,
            String ipAddress,
            Geolocation geolocation)
            throws InterviewsException {
        return locked(interviewId, () -> {
            Interview interview = interview(interviewId);
            interview.checkOngoing();
            Instant now = config.getClock().instant();
            campaign(interview.getCampaignId()).checkActive(now);
            Answer original = interview.getHistory()
                    .findAnswer(index)
                    .orElseThrow(() -> new AnswerException(
                            ErrorCode.ANSWER_INDEX_DOES_NOT_EXIST, index));
            QuestionEvaluator questionEvaluator = questionEvaluator(interview);
            AnswerableQuestion question = (AnswerableQuestion) questionEvaluator.getContext()
                    .getQuestionnaire()
                    .getQuestion(original.label());
            AnswerValidator.validate(question, body);

            RevisionEngine.Revision revision =
                    new RevisionEngine(new InterviewEngine(questionEvaluator))
                            .revise(
                                    interview.getHistory(),
                                    index,
                                    original.revised(body, now, ipAddress, geolocation));
            QuestionView view = questionEvaluator.questionView(revision.stack(), revision.next());

            interview.getHistory().replaceWith(revision.history());
            interview.moveTo(revision.next().getLabel(), revision.next().isFinal());
            interviews.save(interview);
            return view;
        });
    }

    /// Browses the answers of an interview.
    ///
    /// `PREVIOUS` from index 0 returns the last answer; otherwise the closest answer
    /// strictly before (`PREVIOUS`) or after (`NEXT`) `index` is returned.
    ///
    /// @param interviewId interview id, not null
    /// @param index history index to browse from
    /// @param direction browsing direction, not null
    /// @return the localized answer, its index and whether more answers follow in that
    ///     direction, never null
    /// @throws AnswerException `aimiss` if no answer lies in that direction
    /// @throws InterviewsException if the interview is unknown or not started
    public AnswerView getAnswerAt(String interviewId, int index, Direction direction)
            throws InterviewsException {
        return locked(interviewId, () -> {
            Interview interview = interview(interviewId);
            interview.checkStarted();
            History history = interview.getHistory();
            if (index < 0 || index > history.size()) {
                throw new AnswerException(ErrorCode.ANSWER_INDEX_DOES_NOT_EXIST, index);
            }
            int found;
            boolean more;
            if (direction == Direction.PREVIOUS) {
                found = previousAnswer(history, index == 0 ? history.size() - 1 : index - 1);
                more = found >= 0 && previousAnswer(history, found - 1) >= 0;
            } else {
                found = nextAnswer(history, index + 1);
                more = found >= 0 && nextAnswer(history, found + 1) >= 0;
            }
            if (found < 0) {
                throw new AnswerException(ErrorCode.ANSWER_INDEX_DOES_NOT_EXIST, index);
            }
            return answerView(interview, found, more);
        });
    }

    /// Returns the answer at an exact history index.
    ///
    /// @param interviewId interview id, not null
    /// @param index history index of an answer
    /// @return the localized answer, never null; `more` tells whether later answers exist
    /// @throws AnswerException `aimiss` if `index` is not an answer
    /// @throws InterviewsException if the interview is unknown or not started
    public AnswerView getAnswerAt(String interviewId, int index) throws InterviewsException {
        return locked(interviewId, () -> {
            Interview interview = interview(interviewId);
            interview.checkStarted();
            History history = interview.getHistory();
            if (history.findAnswer(index).isEmpty()) {
                throw new AnswerException(ErrorCode.ANSWER_INDEX_DOES_NOT_EXIST, index);
            }
            return answerView(interview, index, nextAnswer(history, index + 1) >= 0);
        });
    }

    /// Exports an interview with the answer data of every answer.
    ///
    /// @param interviewId interview id, not null
    /// @return the export, never null
    /// @throws NotFoundException if the interview does not exist
    public InterviewData exportInterview(String interviewId) throws InterviewsException {
        return locked(interviewId, () -> interviewData(interview(interviewId)));
    }

    /// Exports every interview of a campaign, for automated processing.
    ///
    /// @param campaignId campaign id, not null
    /// @return one export per interview, never null
    /// @throws NotFoundException if the campaign does not exist
    public List<InterviewData> exportCampaign(String campaignId) throws InterviewsException {
        campaign(campaignId);
        List<InterviewData> result = new ArrayList<>();
        for (Interview listed : interviews.findByCampaign(campaignId)) {
            String id = listed.getId();
            result.add(locked(id, () -> interviewData(interview(id))));
        }
        logger.fine("Exported " + result.size() + " interviews of campaign " + campaignId);
        return result;
    }

    // --- Helpers ---

    private static InterviewData interviewData(Interview interview) {
        List<Map<String, Object>> answers = new ArrayList<>();
        for (HistoryEntry entry : interview.getHistory().entries()) {
            if (entry instanceof HistoryEntry.AnswerEntry ae) {
                answers.add(AnswerDataFactory.answerData(ae.answer()));
            }
        }
        return new InterviewData(
                interview.getId(),
                interview.getCampaignId(),
                interview.getQuestionnaireId(),
                interview.getState(),
                interview.getLanguage(),
                interview.getIntervieweeId(),
                interview.getInterviewerId(),
                interview.getStartTimestamp(),
                interview.getStartIpAddress(),
                interview.getStartGeolocation(),
                answers);
    }

    private AnswerView answerView(Interview interview, int index, boolean more)
            throws InterviewsException {
        QuestionEvaluator questionEvaluator = questionEvaluator(interview);
        History history = interview.getHistory();
        LoopStack stack = new InterviewEngine(questionEvaluator).replay(history, index);
        Answer answer = history.findAnswer(index).orElseThrow();
        return new AnswerView(questionEvaluator.localizedAnswerData(stack, answer), index, more);
    }

    private static int previousAnswer(History history, int from) {
        for (int i = Math.min(from, history.size() - 1); i >= 0; i--) {
            if (history.get(i) instanceof HistoryEntry.AnswerEntry) {
                return i;
            }
        }
        return -1;
    }

    private static int nextAnswer(History history, int from) {
        for (int i = Math.max(from, 0); i < history.size(); i++) {
            if (history.get(i) instanceof HistoryEntry.AnswerEntry) {
                return i;
            }
        }
        return -1;
    }

    private QuestionEvaluator questionEvaluator(Interview interview) throws InterviewsException {
        return questionEvaluator(
                questionnaire(interview.getQuestionnaireId()), interview.getLanguage());
    }

    private QuestionEvaluator questionEvaluator(Questionnaire questionnaire, String language)
            throws InterviewsException {
        QuestionnaireLocalization localization = localizations
                .find(questionnaire.getId(), language)
                .orElseThrow(() -> new InterviewStateException(
                        ErrorCode.QUESTIONNAIRE_LOCALIZATION_DOES_NOT_EXIST));
        localization.check(questionnaire, templates);
        return new QuestionEvaluator(ExecutionContext.builder()
                .questionnaire(questionnaire)
                .localization(localization)
                .templates(templates)
                .evaluator(evaluator)
                .textResolver(textResolver)
                .maxLoopIterations(config.getMaxLoopIterations())
                .build());
    }

    private Questionnaire questionnaire(String id) throws NotFoundException {
        return questionnaires.findById(id)
                .orElseThrow(() -> new NotFoundException(ErrorCode.QUESTIONNAIRE_DOES_NOT_EXIST));
    }

    private Campaign campaign(String id) throws NotFoundException {
        return campaigns.findById(id)
                .orElseThrow(() -> new NotFoundException(ErrorCode.CAMPAIGN_DOES_NOT_EXIST));
    }

    private TemplateQuestionCategory templateCategory(String name) throws NotFoundException {
        return templates.findCategory(name)
                .orElseThrow(() -> new NotFoundException(
                        ErrorCode.TEMPLATE_QUESTION_CATEGORY_DOES_NOT_EXIST, name));
    }

    private Interview interview(String id) throws NotFoundException {
        return interviews.findById(id)
                .orElseThrow(() -> new NotFoundException(ErrorCode.INTERVIEW_DOES_NOT_EXIST));
    }

    private <T> T locked(String interviewId, InterviewOperation<T> operation)
            throws InterviewsException {
        Objects.requireNonNull(interviewId, "interviewId must not be null");
        ReentrantLock lock = locks.computeIfAbsent(interviewId, id -> new ReentrantLock());
        lock.lock();
        try {
            return operation.run();
        } finally {
            // Completed and deleted interviews are never mutated again.
            boolean settled = interviews.findById(interviewId)
                    .map(i -> i.getState() == InterviewState.COMPLETED)
                    .orElse(true);
            if (settled) {
                locks.remove(interviewId, lock);
            }
            lock.unlock();
        }
    }

    int lockCount() {
        return locks.size();
    }

    @FunctionalInterface
    private interface InterviewOperation<T> {
        T run() throws InterviewsException;
    }
}
