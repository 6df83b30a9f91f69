package io.interviews.core;

import io.interviews.core.campaign.CampaignRepository;
import io.interviews.core.expression.ExpressionEvaluator;
import io.interviews.core.interview.InterviewRepository;
import io.interviews.core.localization.LocalizationRepository;
import io.interviews.core.questionnaire.QuestionnaireRepository;
import io.interviews.core.questionnaire.template.TemplateQuestionRepository;
import io.interviews.core.service.InterviewService;

/// Container holding the wired interview components.
///
/// Implements {@link AutoCloseable} to release the script runtime.
///
/// ### Contracts
/// - **Precondition**: All constructor parameters must be non-null
/// - **Postcondition**: All getters return the same instances passed to constructor
///
/// @implNote Safe for concurrent reads. All fields are final and set at construction time.
///
/// @apiNote Create instances via {@link InterviewsFactory#createEnvironment()} or
/// {@link InterviewsFactory.Builder} rather than direct construction.
///
/// @see InterviewsFactory
public final class InterviewsEnvironment implements AutoCloseable {

    private final InterviewService interviewService;
    private final ExpressionEvaluator expressionEvaluator;
    private final QuestionnaireRepository questionnaireRepository;
    private final LocalizationRepository localizationRepository;
    private final TemplateQuestionRepository templateQuestionRepository;
    private final CampaignRepository campaignRepository;
    private final InterviewRepository interviewRepository;
    private final InterviewsConfig config;

    /// Creates a new environment with the specified components.
    ///
    /// @param interviewService the service over the repositories below, not null
    /// @param expressionEvaluator the script runtime, not null
    /// @param questionnaireRepository questionnaire storage, not null
    /// @param localizationRepository localization storage, not null
    /// @param templateQuestionRepository template library, not null
    /// @param campaignRepository campaign storage, not null
    /// @param interviewRepository interview storage, not null
    /// @param config the configuration in use, not null
    public InterviewsEnvironment(
            InterviewService interviewService,
            ExpressionEvaluator expressionEvaluator,
            QuestionnaireRepository questionnaireRepository,
            LocalizationRepository localizationRepository,
            TemplateQuestionRepository templateQuestionRepository,
            CampaignRepository campaignRepository,
            InterviewRepository interviewRepository,
            InterviewsConfig config) {
        this.interviewService = interviewService;
        this.expressionEvaluator = expressionEvaluator;
        this.questionnaireRepository = questionnaireRepository;
        this.localizationRepository = localizationRepository;
        this.templateQuestionRepository = templateQuestionRepository;
        this.campaignRepository = campaignRepository;
        this.interviewRepository = interviewRepository;
        this.config = config;
    }

    /// Returns the service driving authoring and interviews.
    ///
    /// @return the service, never null
    public InterviewService getInterviewService() {
        return interviewService;
    }

    /// Returns the script runtime.
    ///
    /// @return the evaluator, never null
    public ExpressionEvaluator getExpressionEvaluator() {
        return expressionEvaluator;
    }

    public QuestionnaireRepository getQuestionnaireRepository() {
        return questionnaireRepository;
    }

    public LocalizationRepository getLocalizationRepository() {
        return localizationRepository;
    }

    public TemplateQuestionRepository getTemplateQuestionRepository() {
        return templateQuestionRepository;
    }

    public CampaignRepository getCampaignRepository() {
        return campaignRepository;
    }

    public InterviewRepository getInterviewRepository() {
        return interviewRepository;
    }

    /// Returns the configuration the environment was built with.
    ///
    /// @return the configuration, never null
    public InterviewsConfig getConfig() {
        return config;
    }

    /// Releases the script runtime.
    ///
    /// @apiNote **Side effects**: the evaluator rejects new scopes afterwards
    @Override
    public void close() {
        expressionEvaluator.close();
    }
}
