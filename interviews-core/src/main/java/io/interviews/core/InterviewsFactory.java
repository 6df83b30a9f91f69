package io.interviews.core;

import io.interviews.core.campaign.CampaignRepository;
import io.interviews.core.campaign.InMemoryCampaignRepository;
import io.interviews.core.expression.ExpressionEvaluator;
import io.interviews.core.expression.ExpressionEvaluators;
import io.interviews.core.interview.InMemoryInterviewRepository;
import io.interviews.core.interview.InterviewRepository;
import io.interviews.core.localization.InMemoryLocalizationRepository;
import io.interviews.core.localization.LocalizationRepository;
import io.interviews.core.questionnaire.InMemoryQuestionnaireRepository;
import io.interviews.core.questionnaire.QuestionnaireRepository;
import io.interviews.core.questionnaire.template.InMemoryTemplateQuestionRepository;
import io.interviews.core.questionnaire.template.TemplateQuestionRepository;
import io.interviews.core.service.InterviewService;
import io.interviews.core.text.ParametricTextResolver;
import io.interviews.core.text.TextResolver;
import java.util.Properties;
import java.util.logging.Logger;

/// Factory for creating and wiring interview environments.
///
/// ### Usage Patterns
///
/// **Quick start** with the evaluator discovered on the class path:
/// {@snippet :
/// try (var env = InterviewsFactory.createEnvironment()) {
///     var compilation = env.getInterviewService().compile(source);
/// }
/// }
///
/// **Builder** with explicit components, typically in tests:
/// {@snippet :
/// var env = InterviewsFactory.builder()
///     .config(InterviewsConfig.builder().clock(fixedClock).build())
///     .expressionEvaluator(new StubExpressionEvaluator())
///     .build();
/// }
///
/// @implNote Utility class with only static methods. Unset repositories default to the
/// in-memory implementations.
///
/// @see InterviewsEnvironment
/// @see InterviewsConfig
public final class InterviewsFactory {

    private static final Logger logger = Logger.getLogger(InterviewsFactory.class.getName());

    private InterviewsFactory() {
        // Utility class - prevent instantiation
    }

    /// Creates an environment with default configuration.
    ///
    /// @return a fully-configured environment, never null
    /// @throws IllegalStateException if no expression evaluator is on the class path
    public static InterviewsEnvironment createEnvironment() {
        return createEnvironment(new InterviewsConfig());
    }

    /// Creates an environment configured from `interviews.*` properties.
    ///
    /// @param properties configuration properties, not null
    /// @return a fully-configured environment, never null
    /// @throws IllegalStateException if no expression evaluator is on the class path
    public static InterviewsEnvironment createEnvironment(Properties properties) {
        return createEnvironment(InterviewsConfig.fromProperties(properties));
    }

    /// Creates an environment with custom configuration.
    ///
    /// @param config configuration, not null
    /// @return a fully-configured environment, never null
    /// @throws IllegalStateException if no expression evaluator is on the class path
    public static InterviewsEnvironment createEnvironment(InterviewsConfig config) {
        return builder().config(config).build();
    }

    /// Creates an environment with custom configuration and script runtime.
    ///
    /// @param config configuration, not null
    /// @param evaluator the script runtime, not null
    /// @return a fully-configured environment, never null
    public static InterviewsEnvironment createEnvironment(
            InterviewsConfig config, ExpressionEvaluator evaluator) {
        return builder().config(config).expressionEvaluator(evaluator).build();
    }

    /// Fluent builder for {@link InterviewsEnvironment} instances.
    public static class Builder {
        private InterviewsConfig config = new InterviewsConfig();
        private ExpressionEvaluator expressionEvaluator;
        private TextResolver textResolver;
        private QuestionnaireRepository questionnaireRepository;
        private LocalizationRepository localizationRepository;
        private TemplateQuestionRepository templateQuestionRepository;
        private CampaignRepository campaignRepository;
        private InterviewRepository interviewRepository;

        public Builder config(InterviewsConfig config) {
            this.config = config;
            return this;
        }

        /// Sets the script runtime. When unset, {@link ExpressionEvaluators#discover()}
        /// picks one from the class path.
        ///
        /// @param expressionEvaluator the evaluator, not null
        /// @return this builder for chaining, never null
        public Builder expressionEvaluator(ExpressionEvaluator expressionEvaluator) {
            this.expressionEvaluator = expressionEvaluator;
            return this;
        }

        public Builder textResolver(TextResolver textResolver) {
            this.textResolver = textResolver;
            return this;
        }

        public Builder questionnaireRepository(QuestionnaireRepository repository) {
            this.questionnaireRepository = repository;
            return this;
        }

        public Builder localizationRepository(LocalizationRepository repository) {
            this.localizationRepository = repository;
            return this;
        }

        public Builder templateQuestionRepository(TemplateQuestionRepository repository) {
            this.templateQuestionRepository = repository;
            return this;
        }

        public Builder campaignRepository(CampaignRepository repository) {
            this.campaignRepository = repository;
            return this;
        }

        public Builder interviewRepository(InterviewRepository repository) {
            this.interviewRepository = repository;
            return this;
        }

        /// Builds the environment, filling unset components with defaults.
        ///
        /// @return the configured environment, never null
        /// @throws IllegalStateException if no evaluator was set and none is on the class
        ///     path, or the configured storage type is unknown
        public InterviewsEnvironment build() {
            if (!"memory".equals(config.getStorageType())
                    && (questionnaireRepository == null
                            || localizationRepository == null
                            || templateQuestionRepository == null
                            || campaignRepository == null
                            || interviewRepository == null)) {
                throw new IllegalStateException(
                        "Storage type '"
                                + config.getStorageType()
                                + "' requires every repository to be provided");
            }
            if (expressionEvaluator == null) {
                expressionEvaluator = ExpressionEvaluators.discover();
            }
            if (textResolver == null) {
                textResolver = new ParametricTextResolver();
            }
            if (questionnaireRepository == null) {
                questionnaireRepository = new InMemoryQuestionnaireRepository();
            }
            if (localizationRepository == null) {
                localizationRepository = new InMemoryLocalizationRepository();
            }
            if (templateQuestionRepository == null) {
                templateQuestionRepository = new InMemoryTemplateQuestionRepository();
            }
            if (campaignRepository == null) {
                campaignRepository = new InMemoryCampaignRepository();
            }
            if (interviewRepository == null) {
                interviewRepository = new InMemoryInterviewRepository();
            }
            InterviewService service = new InterviewService(
                    questionnaireRepository,
                    localizationRepository,
                    templateQuestionRepository,
                    campaignRepository,
                    interviewRepository,
                    expressionEvaluator,
                    textResolver,
                    config);
            logger.fine(
                    "Interviews environment ready (storage="
                            + config.getStorageType()
                            + ", evaluator="
                            + expressionEvaluator.getName()
                            + ")");
            return new InterviewsEnvironment(
                    service,
                    expressionEvaluator,
                    questionnaireRepository,
                    localizationRepository,
                    templateQuestionRepository,
                    campaignRepository,
                    interviewRepository,
                    config);
        }
    }

    /// Creates a new builder for fluent environment configuration.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }
}
