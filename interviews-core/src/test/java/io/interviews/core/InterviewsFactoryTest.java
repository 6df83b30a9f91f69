package io.interviews.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.interviews.core.expression.stub.StubExpressionEvaluator;
import io.interviews.core.questionnaire.InMemoryQuestionnaireRepository;
import java.util.Properties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InterviewsFactory")
class InterviewsFactoryTest {

    @Test
    @DisplayName("builds an environment around an explicit evaluator")
    void shouldBuildWithExplicitEvaluator() {
        var evaluator = QuestionnaireFixtures.evaluator();

        try (var env = InterviewsFactory.builder().expressionEvaluator(evaluator).build()) {
            assertThat(env.getExpressionEvaluator()).isSameAs(evaluator);
            assertThat(env.getInterviewService()).isNotNull();
            assertThat(env.getQuestionnaireRepository())
                    .isInstanceOf(InMemoryQuestionnaireRepository.class);
            assertThat(env.getConfig().getStorageType()).isEqualTo("memory");
        }
    }

    @Test
    @DisplayName("discovers an evaluator on the class path")
    void shouldDiscoverEvaluator() {
        var properties = new Properties();
        properties.setProperty("interviews.default-language", "it");

        try (var env = InterviewsFactory.createEnvironment(properties)) {
            assertThat(env.getExpressionEvaluator()).isInstanceOf(StubExpressionEvaluator.class);
            assertThat(env.getConfig().getDefaultLanguage()).isEqualTo("it");
        }
    }

    @Test
    @DisplayName("requires every repository for a non-memory storage type")
    void shouldRejectIncompleteStorage() {
        var config = InterviewsConfig.builder().storageType("jdbc").build();

        assertThatThrownBy(() -> InterviewsFactory.builder()
                        .config(config)
                        .expressionEvaluator(QuestionnaireFixtures.evaluator())
                        .questionnaireRepository(new InMemoryQuestionnaireRepository())
                        .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jdbc");
    }
}
