package io.interviews.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.interviews.core.QuestionnaireFixtures;
import io.interviews.core.compiler.Compilation;
import io.interviews.core.compiler.QuestionnaireCompiler;
import io.interviews.core.compiler.SourceQuestionnaire;
import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.EvaluationException;
import io.interviews.core.expression.EvaluationScope;
import io.interviews.core.expression.ExpressionEvaluator;
import io.interviews.core.interview.Answer;
import io.interviews.core.interview.AnswerBody;
import io.interviews.core.questionnaire.question.AnswerableQuestion;
import io.interviews.core.questionnaire.question.BeginLoopQuestion;
import io.interviews.core.questionnaire.template.InMemoryTemplateQuestionRepository;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QuestionEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    @Mock private ExpressionEvaluator expressionEvaluator;

    @Mock private EvaluationScope scope;

    @BeforeEach
    void setUp() {
        when(expressionEvaluator.openScope()).thenReturn(scope);
    }

    private QuestionEvaluator evaluator(SourceQuestionnaire source, int maxLoopIterations)
            throws Exception {
        var templates = new InMemoryTemplateQuestionRepository();
        Compilation compilation = new QuestionnaireCompiler(templates).compile(source, "qq");
        return new QuestionEvaluator(
                ExecutionContext.builder()
                        .questionnaire(compilation.questionnaire())
                        .localization(compilation.localization())
                        .templates(templates)
                        .evaluator(expressionEvaluator)
                        .maxLoopIterations(maxLoopIterations)
                        .build());
    }

    @Test
    void shouldDeclareSkippedParameterAsNull() throws Exception {
        // Given
        QuestionEvaluator evaluator = evaluator(QuestionnaireFixtures.branching(false), 10);
        var q1 = evaluator.getContext().getQuestionnaire().getQuestion("q1");
        when(scope.execute(QuestionnaireFixtures.YES)).thenReturn(false);

        // When
        var destination = evaluator.runTransitions(new LoopStack(), q1);

        // Then
        assertThat(destination.getLabel()).isEqualTo("q2");
        verify(scope).declare("q1", null);
        verify(scope).close();
    }

    @Test
    void shouldAttachQuestionLabelToScriptFailure() throws Exception {
        // Given
        QuestionEvaluator evaluator = evaluator(QuestionnaireFixtures.branching(false), 10);
        var q1 = evaluator.getContext().getQuestionnaire().getQuestion("q1");
        when(scope.execute(anyString()))
                .thenThrow(new EvaluationException(ErrorCode.SCRIPT_FAILED));

        // When
        EvaluationException e = catchThrowableOfType(
                () -> evaluator.runTransitions(new LoopStack(), q1), EvaluationException.class);

        // Then
        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.SCRIPT_FAILED);
        assertThat(e.getLabels()).containsExactly("q1");
        verify(scope).close();
    }

    @Test
    void shouldDeclareLanguagesForTextFunctions() throws Exception {
        // Given
        QuestionEvaluator evaluator = evaluator(QuestionnaireFixtures.branching(true), 10);
        var q3 = (AnswerableQuestion) evaluator.getContext().getQuestionnaire().getQuestion("q3");
        LoopStack stack = new LoopStack();
        stack.record(new ScopedAnswer(
                0,
                new Answer("q1", new AnswerBody.SelectAnswer(0), NOW, null, null, "", null)));
        when(scope.execute(QuestionnaireFixtures.QUOTE)).thenReturn("yes");

        // When
        String text = evaluator.renderText(stack, q3);

        // Then
        assertThat(text).isEqualTo("You said yes, anything to add?");
        verify(scope).declare("language", "eng");
        verify(scope).declare("language_str2", "en");
    }

    @Test
    void shouldIgnoreNonArrayOperand() throws Exception {
        // Given
        QuestionEvaluator evaluator = evaluator(QuestionnaireFixtures.loop(), 10);
        var loop = (BeginLoopQuestion)
                evaluator.getContext().getQuestionnaire().getQuestion("people");
        when(scope.executeForResult(QuestionnaireFixtures.SPLIT)).thenReturn("a,b");

        // When
        List<Object> operand = evaluator.computeLoopOperand(new LoopStack(), loop, null);

        // Then
        assertThat(operand).isEmpty();
        verify(scope).declare("names", null);
        verify(scope, never()).execute(anyString());
    }

    @Test
    void shouldRejectOperandAboveIterationGuard() throws Exception {
        // Given
        QuestionEvaluator evaluator = evaluator(QuestionnaireFixtures.loop(), 2);
        var loop = (BeginLoopQuestion)
                evaluator.getContext().getQuestionnaire().getQuestion("people");
        when(scope.executeForResult(QuestionnaireFixtures.SPLIT))
                .thenReturn(List.of("a", "b", "c"));

        // When / Then
        assertThatThrownBy(() -> evaluator.computeLoopOperand(new LoopStack(), loop, null))
                .isInstanceOf(EvaluationException.class)
                .extracting(e -> ((EvaluationException) e).getErrorCode())
                .isEqualTo(ErrorCode.QUESTION_LOOP_LOGIC_ERROR);
    }
}
