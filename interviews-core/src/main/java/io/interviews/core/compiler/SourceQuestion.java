package io.interviews.core.compiler;

import io.interviews.core.questionnaire.question.QuestionKind;
import java.util.List;

/// Source form of a question as uploaded by operators.
///
/// ### Permitted Subtypes
/// - {@link Message}, {@link Input}, {@link WithOptions} - inline questions carrying
///   their text in the source language
/// - {@link FromTemplate} - borrows body and texts from the template library
/// - {@link BeginLoop}, {@link EndLoop} - loop markers
///
/// An empty transition list means "final" for final-capable kinds and "go to the next
/// question" otherwise.
public sealed interface SourceQuestion {

    String label();

    QuestionKind kind();

    List<SourceTransition> transitions();

    /// Message acknowledged by the respondent.
    record Message(String label, SourceText text, String style, List<SourceTransition> transitions)
            implements SourceQuestion {

        public Message {
            style = style == null ? "" : style;
            transitions = transitions == null ? List.of() : List.copyOf(transitions);
        }

        @Override
        public QuestionKind kind() {
            return QuestionKind.MESSAGE;
        }
    }

    /// Free text input. A non-empty comment label enables the comment field.
    record Input(
            String label,
            SourceText text,
            String style,
            String commentLabel,
            boolean optional,
            List<SourceTransition> transitions)
            implements SourceQuestion {

        public Input {
            style = style == null ? "" : style;
            commentLabel = commentLabel == null ? "" : commentLabel;
            transitions = transitions == null ? List.of() : List.copyOf(transitions);
        }

        @Override
        public QuestionKind kind() {
            return QuestionKind.INPUT;
        }
    }

    /// Select or one of the multiple-choice kinds. A limit of 0 means the option count.
    record WithOptions(
            String label,
            QuestionKind kind,
            SourceText text,
            String style,
            String commentLabel,
            boolean randomize,
            int limit,
            List<SourceOption> options,
            List<SourceTransition> transitions)
            implements SourceQuestion {

        public WithOptions {
            if (kind == null || !kind.hasOptions()) {
                throw new IllegalArgumentException("Not an option kind: " + kind);
            }
            style = style == null ? "" : style;
            commentLabel = commentLabel == null ? "" : commentLabel;
            options = options == null ? List.of() : List.copyOf(options);
            transitions = transitions == null ? List.of() : List.copyOf(transitions);
        }
    }

    /// Question borrowed from the template library.
    record FromTemplate(String label, String templateName, List<SourceTransition> transitions)
            implements SourceQuestion {

        public FromTemplate {
            templateName = templateName == null ? "" : templateName;
            transitions = transitions == null ? List.of() : List.copyOf(transitions);
        }

        @Override
        public QuestionKind kind() {
            return QuestionKind.FROM_TEMPLATE;
        }
    }

    /// Opens a loop over the array the operand code assigns to `R`.
    record BeginLoop(
            String label,
            String operandLabel,
            String operandCode,
            String variable,
            List<SourceTransition> transitions)
            implements SourceQuestion {

        public BeginLoop {
            operandLabel = operandLabel == null ? "" : operandLabel;
            operandCode = operandCode == null ? "" : operandCode;
            variable = variable == null ? "" : variable;
            transitions = transitions == null ? List.of() : List.copyOf(transitions);
        }

        @Override
        public QuestionKind kind() {
            return QuestionKind.BEGIN_LOOP;
        }
    }

    /// Closes the innermost open loop.
    record EndLoop(String label, List<SourceTransition> transitions) implements SourceQuestion {

        public EndLoop {
            transitions = transitions == null ? List.of() : List.copyOf(transitions);
        }

        @Override
        public QuestionKind kind() {
            return QuestionKind.END_LOOP;
        }
    }
}
