package io.interviews.core.interview;

import java.util.ArrayList;
import java.util.List;

/// Kind-specific content of an answer.
///
/// ### Permitted Subtypes
/// - {@link MessageAnswer} - acknowledgement of a message
/// - {@link InputAnswer} - free text
/// - {@link SelectAnswer} - exactly one choice
/// - {@link MultipleChoiceAnswer} - ordered choices, used for select and rank kinds
///
/// Every body carries a general comment, empty when the question takes none.
public sealed interface AnswerBody {

    String comment();

    /// Acknowledgement of a message. Carries no data.
    record MessageAnswer() implements AnswerBody {
        @Override
        public String comment() {
            return "";
        }
    }

    /// Free text answer.
    ///
    /// @param input the text, not null (may be empty for optional inputs)
    /// @param comment general comment, not null
    record InputAnswer(String input, String comment) implements AnswerBody {
        public InputAnswer {
            input = input == null ? "" : input;
            comment = comment == null ? "" : comment;
        }

        public InputAnswer(String input) {
            this(input, "");
        }
    }

    /// Single choice answer.
    ///
    /// @param choice the choice, not null
    /// @param comment general comment, not null
    record SelectAnswer(Choice choice, String comment) implements AnswerBody {
        public SelectAnswer {
            comment = comment == null ? "" : comment;
        }

        public SelectAnswer(int index) {
            this(new Choice(index), "");
        }
    }

    /// Multiple choice answer. For rank kinds the order is the ranking.
    ///
    /// @param choices the choices in order, not null
    /// @param comment general comment, not null
    record MultipleChoiceAnswer(List<Choice> choices, String comment) implements AnswerBody {
        public MultipleChoiceAnswer {
            choices = choices == null ? List.of() : List.copyOf(choices);
            comment = comment == null ? "" : comment;
        }

        public static MultipleChoiceAnswer of(int... indices) {
            List<Choice> choices = new ArrayList<>(indices.length);
            for (int index : indices) {
                choices.add(new Choice(index));
            }
            return new MultipleChoiceAnswer(choices, "");
        }
    }
}
