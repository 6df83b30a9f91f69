package io.interviews.core.execution.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.interviews.core.execution.history.HistoryEntry.AnswerEntry;
import io.interviews.core.execution.history.HistoryEntry.BeginLoopMark;
import io.interviews.core.execution.history.HistoryEntry.EndLoopMark;
import io.interviews.core.interview.Answer;
import io.interviews.core.interview.AnswerBody;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("History")
class HistoryTest {

    private static Answer answer(String label, String input) {
        return new Answer(
                label,
                new AnswerBody.InputAnswer(input),
                Instant.EPOCH,
                null,
                null,
                null,
                null);
    }

    private History history;

    // [a, b, BL(loop, ref 1, 0), c, EL, d, BL(loop2, ref 5, 0)]
    @BeforeEach
    void setUp() {
        history = new History();
        history.append(new AnswerEntry(answer("a", "1")));
        history.append(new AnswerEntry(answer("b", "2")));
        history.append(new BeginLoopMark("loop", 1, 0));
        history.append(new AnswerEntry(answer("c", "3")));
        history.append(new EndLoopMark("loop_end"));
        history.append(new AnswerEntry(answer("d", "4")));
        history.append(new BeginLoopMark("loop2", 5, 0));
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("shifts operand references after the removed range")
        void shouldShiftReferences() {
            history.delete(0, 1);

            assertThat(history.get(1)).isEqualTo(new BeginLoopMark("loop", 0, 0));
            assertThat(history.get(5)).isEqualTo(new BeginLoopMark("loop2", 4, 0));
        }

        @Test
        @DisplayName("leaves references into the removed range dangling")
        void shouldLeaveDanglingReferences() {
            history.delete(1, 2);

            assertThat(history.get(1))
                    .isEqualTo(new BeginLoopMark("loop", BeginLoopMark.DANGLING, 0));
        }

        @Test
        @DisplayName("keeps references before the removed range")
        void shouldKeepEarlierReferences() {
            history.delete(3, 5);

            assertThat(history.get(2)).isEqualTo(new BeginLoopMark("loop", 1, 0));
            assertThat(history.get(4)).isEqualTo(new BeginLoopMark("loop2", 3, 0));
        }

        @Test
        @DisplayName("rejects an invalid range")
        void shouldRejectInvalidRange() {
            assertThatThrownBy(() -> history.delete(3, 2))
                    .isInstanceOf(IndexOutOfBoundsException.class);
        }

        @Test
        @DisplayName("truncate removes the tail")
        void shouldTruncate() {
            history.truncate(3);

            assertThat(history.size()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("answers")
    class Answers {

        @Test
        @DisplayName("finds answers only at answer entries")
        void shouldFindAnswers() {
            assertThat(history.findAnswer(1)).map(Answer::label).contains("b");
            assertThat(history.findAnswer(2)).isEmpty();
            assertThat(history.findAnswer(-1)).isEmpty();
            assertThat(history.findAnswer(42)).isEmpty();
        }

        @Test
        @DisplayName("grafts an answer to the same question in place")
        void shouldGraft() {
            history.graft(3, answer("c", "new"));

            assertThat(history.findAnswer(3).orElseThrow().body())
                    .isEqualTo(new AnswerBody.InputAnswer("new"));
            assertThat(history.size()).isEqualTo(7);
        }

        @Test
        @DisplayName("refuses to graft onto another question")
        void shouldRejectGraftOnOtherQuestion() {
            assertThatThrownBy(() -> history.graft(3, answer("a", "x")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> history.graft(2, answer("loop", "x")))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("copies are independent")
    void shouldCopyIndependently() {
        History copy = history.copy();
        copy.truncate(0);

        assertThat(history.size()).isEqualTo(7);
        history.replaceWith(copy);
        assertThat(history.isEmpty()).isTrue();
    }
}
