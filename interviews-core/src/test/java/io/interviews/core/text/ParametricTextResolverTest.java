package io.interviews.core.text;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.interviews.core.exception.ErrorCode;
import io.interviews.core.exception.EvaluationException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ParametricText")
class ParametricTextResolverTest {

    private static TextBindings bindings(
            List<Object> results, Map<String, Object> variables, AtomicInteger calls) {
        return new TextBindings() {
            @Override
            public int functionCount() {
                return results.size();
            }

            @Override
            public Object call(int index) {
                calls.incrementAndGet();
                return results.get(index);
            }

            @Override
            public boolean hasLoopVariable(String name) {
                return variables.containsKey(name);
            }

            @Override
            public Object loopVariable(String name) {
                return variables.get(name);
            }
        };
    }

    @Nested
    @DisplayName("scan")
    class Scan {

        @Test
        @DisplayName("splits calls, variables and literals")
        void shouldTokenize() {
            assertThat(ParametricText.scan("Hi @{0}, how is @{who}?"))
                    .containsExactly(
                            new ParametricText.Literal("Hi "),
                            new ParametricText.Call(0),
                            new ParametricText.Literal(", how is "),
                            new ParametricText.Variable("who"),
                            new ParametricText.Literal("?"));
        }

        @Test
        @DisplayName("keeps unterminated markers verbatim")
        void shouldKeepMalformedMarkers() {
            assertThat(ParametricText.scan("cost @{12")).containsExactly(
                    new ParametricText.Literal("cost @{12"));
            assertThat(ParametricText.scan("@{name")).containsExactly(
                    new ParametricText.Literal("@{name"));
            assertThat(ParametricText.scan("@{1x}")).containsExactly(
                    new ParametricText.Literal("@{1x}"));
            assertThat(ParametricText.scan("mail@example")).containsExactly(
                    new ParametricText.Literal("mail@example"));
        }

        @Test
        @DisplayName("reads only ASCII digits as call indices")
        void shouldTreatNonAsciiDigitsAsName() {
            assertThat(ParametricText.scan("@{\u0663}"))
                    .containsExactly(new ParametricText.Variable("\u0663"));
            assertThat(ParametricText.scan("@{1\u0663}")).containsExactly(
                    new ParametricText.Literal("@{1\u0663}"));
        }

        @Test
        @DisplayName("saturates huge indices")
        void shouldSaturateIndex() {
            assertThat(ParametricText.scan("@{99999999999999}"))
                    .containsExactly(new ParametricText.Call(Integer.MAX_VALUE));
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        private final ParametricTextResolver resolver = new ParametricTextResolver();

        @Test
        @DisplayName("splices strings raw and other values as JSON")
        void shouldSpliceValues() throws Exception {
            var calls = new AtomicInteger();
            var b = bindings(List.of("Ann", List.of(1, 2)), Map.of("n", 3), calls);

            assertThat(resolver.resolve("q", "@{0} @{1} @{n}", b)).isEqualTo("Ann [1,2] 3");
        }

        @Test
        @DisplayName("calls each function once per resolution")
        void shouldMemoizeCalls() throws Exception {
            var calls = new AtomicInteger();
            var b = bindings(List.of("x"), Map.of(), calls);

            assertThat(resolver.resolve("q", "@{0}@{0}@{0}", b)).isEqualTo("xxx");
            assertThat(calls.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("rejects an unknown loop variable")
        void shouldRejectUnknownVariable() {
            var b = bindings(List.of(), Map.of(), new AtomicInteger());

            assertThatThrownBy(() -> resolver.resolve("q", "@{who}", b))
                    .isInstanceOf(EvaluationException.class)
                    .hasFieldOrPropertyWithValue(
                            "errorCode", ErrorCode.QUESTION_LOOP_VARIABLE_UNKNOWN);
        }

        @Test
        @DisplayName("rejects a call beyond the declared functions")
        void shouldRejectOutOfBoundsCall() {
            var b = bindings(List.of(), Map.of(), new AtomicInteger());

            assertThatThrownBy(() -> resolver.resolve("q", "@{3}", b))
                    .isInstanceOf(EvaluationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", ErrorCode.FUNCTION_CALL_OUT_OF_BOUNDS);
        }
    }
}
