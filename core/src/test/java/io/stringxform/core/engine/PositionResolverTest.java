package io.stringxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.stringxform.core.model.Boundary;
import io.stringxform.core.model.Category;
import io.stringxform.core.model.DslRegex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link PositionResolver}. */
@DisplayName("PositionResolver")
class PositionResolverTest {

    private static final DslRegex WORD = DslRegex.of(Category.WORD);
    private static final DslRegex NUMBER = DslRegex.of(Category.NUMBER);

    @Nested
    @DisplayName("substrIndex")
    class SubstrIndex {

        @ParameterizedTest(name = "position {0} in \"hello\" -> {1}")
        @CsvSource({"1, 0", "5, 4", "10, 9", "0, 0", "-1, -1", "-5, -5", "-6, 0", "-100, 0"})
        void resolves(int position, int expected) {
            assertThat(PositionResolver.substrIndex(position, "hello")).isEqualTo(expected);
        }

        @Test
        @DisplayName("any negative position clamps to 0 on an empty string")
        void emptyString() {
            assertThat(PositionResolver.substrIndex(-1, "")).isZero();
        }
    }

    @Nested
    @DisplayName("spanIndex")
    class SpanIndex {

        // one two three: [0,3) [4,7) [8,13)
        private static final String TEXT = "one two three";

        @ParameterizedTest(name = "index {0} {1} -> {2}")
        @CsvSource({
            "1, START, 0",
            "1, END, 3",
            "2, START, 4",
            "-1, START, 8",
            "-1, END, 13",
            "-3, START, 0",
        })
        void selectsMatch(int index, Boundary boundary, int expected) {
            assertThat(PositionResolver.spanIndex(WORD, index, boundary, TEXT)).isEqualTo(expected);
        }

        @Test
        @DisplayName("index past the last match clamps to the last match")
        void clampsHigh() {
            assertThat(PositionResolver.spanIndex(WORD, 5, Boundary.START, TEXT)).isEqualTo(8);
            assertThat(PositionResolver.spanIndex(WORD, 4, Boundary.END, TEXT)).isEqualTo(13);
        }

        @Test
        @DisplayName("index before the first match clamps to the first match")
        void clampsLow() {
            assertThat(PositionResolver.spanIndex(WORD, -5, Boundary.START, TEXT)).isZero();
            assertThat(PositionResolver.spanIndex(WORD, -4, Boundary.END, TEXT)).isEqualTo(3);
        }

        @Test
        @DisplayName("no match resolves to -1 for positive and 0 for negative indices")
        void noMatch() {
            assertThat(PositionResolver.spanIndex(NUMBER, 1, Boundary.START, "abc")).isEqualTo(-1);
            assertThat(PositionResolver.spanIndex(NUMBER, -1, Boundary.END, "abc")).isZero();
        }

        @Test
        @DisplayName("delimiter regex resolves against literal occurrences")
        void delimiter() {
            assertThat(PositionResolver.spanIndex(DslRegex.delimiter("-"), 2, Boundary.END, "2024-01-15"))
                    .isEqualTo(8);
        }
    }

    @Nested
    @DisplayName("slice")
    class Slice {

        @ParameterizedTest(name = "hello[{0}:{1}] = \"{2}\"")
        @CsvSource({"1, 3, el", "-3, -1, ll", "3, 1, ''", "0, 99, hello", "-99, 2, he", "2, 2, ''"})
        void slices(int start, int end, String expected) {
            assertThat(PositionResolver.slice("hello", start, end)).isEqualTo(expected);
        }

        @Test
        @DisplayName("suffix accepts negative offsets")
        void suffix() {
            assertThat(PositionResolver.suffix("hello", -2)).isEqualTo("lo");
            assertThat(PositionResolver.suffix("hello", 0)).isEqualTo("hello");
            assertThat(PositionResolver.suffix("hello", -9)).isEqualTo("hello");
        }
    }
}
