package io.tabula.kernel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class StatisticsTest {

    private static List<Value> values(Object... raw) {
        List<Value> result = new ArrayList<>(raw.length);
        for (Object value : raw) {
            result.add(Value.of(value));
        }
        return result;
    }

    @Test
    @DisplayName("Should aggregate numeric values")
    void shouldAggregateNumericValues() {
        List<Value> values = values(10, 20, 30, 40, 50);

        assertThat(Statistics.sum(values)).hasValue(150.0);
        assertThat(Statistics.mean(values)).hasValue(30.0);
        assertThat(Statistics.median(values)).hasValue(30.0);
        assertThat(Statistics.min(values)).hasValue(10.0);
        assertThat(Statistics.max(values)).hasValue(50.0);
    }

    @Test
    @DisplayName("Should sum empty list to zero and leave other aggregations empty")
    void shouldHandleEmptyList() {
        List<Value> empty = List.of();

        assertThat(Statistics.sum(empty)).hasValue(0.0);
        assertThat(Statistics.max(empty)).isEmpty();
        assertThat(Statistics.min(empty)).isEmpty();
        assertThat(Statistics.mean(empty)).isEmpty();
        assertThat(Statistics.median(empty)).isEmpty();
        assertThat(Statistics.mode(empty)).isEmpty();
    }

    static Stream<Arguments> nonNumeric() {
        return Stream.of(
                Arguments.of("text only", values("a", "b")),
                Arguments.of("mixed", values(1, "b", 3)),
                Arguments.of("with null", values(1, null, 3)),
                Arguments.of("with other", values(1, Boolean.TRUE)));
    }

    @ParameterizedTest(name = "numeric aggregations are empty for {0}")
    @MethodSource("nonNumeric")
    void shouldReportEmptyForNonNumeric(String label, List<Value> values) {
        assertThat(Statistics.allNumeric(values)).isFalse();
        assertThat(Statistics.sum(values)).isEmpty();
        assertThat(Statistics.max(values)).isEmpty();
        assertThat(Statistics.min(values)).isEmpty();
        assertThat(Statistics.mean(values)).isEmpty();
        assertThat(Statistics.median(values)).isEmpty();
    }

    @Test
    @DisplayName("Should take middle element for odd length and average for even length")
    void shouldComputeMedian() {
        assertThat(Statistics.median(values(1, 2, 3))).hasValue(2.0);
        assertThat(Statistics.median(values(1, 2, 3, 4))).hasValue(2.5);
        assertThat(Statistics.median(values(9, 1, 5))).hasValue(5.0);
        assertThat(Statistics.median(values(4, -1, 10, 2))).hasValue(3.0);
        assertThat(Statistics.median(values(7))).hasValue(7.0);
    }

    @Test
    @DisplayName("Should find extremes including negatives")
    void shouldFindExtremes() {
        List<Value> values = values(-5, 3.5, -12, 0);

        assertThat(Statistics.max(values)).hasValue(3.5);
        assertThat(Statistics.min(values)).hasValue(-12.0);
    }

    @Test
    @DisplayName("Should pick the most frequent value")
    void shouldPickMostFrequentValue() {
        assertThat(Statistics.mode(values(1, 2, 2, 3, 3, 3, 4))).contains(Value.of(3));
        assertThat(Statistics.mode(values("apple", "banana", "apple", "cherry"))).contains(Value.of("apple"));
    }

    @Test
    @DisplayName("Should break mode ties by first-seen value")
    void shouldBreakModeTiesByFirstSeenValue() {
        assertThat(Statistics.mode(values(1, 1, 2, 3))).contains(Value.of(1));
        assertThat(Statistics.mode(values(1, 2, 3, 4, 5))).contains(Value.of(1));
        assertThat(Statistics.mode(values(5, 4, 4, 5))).contains(Value.of(5));
        assertThat(Statistics.mode(values(null, "x", null, "x"))).contains(Value.NULL);
    }

    @Test
    @DisplayName("Should keep first occurrence order in unique values")
    void shouldKeepFirstOccurrenceOrderInUnique() {
        assertThat(Statistics.unique(values(3, 1, 3, "a", 1, null, "a", null)))
                .containsExactly(Value.of(3), Value.of(1), Value.of("a"), Value.NULL);
    }

    @Test
    @DisplayName("Should order value counts by count descending with stable ties")
    void shouldOrderValueCountsDescending() {
        Map<Value, Integer> counts = Statistics.valueCounts(values("a", "b", "a", "c", "a", "d"), true);

        assertThat(counts.keySet()).containsExactly(Value.of("a"), Value.of("b"), Value.of("c"), Value.of("d"));
        assertThat(counts.values()).containsExactly(3, 1, 1, 1);
    }

    @Test
    @DisplayName("Should keep first-seen order when not sorting value counts")
    void shouldKeepFirstSeenOrderWhenNotSorting() {
        Map<Value, Integer> counts = Statistics.valueCounts(values("x", "y", "y", "z", "y", "z"), false);

        assertThat(counts.keySet()).containsExactly(Value.of("x"), Value.of("y"), Value.of("z"));
        assertThat(counts.values()).containsExactly(1, 3, 2);
    }

    @Test
    @DisplayName("Should move later, more frequent values ahead when sorting")
    void shouldSortLaterFrequentValuesFirst() {
        Map<Value, Integer> counts = Statistics.valueCounts(values("x", "y", "y", "z", "y", "z"), true);

        assertThat(counts.keySet()).containsExactly(Value.of("y"), Value.of("z"), Value.of("x"));
    }

    @Test
    @DisplayName("Should count zero and negative zero as one value")
    void shouldCountSignedZerosTogether() {
        List<Value> values = values(0, -0.0d, 0, 1);

        assertThat(Statistics.unique(values)).containsExactly(Value.of(0), Value.of(1));
        assertThat(Statistics.valueCounts(values, true)).containsEntry(Value.of(0), 3).hasSize(2);
        assertThat(Statistics.mode(values(-0.0d, 1, 0))).contains(Value.of(0));
    }
}
