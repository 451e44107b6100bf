package io.tabula.kernel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Descriptive statistics over a list of values.
 * <p>
 * Numeric aggregations only apply when every value is numeric. Otherwise they report an
 * empty result instead of failing, so a whole-table summary can mix text and number columns.
 * An empty list sums to zero and has no extremum, mean or median.
 */
public final class Statistics {

    private Statistics() {
    }

    public static boolean allNumeric(List<Value> values) {
        for (Value value : values) {
            if (!value.isNumeric()) {
                return false;
            }
        }
        return true;
    }

    public static OptionalDouble sum(List<Value> values) {
        if (!allNumeric(values)) {
            return OptionalDouble.empty();
        }
        double sum = 0;
        for (Value value : values) {
            sum += value.asDouble();
        }
        return OptionalDouble.of(sum);
    }

    public static OptionalDouble max(List<Value> values) {
        if (values.isEmpty() || !allNumeric(values)) {
            return OptionalDouble.empty();
        }
        double max = Double.NEGATIVE_INFINITY;
        for (Value value : values) {
            double current = value.asDouble();
            if (current > max) {
                max = current;
            }
        }
        return OptionalDouble.of(max);
    }

    public static OptionalDouble min(List<Value> values) {
        if (values.isEmpty() || !allNumeric(values)) {
            return OptionalDouble.empty();
        }
        double min = Double.POSITIVE_INFINITY;
        for (Value value : values) {
            double current = value.asDouble();
            if (current < min) {
                min = current;
            }
        }
        return OptionalDouble.of(min);
    }

    public static OptionalDouble mean(List<Value> values) {
        if (values.isEmpty()) {
            return OptionalDouble.empty();
        }
        OptionalDouble sum = sum(values);
        if (sum.isEmpty()) {
            return sum;
        }
        return OptionalDouble.of(sum.getAsDouble() / values.size());
    }

    public static OptionalDouble median(List<Value> values) {
        if (values.isEmpty() || !allNumeric(values)) {
            return OptionalDouble.empty();
        }
        double[] sorted = new double[values.size()];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = values.get(i).asDouble();
        }
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 0) {
            return OptionalDouble.of((sorted[mid - 1] + sorted[mid]) / 2);
        }
        return OptionalDouble.of(sorted[mid]);
    }

    /**
     * Most frequent value. Among values sharing the highest count, the one seen first wins,
     * so a list where every value occurs once reports its first element.
     */
    public static Optional<Value> mode(List<Value> values) {
        if (values.isEmpty()) {
            return Optional.empty();
        }
        Value mode = null;
        int maxCount = 0;
        for (Map.Entry<Value, Integer> entry : counts(values).entrySet()) {
            if (entry.getValue() > maxCount) {
                maxCount = entry.getValue();
                mode = entry.getKey();
            }
        }
        return Optional.of(mode);
    }

    public static List<Value> unique(List<Value> values) {
        return new ArrayList<>(new LinkedHashSet<>(values));
    }

    /**
     * Occurrence count per distinct value.
     *
     * @param descending when true, order by count descending keeping first-seen order on ties;
     *                   otherwise keep first-seen order
     */
    public static LinkedHashMap<Value, Integer> valueCounts(List<Value> values, boolean descending) {
        LinkedHashMap<Value, Integer> counts = counts(values);
        if (!descending) {
            return counts;
        }
        List<Map.Entry<Value, Integer>> entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable
        entries.sort((left, right) -> Integer.compare(right.getValue(), left.getValue()));
        LinkedHashMap<Value, Integer> sorted = new LinkedHashMap<>();
        for (Map.Entry<Value, Integer> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }

    private static LinkedHashMap<Value, Integer> counts(List<Value> values) {
        LinkedHashMap<Value, Integer> counts = new LinkedHashMap<>();
        for (Value value : values) {
            counts.merge(value, 1, Integer::sum);
        }
        return counts;
    }
}
