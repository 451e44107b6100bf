package io.tabula.frame;

import io.tabula.core.TabulaConfiguration;
import io.tabula.kernel.MemoryEstimator;
import io.tabula.kernel.ReadOnlyViews;
import io.tabula.kernel.Statistics;
import io.tabula.kernel.Value;
import io.tabula.kernel.ValueType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Ordered, immutable, optionally named sequence of values.
 * <p>
 * Values may be of mixed types; nothing is validated on construction. Numeric statistics
 * report an empty result when any value is not a number. Every transformation returns a
 * new series.
 * <pre>
 * Series prices = new Series("price", List.of(10, 20, 30));
 * prices.mean();          // OptionalDouble[20.0]
 * prices.head(2).values(); // [10, 20]
 * </pre>
 */
public final class Series {

    private final String name;
    private final List<Value> values;

    public Series(List<?> values) {
        this(null, values);
    }

    public Series(String name, List<?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        List<Value> copy = new ArrayList<>(values.size());
        for (Object raw : values) {
            copy.add(Value.of(raw));
        }
        this.name = name;
        this.values = ReadOnlyViews.list(copy, "Series value");
    }

    private Series(List<Value> owned, String name) {
        this.name = name;
        this.values = ReadOnlyViews.list(owned, "Series value");
    }

    public static Series of(Object... values) {
        if (values == null) {
            throw new IllegalArgumentException("values required");
        }
        return new Series(Arrays.asList(values));
    }

    static Series wrap(String name, List<Value> owned) {
        return new Series(owned, name);
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public int length() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return read-only view of the values; mutators throw
     * {@link io.tabula.core.MutationNotAllowedException}
     */
    public List<Value> values() {
        return values;
    }

    public Value get(int index) {
        if (index < 0 || index >= values.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range [0, " + values.size() + ")");
        }
        return values.get(index);
    }

    /**
     * @return a fresh list of the plain Java values ({@code Double}, {@code String}, {@code null}, ...)
     */
    public List<Object> toList() {
        List<Object> result = new ArrayList<>(values.size());
        for (Value value : values) {
            result.add(value.unwrap());
        }
        return result;
    }

    public Series head() {
        return head(TabulaConfiguration.defaults());
    }

    public Series head(TabulaConfiguration configuration) {
        return head(configuration.previewRows());
    }

    /**
     * First {@code n} values. All values when {@code n} exceeds the length, none when
     * {@code n <= 0}.
     */
    public Series head(int n) {
        int end = Math.max(0, Math.min(n, values.size()));
        return slice(0, end);
    }

    public Series tail() {
        return tail(TabulaConfiguration.defaults());
    }

    public Series tail(TabulaConfiguration configuration) {
        return tail(configuration.previewRows());
    }

    /**
     * Last {@code n} values. All values when {@code n} exceeds the length, none when
     * {@code n <= 0}.
     */
    public Series tail(int n) {
        int count = Math.max(0, Math.min(n, values.size()));
        return slice(values.size() - count, values.size());
    }

    Series slice(int from, int to) {
        return new Series(new ArrayList<>(values.subList(from, to)), name);
    }

    public OptionalDouble sum() {
        return Statistics.sum(values);
    }

    public OptionalDouble max() {
        return Statistics.max(values);
    }

    public OptionalDouble min() {
        return Statistics.min(values);
    }

    public OptionalDouble mean() {
        return Statistics.mean(values);
    }

    public OptionalDouble median() {
        return Statistics.median(values);
    }

    public Optional<Value> mode() {
        return Statistics.mode(values);
    }

    public Summary describe() {
        return new Summary(max(), min(), sum(), mean(), median(), mode());
    }

    public Series unique() {
        return new Series(Statistics.unique(values), name);
    }

    public Map<Value, Integer> valueCounts() {
        return valueCounts(true);
    }

    /**
     * @param descending order by count descending, ties in first-seen order; when false keep
     *                   first-seen order
     * @return read-only ordered mapping from distinct value to occurrence count
     */
    public Map<Value, Integer> valueCounts(boolean descending) {
        return ReadOnlyViews.map(Statistics.valueCounts(values, descending), "value count");
    }

    public SeriesInfo info() {
        return info(TabulaConfiguration.defaults());
    }

    public SeriesInfo info(TabulaConfiguration configuration) {
        ValueType type = values.isEmpty() ? ValueType.NONE : values.get(0).type();
        return new SeriesInfo(values.size(), type, new MemoryEstimator(configuration).estimate(values));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Series other = (Series) obj;
        return Objects.equals(name, other.name) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, values);
    }

    @Override
    public String toString() {
        return "Series{" + (name == null ? "" : "name=" + name + ", ") + "values=" + values + "}";
    }
}
