package io.tabula.frame;

import io.tabula.core.ColumnNotFoundException;
import io.tabula.kernel.Value;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Descriptive statistics of a whole table: one column-name to result mapping per statistic.
 */
public record TableSummary(
        Map<String, OptionalDouble> max,
        Map<String, OptionalDouble> min,
        Map<String, OptionalDouble> sum,
        Map<String, OptionalDouble> mean,
        Map<String, OptionalDouble> median,
        Map<String, Optional<Value>> mode) {

    /**
     * @return the statistics of one column, assembled from the per-statistic mappings
     */
    public Summary column(String name) {
        if (!max.containsKey(name)) {
            throw new ColumnNotFoundException(name);
        }
        return new Summary(max.get(name), min.get(name), sum.get(name),
                mean.get(name), median.get(name), mode.get(name));
    }
}
