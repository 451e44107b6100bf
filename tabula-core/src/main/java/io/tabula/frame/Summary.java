package io.tabula.frame;

import io.tabula.kernel.Value;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * The six descriptive statistics of one series. Numeric entries are empty when the series
 * holds anything but numbers.
 */
public record Summary(
        OptionalDouble max,
        OptionalDouble min,
        OptionalDouble sum,
        OptionalDouble mean,
        OptionalDouble median,
        Optional<Value> mode) {
}
