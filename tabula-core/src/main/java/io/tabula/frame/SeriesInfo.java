package io.tabula.frame;

import io.tabula.kernel.MemoryUsage;
import io.tabula.kernel.ValueType;

/**
 * @param type type of the first element, {@link ValueType#NONE} for an empty series
 */
public record SeriesInfo(int length, ValueType type, MemoryUsage memoryUsage) {
}
