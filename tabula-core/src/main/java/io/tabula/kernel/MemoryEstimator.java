package io.tabula.kernel;

import io.tabula.core.TabulaConfiguration;

/**
 * Per-value cost model: numbers and other objects have a fixed size, text costs a fixed
 * amount per character, absent values cost nothing.
 */
public final class MemoryEstimator {

    private final TabulaConfiguration configuration;

    public MemoryEstimator(TabulaConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.configuration = configuration;
    }

    public long bytes(Value value) {
        return switch (value.type()) {
            case NUMBER -> configuration.numberBytes();
            case TEXT -> (long) ((Value.Text) value).value().length() * configuration.charBytes();
            case NULL, NONE -> 0L;
            case OTHER -> configuration.otherBytes();
        };
    }

    public MemoryUsage estimate(Iterable<Value> values) {
        long total = 0;
        for (Value value : values) {
            total += bytes(value);
        }
        return new MemoryUsage(total);
    }
}
