package io.tabula.kernel;

import java.util.Locale;

/**
 * Estimated in-memory footprint, rendered as kilobytes with two decimals.
 */
public record MemoryUsage(long bytes) {

    public static final MemoryUsage ZERO = new MemoryUsage(0);

    public MemoryUsage {
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must not be negative");
        }
    }

    public double kilobytes() {
        return bytes / 1024.0;
    }

    public MemoryUsage plus(MemoryUsage other) {
        return new MemoryUsage(bytes + other.bytes);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.2f KB", kilobytes());
    }
}
