package io.tabula.core;

/**
 * Immutable configuration shared by series, tables and their formatters.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * TabulaConfiguration config = TabulaConfiguration.builder()
 *     .previewRows(10)
 *     .charBytes(1)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 */
public final class TabulaConfiguration {

    private static final TabulaConfiguration DEFAULTS = builder().build();

    // Row previews
    private final int previewRows;
    private final int displayRows;

    // Memory cost model, in bytes
    private final int numberBytes;
    private final int charBytes;
    private final int otherBytes;

    private TabulaConfiguration(Builder builder) {
        this.previewRows = builder.previewRows;
        this.displayRows = builder.displayRows;
        this.numberBytes = builder.numberBytes;
        this.charBytes = builder.charBytes;
        this.otherBytes = builder.otherBytes;
    }

    /**
     * Create a new builder for TabulaConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The shared configuration used when no explicit configuration is given.
     */
    public static TabulaConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Number of rows returned by the no-argument {@code head()} and {@code tail()}.
     *
     * @return preview row count (default: 5)
     */
    public int previewRows() {
        return previewRows;
    }

    /**
     * Maximum number of rows rendered by the text formatter.
     *
     * @return display row limit, 0 meaning all rows (default: 0)
     */
    public int displayRows() {
        return displayRows;
    }

    /**
     * @return estimated bytes per numeric value (default: 8)
     */
    public int numberBytes() {
        return numberBytes;
    }

    /**
     * @return estimated bytes per character of a text value (default: 2)
     */
    public int charBytes() {
        return charBytes;
    }

    /**
     * @return estimated bytes per value that is neither number, text nor null (default: 8)
     */
    public int otherBytes() {
        return otherBytes;
    }

    /**
     * Builder for TabulaConfiguration.
     */
    public static class Builder {
        private int previewRows = 5;
        private int displayRows = 0;
        private int numberBytes = 8;
        private int charBytes = 2;
        private int otherBytes = 8;

        private Builder() {
        }

        /**
         * Set the default row count for {@code head()} and {@code tail()}.
         *
         * @param previewRows number of rows
         * @return this builder for method chaining
         */
        public Builder previewRows(int previewRows) {
            this.previewRows = previewRows;
            return this;
        }

        /**
         * Set the row limit used by the text formatter.
         *
         * @param displayRows number of rows, 0 for all rows
         * @return this builder for method chaining
         */
        public Builder displayRows(int displayRows) {
            this.displayRows = displayRows;
            return this;
        }

        public Builder numberBytes(int numberBytes) {
            this.numberBytes = numberBytes;
            return this;
        }

        public Builder charBytes(int charBytes) {
            this.charBytes = charBytes;
            return this;
        }

        public Builder otherBytes(int otherBytes) {
            this.otherBytes = otherBytes;
            return this;
        }

        /**
         * Build the immutable TabulaConfiguration.
         *
         * @return a new TabulaConfiguration instance
         * @throws IllegalArgumentException if any setting is negative
         */
        public TabulaConfiguration build() {
            requireNonNegative(previewRows, "previewRows");
            requireNonNegative(displayRows, "displayRows");
            requireNonNegative(numberBytes, "numberBytes");
            requireNonNegative(charBytes, "charBytes");
            requireNonNegative(otherBytes, "otherBytes");
            return new TabulaConfiguration(this);
        }

        private static void requireNonNegative(int value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
        }
    }
}
