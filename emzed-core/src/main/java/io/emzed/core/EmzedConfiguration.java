package io.emzed.core;

/**
 * Immutable configuration for tables and their persistence helpers.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * EmzedConfiguration config = EmzedConfiguration.builder()
 *     .csvSeparator(",")
 *     .compressOnStore(false)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.emzed.storage.TableStore
 * @see io.emzed.storage.CsvTableIO
 */
public final class EmzedConfiguration {

    private static final EmzedConfiguration DEFAULTS = builder().build();

    // CSV import and export
    private final String csvSeparator;
    private final boolean keepNoneStrings;

    // Binary persistence
    private final boolean compressOnStore;
    private final String digestAlgorithm;

    // Join progress reporting, in percent
    private final int progressStep;

    private EmzedConfiguration(Builder builder) {
        this.csvSeparator = builder.csvSeparator;
        this.keepNoneStrings = builder.keepNoneStrings;
        this.compressOnStore = builder.compressOnStore;
        this.digestAlgorithm = builder.digestAlgorithm;
        this.progressStep = builder.progressStep;
    }

    /**
     * Create a new builder for EmzedConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The configuration used by the convenience methods of {@link io.emzed.storage.Table}.
     */
    public static EmzedConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Get the column separator used when reading CSV files.
     *
     * @return separator, {@code ";"} unless configured otherwise
     */
    public String csvSeparator() {
        return csvSeparator;
    }

    /**
     * Check if the literal text {@code None} in CSV files is kept as a string.
     *
     * @return true if {@code None} cells stay strings, false if they become missing values
     */
    public boolean keepNoneStrings() {
        return keepNoneStrings;
    }

    /**
     * Check if embedded values are deduplicated before a table is stored.
     *
     * @return true if stores compress embedded values (default: true)
     */
    public boolean compressOnStore() {
        return compressOnStore;
    }

    /**
     * Get the message digest algorithm used for content hashes.
     *
     * @return algorithm name accepted by {@link java.security.MessageDigest#getInstance(String)}
     */
    public String digestAlgorithm() {
        return digestAlgorithm;
    }

    /**
     * Get the percent step between two join progress log lines.
     *
     * @return step in percent, 1 to 100
     */
    public int progressStep() {
        return progressStep;
    }

    /**
     * Builder for EmzedConfiguration.
     */
    public static class Builder {
        private String csvSeparator = ";";
        private boolean keepNoneStrings = false;
        private boolean compressOnStore = true;
        private String digestAlgorithm = "SHA-256";
        private int progressStep = 10;

        private Builder() {
        }

        /**
         * Set the column separator for CSV input.
         *
         * @param csvSeparator non empty separator
         * @return this builder for method chaining
         */
        public Builder csvSeparator(String csvSeparator) {
            if (csvSeparator == null || csvSeparator.isEmpty()) {
                throw new IllegalArgumentException("csvSeparator required");
            }
            this.csvSeparator = csvSeparator;
            return this;
        }

        public Builder keepNoneStrings(boolean keepNoneStrings) {
            this.keepNoneStrings = keepNoneStrings;
            return this;
        }

        public Builder compressOnStore(boolean compressOnStore) {
            this.compressOnStore = compressOnStore;
            return this;
        }

        public Builder digestAlgorithm(String digestAlgorithm) {
            if (digestAlgorithm == null || digestAlgorithm.isBlank()) {
                throw new IllegalArgumentException("digestAlgorithm required");
            }
            this.digestAlgorithm = digestAlgorithm;
            return this;
        }

        /**
         * Set the percent step between join progress log lines.
         *
         * @param progressStep value between 1 and 100
         * @return this builder for method chaining
         */
        public Builder progressStep(int progressStep) {
            if (progressStep < 1 || progressStep > 100) {
                throw new IllegalArgumentException("progressStep must be between 1 and 100");
            }
            this.progressStep = progressStep;
            return this;
        }

        /**
         * Build the immutable EmzedConfiguration.
         *
         * @return a new EmzedConfiguration instance
         */
        public EmzedConfiguration build() {
            return new EmzedConfiguration(this);
        }
    }
}
