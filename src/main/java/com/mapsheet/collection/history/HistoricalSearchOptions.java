package com.mapsheet.collection.history;

/**
 * Options for historical archive lookups.
 */
public class HistoricalSearchOptions {

    private static final int DEFAULT_LOOKBACK_DAYS = 30;
    private static final int DEFAULT_PARALLELISM = 4;

    private final int lookbackDays;
    private final int parallelism;

    private HistoricalSearchOptions(Builder builder) {
        this.lookbackDays = builder.lookbackDays;
        this.parallelism = builder.parallelism;
    }

    /**
     * Number of days before the reference date that are searched, in addition to the
     * reference date itself.
     */
    public int getLookbackDays() {
        return lookbackDays;
    }

    /**
     * Number of archive folders scanned concurrently by the fuzzy pass.
     */
    public int getParallelism() {
        return parallelism;
    }

    public static HistoricalSearchOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int lookbackDays = DEFAULT_LOOKBACK_DAYS;
        private int parallelism = DEFAULT_PARALLELISM;

        public Builder lookbackDays(int lookbackDays) {
            if (lookbackDays < 0) {
                throw new IllegalArgumentException("lookbackDays must not be negative");
            }
            this.lookbackDays = lookbackDays;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public HistoricalSearchOptions build() {
            return new HistoricalSearchOptions(this);
        }
    }
}
