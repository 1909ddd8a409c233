package com.disease.coding.resolver;

/**
 * Options for disease name resolution.
 */
public class ResolverOptions {

    public static final double DEFAULT_THRESHOLD = 70.0;

    private final double threshold;

    private ResolverOptions(Builder builder) {
        this.threshold = builder.threshold;
    }

    /**
     * Minimum score a fuzzy candidate must strictly exceed to be accepted.
     */
    public double getThreshold() {
        return threshold;
    }

    /**
     * Creates default options.
     */
    public static ResolverOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static void validateThreshold(double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException("threshold must be between 0 and 100, got " + value);
        }
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;

        public Builder threshold(double threshold) {
            validateThreshold(threshold);
            this.threshold = threshold;
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ResolverOptions{threshold=" + threshold + '}';
    }
}
