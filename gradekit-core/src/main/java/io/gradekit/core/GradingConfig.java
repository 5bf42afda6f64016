package io.gradekit.core;

/// Configuration options for the grading engine.
///
/// Use the {@link Builder} for fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `maxResponseBytes`: `1048576` (1 MiB, UTF-8 encoded)
/// - `defaultGraderWeight`: `1.0` (applied by configuration loaders when `weight` is absent)
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link GradeKitFactory}. Do not modify after engine creation.
///
/// @see GradeKitFactory#createEngine(GradingConfig)
public class GradingConfig {

    public static final long DEFAULT_MAX_RESPONSE_BYTES = 1024L * 1024L;

    private long maxResponseBytes = DEFAULT_MAX_RESPONSE_BYTES;
    private double defaultGraderWeight = 1.0;

    /// Creates a configuration with default values.
    public GradingConfig() {}

    /// Returns the largest response the engine will read.
    ///
    /// Larger responses are graded with every field failing as `RESPONSE_TOO_LARGE`.
    ///
    /// @return limit in UTF-8 bytes
    public long getMaxResponseBytes() {
        return maxResponseBytes;
    }

    /// Sets the largest response the engine will read.
    ///
    /// @param maxResponseBytes limit in UTF-8 bytes, must be positive
    /// @throws IllegalArgumentException if not positive
    public void setMaxResponseBytes(long maxResponseBytes) {
        if (maxResponseBytes <= 0) {
            throw new IllegalArgumentException("maxResponseBytes must be positive");
        }
        this.maxResponseBytes = maxResponseBytes;
    }

    public double getDefaultGraderWeight() {
        return defaultGraderWeight;
    }

    /// Sets the weight loaders assign to graders that declare none.
    ///
    /// @param defaultGraderWeight non-negative weight
    /// @throws IllegalArgumentException if negative
    public void setDefaultGraderWeight(double defaultGraderWeight) {
        if (defaultGraderWeight < 0) {
            throw new IllegalArgumentException("defaultGraderWeight cannot be negative");
        }
        this.defaultGraderWeight = defaultGraderWeight;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link GradingConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final GradingConfig config = new GradingConfig();

        public Builder maxResponseBytes(long maxResponseBytes) {
            config.setMaxResponseBytes(maxResponseBytes);
            return this;
        }

        public Builder defaultGraderWeight(double defaultGraderWeight) {
            config.setDefaultGraderWeight(defaultGraderWeight);
            return this;
        }

        public GradingConfig build() {
            return config;
        }
    }
}
