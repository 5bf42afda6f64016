package io.gradekit.core.grader.result;

import io.gradekit.core.grader.model.GraderType;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/// Immutable outcome of one grader.
///
/// `score` and `maxScore` are sums of field weights. `contribution` is the grader's
/// weight-normalized share of the task total: `score / maxScore * weight`, or 0 when the
/// grader had no applicable fields.
public final class GraderResult {

    private final String graderName;
    private final GraderType graderType;
    private final double weight;
    private final double score;
    private final double maxScore;
    private final boolean passed;
    private final double contribution;
    private final String error;
    private final List<FieldResult> details;

    private GraderResult(Builder builder) {
        this.graderName = Objects.requireNonNull(builder.graderName, "Grader name required");
        this.graderType = Objects.requireNonNull(builder.graderType, "Grader type required");
        this.weight = builder.weight;
        this.score = builder.score;
        this.maxScore = builder.maxScore;
        this.passed = builder.passed;
        this.error = builder.error;
        this.details = List.copyOf(builder.details);
        this.contribution = maxScore > 0 ? score / maxScore * weight : 0.0;

        if (score < 0 || maxScore < 0 || score > maxScore + 1e-9) {
            throw new IllegalArgumentException(
                    "Score must be within [0, maxScore], got " + score + "/" + maxScore);
        }
    }

    public String getGraderName() {
        return graderName;
    }

    public GraderType getGraderType() {
        return graderType;
    }

    public double getWeight() {
        return weight;
    }

    /// Returns the summed weight of passed applicable fields.
    public double getScore() {
        return score;
    }

    /// Returns the summed weight of applicable fields.
    public double getMaxScore() {
        return maxScore;
    }

    /// True when every applicable field passed. Vacuously true with no applicable fields.
    public boolean isPassed() {
        return passed;
    }

    public double getContribution() {
        return contribution;
    }

    /// Returns the container-level failure shared by every field.
    ///
    /// @return error message, null if the response was readable
    public String getError() {
        return error;
    }

    /// Returns per-field results in declaration order.
    ///
    /// @return unmodifiable list, never null
    public List<FieldResult> getDetails() {
        return details;
    }

    public List<FieldResult> getFailedFields() {
        return details.stream()
                .filter(field -> field.isApplicable() && !field.isPassed())
                .collect(Collectors.toList());
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GraderResult{name="
                + graderName
                + ", score="
                + score
                + "/"
                + maxScore
                + ", passed="
                + passed
                + "}";
    }

    public static final class Builder {
        private String graderName;
        private GraderType graderType;
        private double weight = 1.0;
        private double score;
        private double maxScore;
        private boolean passed;
        private String error;
        private List<FieldResult> details = List.of();

        private Builder() {}

        public Builder graderName(String graderName) {
            this.graderName = graderName;
            return this;
        }

        public Builder graderType(GraderType graderType) {
            this.graderType = graderType;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder maxScore(double maxScore) {
            this.maxScore = maxScore;
            return this;
        }

        public Builder passed(boolean passed) {
            this.passed = passed;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder details(List<FieldResult> details) {
            this.details = details;
            return this;
        }

        /// Builds the result and derives its contribution.
        ///
        /// @return new GraderResult instance, never null
        /// @throws IllegalArgumentException if score is outside [0, maxScore]
        public GraderResult build() {
            return new GraderResult(this);
        }
    }
}
