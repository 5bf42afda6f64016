package io.gradekit.core.grader.result;

import java.util.List;

/// Immutable outcome of evaluating one response against all of a task's graders.
///
/// This is the value stored as a submission's `grader_results`; `percentageScore` is the
/// submission score.
public final class EvaluationResult {

    private final double totalScore;
    private final double maxScore;
    private final double percentageScore;
    private final boolean passed;
    private final List<GraderResult> graderResults;

    private EvaluationResult(Builder builder) {
        this.totalScore = builder.totalScore;
        this.maxScore = builder.maxScore;
        this.percentageScore = builder.percentageScore;
        this.passed = builder.passed;
        this.graderResults = List.copyOf(builder.graderResults);

        if (percentageScore < 0 || percentageScore > 100) {
            throw new IllegalArgumentException(
                    "Percentage must be within [0, 100], got " + percentageScore);
        }
    }

    public double getTotalScore() {
        return totalScore;
    }

    public double getMaxScore() {
        return maxScore;
    }

    /// Returns the score on a 0-100 scale, 0 when nothing was scorable.
    public double getPercentageScore() {
        return percentageScore;
    }

    public boolean isPassed() {
        return passed;
    }

    /// Returns per-grader results in grader order.
    ///
    /// @return unmodifiable list, never null
    public List<GraderResult> getGraderResults() {
        return graderResults;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EvaluationResult{total="
                + totalScore
                + "/"
                + maxScore
                + ", percentage="
                + percentageScore
                + ", passed="
                + passed
                + "}";
    }

    public static final class Builder {
        private double totalScore;
        private double maxScore;
        private double percentageScore;
        private boolean passed;
        private List<GraderResult> graderResults = List.of();

        private Builder() {}

        public Builder totalScore(double totalScore) {
            this.totalScore = totalScore;
            return this;
        }

        public Builder maxScore(double maxScore) {
            this.maxScore = maxScore;
            return this;
        }

        public Builder percentageScore(double percentageScore) {
            this.percentageScore = percentageScore;
            return this;
        }

        public Builder passed(boolean passed) {
            this.passed = passed;
            return this;
        }

        public Builder graderResults(List<GraderResult> graderResults) {
            this.graderResults = graderResults;
            return this;
        }

        public EvaluationResult build() {
            return new EvaluationResult(this);
        }
    }
}
