package io.gradekit.core.grader;

import io.gradekit.core.grader.result.EvaluationResult;
import io.gradekit.core.grader.result.GraderResult;
import java.util.List;
import java.util.Objects;

/// Combines grader results into a task score.
///
/// Each grader contributes `score / maxScore * weight`, so its share of the total depends on
/// its declared weight and not on how many fields it has. Graders with no applicable fields
/// contribute to neither the total nor the maximum.
///
/// ### Contracts
/// - **Postcondition**: `0 <= percentageScore <= 100`, and 0 when nothing was scorable
/// - **Postcondition**: `passed` is true iff every grader passed
///
/// @implNote Stateless and thread-safe.
public final class AggregateScorer {

    /// Aggregates grader results in order.
    ///
    /// @param graderResults per-grader results, not null, may be empty
    /// @return task-level result, never null
    public EvaluationResult aggregate(List<GraderResult> graderResults) {
        Objects.requireNonNull(graderResults, "graderResults must not be null");

        double totalScore = 0.0;
        double maxScore = 0.0;
        boolean passed = true;

        for (GraderResult result : graderResults) {
            if (result.getMaxScore() > 0) {
                totalScore += result.getContribution();
                maxScore += result.getWeight();
            }
            passed &= result.isPassed();
        }

        double percentage = maxScore > 0 ? totalScore / maxScore * 100.0 : 0.0;

        return EvaluationResult.builder()
                .totalScore(totalScore)
                .maxScore(maxScore)
                .percentageScore(Math.max(0.0, Math.min(100.0, percentage)))
                .passed(passed)
                .graderResults(graderResults)
                .build();
    }
}
