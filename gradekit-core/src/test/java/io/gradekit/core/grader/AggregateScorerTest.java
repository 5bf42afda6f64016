package io.gradekit.core.grader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.gradekit.core.grader.model.GraderType;
import io.gradekit.core.grader.result.EvaluationResult;
import io.gradekit.core.grader.result.GraderResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class AggregateScorerTest {

    private final AggregateScorer scorer = new AggregateScorer();

    private static GraderResult result(double weight, double score, double maxScore) {
        return GraderResult.builder()
                .graderName("g")
                .graderType(GraderType.XML)
                .weight(weight)
                .score(score)
                .maxScore(maxScore)
                .passed(score == maxScore)
                .build();
    }

    @Test
    void shouldWeightGradersByDeclaredWeightNotFieldCount() {
        // 1 of 10 fields on a weight-1 grader, 1 of 1 field on a weight-3 grader
        EvaluationResult evaluation =
                scorer.aggregate(List.of(result(1.0, 1.0, 10.0), result(3.0, 1.0, 1.0)));

        assertThat(evaluation.getTotalScore()).isCloseTo(3.1, within(1e-9));
        assertThat(evaluation.getMaxScore()).isEqualTo(4.0);
        assertThat(evaluation.getPercentageScore()).isCloseTo(77.5, within(1e-9));
        assertThat(evaluation.isPassed()).isFalse();
    }

    @Test
    void shouldSkipGradersWithoutApplicableFields() {
        EvaluationResult evaluation =
                scorer.aggregate(List.of(result(1.0, 1.0, 1.0), result(5.0, 0.0, 0.0)));

        assertThat(evaluation.getMaxScore()).isEqualTo(1.0);
        assertThat(evaluation.getPercentageScore()).isEqualTo(100.0);
        assertThat(evaluation.isPassed()).isTrue();
    }

    @Test
    void shouldScoreZeroWhenNothingIsScorable() {
        EvaluationResult evaluation = scorer.aggregate(List.of());

        assertThat(evaluation.getTotalScore()).isZero();
        assertThat(evaluation.getMaxScore()).isZero();
        assertThat(evaluation.getPercentageScore()).isZero();
        assertThat(evaluation.isPassed()).isTrue();
    }

    @Test
    void shouldIgnoreZeroWeightGraders() {
        EvaluationResult evaluation =
                scorer.aggregate(List.of(result(0.0, 0.0, 2.0), result(1.0, 1.0, 1.0)));

        assertThat(evaluation.getPercentageScore()).isEqualTo(100.0);
        assertThat(evaluation.isPassed()).isFalse();
    }
}
