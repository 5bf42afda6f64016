package io.gradekit.core;

import io.gradekit.core.grader.AggregateScorer;
import io.gradekit.core.grader.GraderConfigurationException;
import io.gradekit.core.grader.GraderEvaluator;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.result.EvaluationResult;
import io.gradekit.core.grader.result.GraderResult;
import io.gradekit.core.response.ResponsePayload;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point for grading a labeler's response against a task's graders.
///
/// Runs every grader in order, then combines their results into a weighted score on a
/// 0-100 scale. The result is what a submission stores as its `grader_results`, and its
/// `percentageScore` is the submission's score.
///
/// ### Contracts
/// - **Precondition**: every grader declares at least one field
/// - **Postcondition**: one {@link GraderResult} per grader, in order, each with one
///   detail per field
/// - **Invariant**: malformed response content never raises an exception; it is recorded
///   as per-field failures and per-grader errors
///
/// ### Usage
/// {@snippet :
/// GradingEngine engine = GradeKitFactory.createEngine();
/// EvaluationResult result = engine.evaluateResponse("<answer>42</answer>", graders);
/// double score = result.getPercentageScore();
/// }
///
/// @implNote Immutable and thread-safe. The engine holds no per-evaluation state, so the
/// same response and graders always produce the same result.
///
/// @see GraderEvaluator for per-grader evaluation
/// @see AggregateScorer for weight normalization
public final class GradingEngine {

    private static final Logger logger = Logger.getLogger(GradingEngine.class.getName());

    private final GraderEvaluator evaluator;
    private final AggregateScorer scorer;

    /// Creates a grading engine.
    ///
    /// @param evaluator per-grader evaluation, not null
    /// @param scorer result aggregation, not null
    public GradingEngine(GraderEvaluator evaluator, AggregateScorer scorer) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
    }

    /// Grades a free-text response.
    ///
    /// @param response submitted text, not null
    /// @param graders task graders, not null, may be empty
    /// @return evaluation result, never null
    /// @throws GraderConfigurationException if any grader declares no fields
    public EvaluationResult evaluateResponse(String response, List<GraderConfig> graders)
            throws GraderConfigurationException {
        return evaluateResponse(ResponsePayload.text(response), graders);
    }

    /// Grades a response against every grader and aggregates the scores.
    ///
    /// All graders are checked before any is evaluated, so a configuration error never
    /// leaves a partial result.
    ///
    /// ### Performance
    /// - Time: O(g * f * n) for g graders of f fields over a response of n characters
    ///
    /// @param response submission, not null
    /// @param graders task graders, not null, may be empty
    /// @return evaluation result, never null
    /// @throws GraderConfigurationException if any grader declares no fields
    public EvaluationResult evaluateResponse(
            ResponsePayload response, List<GraderConfig> graders)
            throws GraderConfigurationException {
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(graders, "graders must not be null");

        for (int i = 0; i < graders.size(); i++) {
            GraderConfig grader = graders.get(i);
            if (grader.getFields().isEmpty()) {
                throw new GraderConfigurationException(
                        "Grader '" + grader.getName() + "' declares no fields",
                        "graders[" + i + "]");
            }
        }

        List<GraderResult> results = new ArrayList<>(graders.size());
        for (GraderConfig grader : graders) {
            results.add(evaluator.evaluate(response, grader));
        }

        EvaluationResult evaluation = scorer.aggregate(results);
        logger.info(
                "Evaluated response against "
                        + graders.size()
                        + " grader(s): "
                        + String.format("%.2f", evaluation.getPercentageScore())
                        + "%");
        return evaluation;
    }

    /// Grades a free-text response with a single grader.
    ///
    /// @param response submitted text, not null
    /// @param grader grader definition, not null
    /// @return grader result, never null
    /// @throws GraderConfigurationException if the grader declares no fields
    public GraderResult evaluateGrader(String response, GraderConfig grader)
            throws GraderConfigurationException {
        return evaluateGrader(ResponsePayload.text(response), grader);
    }

    /// Grades a response with a single grader, without aggregation.
    ///
    /// @param response submission, not null
    /// @param grader grader definition, not null
    /// @return grader result, never null
    /// @throws GraderConfigurationException if the grader declares no fields
    public GraderResult evaluateGrader(ResponsePayload response, GraderConfig grader)
            throws GraderConfigurationException {
        return evaluator.evaluate(response, grader);
    }
}
