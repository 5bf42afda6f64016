package io.gradekit.core.grader;

import io.gradekit.core.GradingConfig;
import io.gradekit.core.compare.ComparatorRegistry;
import io.gradekit.core.compare.FieldComparator;
import io.gradekit.core.extract.ExtractionOutcome;
import io.gradekit.core.extract.ExtractionOutcome.ExtractedValue;
import io.gradekit.core.extract.ExtractionOutcome.ExtractionFailure;
import io.gradekit.core.extract.FieldExtractor;
import io.gradekit.core.extract.JsonCodec;
import io.gradekit.core.extract.ResponseDocument;
import io.gradekit.core.extract.ResponseDocuments;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.model.GraderField;
import io.gradekit.core.grader.result.FieldResult;
import io.gradekit.core.grader.result.GraderResult;
import io.gradekit.core.response.ResponsePayload;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Grades one response against one grader.
///
/// Opens the response once in the grader's container format, then extracts, coerces and
/// compares every field in declaration order.
///
/// ### Scoring
/// - achieved = sum of weights of applicable fields that passed
/// - possible = sum of weights of applicable fields
/// - passed = every applicable field passed (true when none is applicable)
///
/// ### Contracts
/// - **Precondition**: the grader declares at least one field
/// - **Postcondition**: one {@link FieldResult} per declared field, in order, whatever the
///   response contains
///
/// @implNote Immutable and thread-safe if the comparator registry and codec are.
///
/// @see io.gradekit.core.GradingEngine for the task-level entry point
public final class GraderEvaluator {

    private static final Logger logger = Logger.getLogger(GraderEvaluator.class.getName());

    private final ComparatorRegistry comparators;
    private final JsonCodec codec;
    private final long maxResponseBytes;

    /// Creates an evaluator.
    ///
    /// @param comparators comparator lookup, not null
    /// @param codec JSON codec, may be null when no grader reads JSON
    /// @param config size limits, not null
    public GraderEvaluator(ComparatorRegistry comparators, JsonCodec codec, GradingConfig config) {
        this.comparators = Objects.requireNonNull(comparators, "comparators must not be null");
        this.codec = codec;
        this.maxResponseBytes =
                Objects.requireNonNull(config, "config must not be null").getMaxResponseBytes();
    }

    /// Grades a response with one grader.
    ///
    /// @param response submission, not null
    /// @param grader grader definition, not null
    /// @return grader result with complete details, never null
    /// @throws GraderConfigurationException if the grader has no fields or uses a comparator
    ///         type with no registered implementation
    public GraderResult evaluate(ResponsePayload response, GraderConfig grader)
            throws GraderConfigurationException {
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(grader, "grader must not be null");

        if (grader.getFields().isEmpty()) {
            throw new GraderConfigurationException(
                    "Grader '" + grader.getName() + "' declares no fields");
        }

        ResponseDocument document =
                ResponseDocuments.open(
                        response, grader.getContainerFormat(), codec, maxResponseBytes);

        List<FieldResult> details = new ArrayList<>();
        double score = 0.0;
        double maxScore = 0.0;
        boolean passed = true;

        for (GraderField field : grader.getFields()) {
            FieldResult result = evaluateField(document, field);
            details.add(result);
            if (result.isApplicable()) {
                maxScore += field.getWeight();
                if (result.isPassed()) {
                    score += field.getWeight();
                } else {
                    passed = false;
                }
            }
        }

        return GraderResult.builder()
                .graderName(grader.getName())
                .graderType(grader.getType())
                .weight(grader.getWeight())
                .score(score)
                .maxScore(maxScore)
                .passed(passed)
                .error(document.failure().map(ExtractionFailure::message).orElse(null))
                .details(details)
                .build();
    }

    private FieldResult evaluateField(ResponseDocument document, GraderField field)
            throws GraderConfigurationException {
        ComparatorConfig config = field.getComparator();
        FieldComparator comparator =
                comparators
                        .find(config.type())
                        .orElseThrow(
                                () ->
                                        new GraderConfigurationException(
                                                "No comparator registered for type: "
                                                        + config.type().getValue()));

        boolean applicable = comparator.isApplicable(config);
        ExtractionOutcome outcome = FieldExtractor.extract(document, field.getKey(), field.getType());

        FieldResult.Builder builder =
                FieldResult.builder()
                        .fieldId(field.getId())
                        .key(field.getKey())
                        .type(field.getType())
                        .weight(field.getWeight())
                        .applicable(applicable)
                        .comparatorType(config.type())
                        .expected(config.getExpected())
                        .rawValue(outcome.raw());

        if (outcome instanceof ExtractedValue extracted) {
            boolean matched = applicable && comparator.matches(config, extracted.value());
            builder.actual(extracted.value().value()).passed(matched);
        } else {
            builder.failure((ExtractionFailure) outcome).passed(false);
        }

        FieldResult result = builder.build();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Field " + field.getKey() + ": " + result);
        }
        return result;
    }
}
