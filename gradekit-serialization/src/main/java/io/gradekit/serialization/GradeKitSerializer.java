package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.gradekit.core.grader.result.EvaluationResult;
import io.gradekit.core.grader.result.GraderResult;

/// Utility class for serializing grading results to JSON.
///
/// ### Usage
/// {@snippet :
/// EvaluationResult result = engine.evaluateResponse(response, graders);
/// String graderResults = GradeKitSerializer.toJson(result);
/// }
///
/// @implNote Thread-safe. The ObjectMapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper.
///
/// @see GradeKitJacksonModule for the registered type handlers
/// @see GraderConfigReader for loading grader configuration
public final class GradeKitSerializer {

    private GradeKitSerializer() {}

    /// Serializes an evaluation result to pretty-printed JSON.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON string in the `grader_results` shape, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(EvaluationResult result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize evaluation result: " + e.getMessage(), e);
        }
    }

    /// Serializes a single grader result to pretty-printed JSON.
    ///
    /// @param result the result to serialize, not null
    /// @return JSON string, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(GraderResult result) {
        try {
            return createMapper().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize grader result: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for GradeKit types.
    ///
    /// Registers:
    /// - `GradeKitJacksonModule` for configuration and result types
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new GradeKitJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
