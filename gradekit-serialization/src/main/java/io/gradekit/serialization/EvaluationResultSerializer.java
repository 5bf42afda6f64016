package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gradekit.core.grader.result.EvaluationResult;
import java.io.IOException;
import java.io.Serial;

/// Serializes an {@link EvaluationResult} into the `grader_results` shape stored with a
/// submission.
///
/// Emitted JSON shape:
/// `{"totalScore":..,"maxScore":..,"percentageScore":..,"passed":..,"graderResults":[..]}`.
/// Each grader result is written by {@link GraderResultSerializer}.
///
/// @implNote Package-private. Registered by {@link GradeKitJacksonModule}. Write-only: stored
/// results are read back by external consumers, never by the engine.
class EvaluationResultSerializer extends StdSerializer<EvaluationResult> {

    @Serial private static final long serialVersionUID = -5216183094756271838L;

    EvaluationResultSerializer() {
        super(EvaluationResult.class);
    }

    @Override
    public void serialize(EvaluationResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeNumberField("totalScore", result.getTotalScore());
        gen.writeNumberField("maxScore", result.getMaxScore());
        gen.writeNumberField("percentageScore", result.getPercentageScore());
        gen.writeBooleanField("passed", result.isPassed());
        provider.defaultSerializeField("graderResults", result.getGraderResults(), gen);
        gen.writeEndObject();
    }
}
