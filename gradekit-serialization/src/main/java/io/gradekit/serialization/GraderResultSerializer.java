package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gradekit.core.extract.ExtractionOutcome.ExtractionFailure;
import io.gradekit.core.grader.result.FieldResult;
import io.gradekit.core.grader.result.GraderResult;
import java.io.IOException;
import java.io.Serial;

/// Serializes a {@link GraderResult} with its per-field details.
///
/// Field entries carry `fieldId`, `key`, `type`, `weight`, `applicable`, `comparatorType`,
/// `expected`, `rawValue`, `actual`, `passed`, `score`, `maxScore` and `failure`. A failure is
/// written as `{"kind": "MISSING_FIELD", "message": "..."}` and is `null` for fields that
/// were read successfully.
///
/// @implNote Package-private. Registered by {@link GradeKitJacksonModule}.
class GraderResultSerializer extends StdSerializer<GraderResult> {

    @Serial private static final long serialVersionUID = 2958466177710233905L;

    GraderResultSerializer() {
        super(GraderResult.class);
    }

    @Override
    public void serialize(GraderResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("graderName", result.getGraderName());
        gen.writeStringField("graderType", result.getGraderType().getValue());
        gen.writeNumberField("weight", result.getWeight());
        gen.writeNumberField("score", result.getScore());
        gen.writeNumberField("maxScore", result.getMaxScore());
        gen.writeBooleanField("passed", result.isPassed());
        gen.writeNumberField("contribution", result.getContribution());
        gen.writeStringField("error", result.getError());

        gen.writeArrayFieldStart("details");
        for (FieldResult field : result.getDetails()) {
            writeField(field, gen);
        }
        gen.writeEndArray();

        gen.writeEndObject();
    }

    private static void writeField(FieldResult field, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("fieldId", field.getFieldId());
        gen.writeStringField("key", field.getKey());
        gen.writeStringField("type", field.getType().getValue());
        gen.writeNumberField("weight", field.getWeight());
        gen.writeBooleanField("applicable", field.isApplicable());
        gen.writeStringField("comparatorType", field.getComparatorType().getValue());
        JsonValues.writeField(gen, "expected", field.getExpected());
        gen.writeStringField("rawValue", field.getRawValue());
        JsonValues.writeField(gen, "actual", field.getActual());
        gen.writeBooleanField("passed", field.isPassed());
        gen.writeNumberField("score", field.getScore());
        gen.writeNumberField("maxScore", field.getMaxScore());

        ExtractionFailure failure = field.getFailure();
        if (failure == null) {
            gen.writeNullField("failure");
        } else {
            gen.writeObjectFieldStart("failure");
            gen.writeStringField("kind", failure.kind().name());
            gen.writeStringField("message", failure.message());
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }
}
