package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import io.gradekit.core.grader.model.FieldType;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.model.GraderField;
import java.io.IOException;
import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// Writes a {@link GraderConfig} back in the configuration shape it was authored in.
///
/// Emitted JSON shape per layout:
/// - **STRUCTURE**: `config.structure[]` of `{id, name, type, weight, comparator, ...}`
/// - **TEST_CASES**: `config.test_cases[]` of `{id, type, weight, expected_value, ...}`.
///   `comparator` is only written when it is anything other than a plain `equals` on
///   `expected_value`. A declared `expected_value` kept beside the comparator's own
///   `expected` is written back as declared
/// - **WHOLE_RESPONSE**: `config.expected`
///
/// Field attributes and grader settings follow the interpreted keys in their original order.
/// `type` and `weight` are left out when the definition omitted them and they still hold the
/// default.
///
/// @implNote Package-private. Registered by {@link GradeKitJacksonModule}.
/// @see GraderConfigParser for the inverse operation
class GraderConfigSerializer extends StdSerializer<GraderConfig> {

    @Serial private static final long serialVersionUID = 6262819415040871179L;

    GraderConfigSerializer() {
        super(GraderConfig.class);
    }

    @Override
    public void serialize(GraderConfig grader, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", grader.getType().getValue());
        gen.writeStringField("name", grader.getName());
        gen.writeFieldName("weight");
        JsonValues.writeDouble(gen, grader.getWeight());

        gen.writeObjectFieldStart("config");
        switch (grader.getLayout()) {
            case STRUCTURE -> {
                gen.writeArrayFieldStart(GraderConfigParser.STRUCTURE);
                for (GraderField field : grader.getFields()) {
                    writeStructureField(field, gen);
                }
                gen.writeEndArray();
            }
            case TEST_CASES -> {
                gen.writeArrayFieldStart(GraderConfigParser.TEST_CASES);
                for (GraderField field : grader.getFields()) {
                    writeTestCase(field, gen);
                }
                gen.writeEndArray();
            }
            case WHOLE_RESPONSE -> {
                Object expected =
                        grader.getFields().isEmpty()
                                ? null
                                : grader.getFields().get(0).getComparator().getExpected();
                JsonValues.writeField(gen, ComparatorConfig.EXPECTED, expected);
            }
        }
        writeEntries(grader.getSettings(), gen);
        gen.writeEndObject();

        gen.writeEndObject();
    }

    private static void writeStructureField(GraderField field, JsonGenerator gen)
            throws IOException {
        gen.writeStartObject();
        if (field.getId() != null) {
            gen.writeStringField("id", field.getId());
        }
        if (field.getName() != null) {
            gen.writeStringField("name", field.getName());
        }
        writeTypeAndWeight(field, gen);
        writeComparator(field.getComparator(), gen);
        writeEntries(field.getAttributes(), gen);
        gen.writeEndObject();
    }

    private static void writeTestCase(GraderField field, JsonGenerator gen) throws IOException {
        ComparatorConfig comparator = field.getComparator();
        Map<String, Object> attributes = new LinkedHashMap<>(field.getAttributes());
        boolean declaredSeparately = attributes.containsKey(GraderField.EXPECTED_VALUE);
        Object expectedValue =
                declaredSeparately
                        ? attributes.remove(GraderField.EXPECTED_VALUE)
                        : comparator.getExpected();

        gen.writeStartObject();
        gen.writeStringField("id", field.getKey());
        writeTypeAndWeight(field, gen);
        JsonValues.writeField(gen, GraderField.EXPECTED_VALUE, expectedValue);
        if (declaredSeparately || !isPlainEquals(comparator)) {
            writeComparator(comparator, gen);
        }
        writeEntries(attributes, gen);
        gen.writeEndObject();
    }

    private static void writeTypeAndWeight(GraderField field, JsonGenerator gen)
            throws IOException {
        Set<String> defaulted = field.getDefaultedKeys();
        if (!defaulted.contains("type") || field.getType() != FieldType.STRING) {
            gen.writeStringField("type", field.getType().getValue());
        }
        if (!defaulted.contains("weight") || field.getWeight() != 1.0) {
            gen.writeFieldName("weight");
            JsonValues.writeDouble(gen, field.getWeight());
        }
    }

    private static void writeComparator(ComparatorConfig comparator, JsonGenerator gen)
            throws IOException {
        gen.writeObjectFieldStart("comparator");
        gen.writeStringField("type", comparator.type().getValue());
        JsonValues.writeField(gen, "config", comparator.settings());
        gen.writeEndObject();
    }

    private static boolean isPlainEquals(ComparatorConfig comparator) {
        return comparator.type() == ComparatorType.EQUALS
                && comparator.settings().keySet().equals(Set.of(ComparatorConfig.EXPECTED));
    }

    private static void writeEntries(Map<String, Object> entries, JsonGenerator gen)
            throws IOException {
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            JsonValues.writeField(gen, entry.getKey(), entry.getValue());
        }
    }
}
