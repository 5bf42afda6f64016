package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.gradekit.core.task.TaskDefinition;
import java.io.IOException;
import java.io.Serial;

/// Serializes a {@link TaskDefinition} as one entry of a `{"tasks": [...]}` document.
///
/// `description` and `prompt` are omitted when null. Graders are delegated to
/// {@link GraderConfigSerializer} through the provider.
///
/// @implNote Package-private. Registered by {@link GradeKitJacksonModule}.
class TaskDefinitionSerializer extends StdSerializer<TaskDefinition> {

    @Serial private static final long serialVersionUID = 3301754628811092345L;

    TaskDefinitionSerializer() {
        super(TaskDefinition.class);
    }

    @Override
    public void serialize(TaskDefinition task, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", task.name());
        if (task.description() != null) {
            gen.writeStringField("description", task.description());
        }
        if (task.prompt() != null) {
            gen.writeStringField("prompt", task.prompt());
        }
        provider.defaultSerializeField("graders", task.graders(), gen);
        gen.writeEndObject();
    }
}
