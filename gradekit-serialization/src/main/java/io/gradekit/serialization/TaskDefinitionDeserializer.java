package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.gradekit.core.GradingConfig;
import io.gradekit.core.grader.GraderConfigurationException;
import io.gradekit.core.task.TaskDefinition;
import java.io.IOException;
import java.io.Serial;

/// Deserializes one task entry, including its graders.
///
/// @implNote Package-private. Registered by {@link GradeKitJacksonModule}.
/// @see TaskDefinitionSerializer for the inverse operation
class TaskDefinitionDeserializer extends StdDeserializer<TaskDefinition> {

    @Serial private static final long serialVersionUID = 8719404853318760228L;

    private final transient GraderConfigParser parser;

    TaskDefinitionDeserializer() {
        this(new GradingConfig());
    }

    TaskDefinitionDeserializer(GradingConfig config) {
        super(TaskDefinition.class);
        this.parser = new GraderConfigParser(config.getDefaultGraderWeight());
    }

    @Override
    public TaskDefinition deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        try {
            return parser.parseTask(root, "task");
        } catch (GraderConfigurationException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
