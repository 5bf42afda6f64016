package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.gradekit.core.GradingConfig;
import io.gradekit.core.grader.GraderConfigurationException;
import io.gradekit.core.grader.model.GraderConfig;
import java.io.IOException;
import java.io.Serial;

/// Deserializes a {@link GraderConfig} from either legacy configuration shape.
///
/// Parsing is delegated to {@link GraderConfigParser}. A configuration error surfaces as a
/// `JsonMappingException` carrying the original {@link GraderConfigurationException} as its
/// cause, since Jackson deserializers cannot throw checked domain exceptions.
///
/// @implNote Package-private. Registered by {@link GradeKitJacksonModule}.
/// @see GraderConfigReader for loading with checked configuration errors
class GraderConfigDeserializer extends StdDeserializer<GraderConfig> {

    @Serial private static final long serialVersionUID = -1645010937795285042L;

    private final transient GraderConfigParser parser;

    GraderConfigDeserializer() {
        this(new GradingConfig());
    }

    GraderConfigDeserializer(GradingConfig config) {
        super(GraderConfig.class);
        this.parser = new GraderConfigParser(config.getDefaultGraderWeight());
    }

    @Override
    public GraderConfig deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        try {
            return parser.parseGrader(root, "grader");
        } catch (GraderConfigurationException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
