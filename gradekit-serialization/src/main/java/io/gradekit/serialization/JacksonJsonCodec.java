package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.gradekit.core.extract.JsonCodec;
import io.gradekit.core.extract.JsonCodecException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/// Jackson-backed {@link JsonCodec} used by the extractor to read `json` grader responses.
///
/// Registered in `META-INF/services/io.gradekit.core.extract.JsonCodec`, so
/// {@link io.gradekit.core.GradeKitFactory#createEngine()} picks it up whenever this module
/// is on the classpath.
///
/// Floating-point numbers are read as `BigDecimal`. `{"score": 5.0}` therefore keeps the
/// exact written digits until the extractor renders them as text.
///
/// @implNote Thread-safe. The mapper is configured once and never mutated afterwards.
public final class JacksonJsonCodec implements JsonCodec {

    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this.mapper =
                new ObjectMapper()
                        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                        .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Map<String, Object> readObject(String json) throws JsonCodecException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JsonCodecException(e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new JsonCodecException(
                    "Expected a JSON object but found " + describe(root));
        }
        return mapper.convertValue(root, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    @Override
    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to write JSON: " + e.getMessage(), e);
        }
    }

    private static String describe(JsonNode node) {
        if (node == null || node.isMissingNode()) {
            return "no content";
        }
        return node.getNodeType().name().toLowerCase(Locale.ROOT);
    }
}
