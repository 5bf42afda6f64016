package io.gradekit.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.gradekit.core.grader.GraderConfigurationException;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import io.gradekit.core.grader.model.FieldLayout;
import io.gradekit.core.grader.model.FieldType;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.model.GraderField;
import io.gradekit.core.grader.model.GraderType;
import io.gradekit.core.response.ResponseComposer;
import io.gradekit.core.task.TaskDefinition;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Translates grader configuration JSON into the unified domain model.
///
/// Both legacy field shapes collapse into {@link GraderField} lists:
/// - `config.structure[]` - fields keyed by `name`, layout {@link FieldLayout#STRUCTURE}
/// - `config.test_cases[]` - fields keyed by `id`, layout {@link FieldLayout#TEST_CASES}
/// - `config.expected` on `text`/`number` graders - one implicit field named `response`,
///   layout {@link FieldLayout#WHOLE_RESPONSE}
///
/// Every structural problem is reported as a {@link GraderConfigurationException} whose path
/// points at the offending element, e.g. `graders[1].config.structure[0].comparator.type`.
///
/// @implNote Package-private. Stateless apart from the default grader weight; thread-safe.
/// @see GraderConfigSerializer for the inverse operation
final class GraderConfigParser {

    static final String STRUCTURE = "structure";
    static final String TEST_CASES = "test_cases";
    static final String EXPECTED_VALUE = GraderField.EXPECTED_VALUE;

    private static final Set<String> FIELD_KEYS =
            Set.of("id", "name", "type", "weight", "comparator");
    private static final Set<String> TEST_CASE_KEYS =
            Set.of("id", "type", "weight", "comparator", EXPECTED_VALUE);
    private static final List<String> DEFAULTABLE_KEYS = List.of("type", "weight");

    private final double defaultGraderWeight;

    GraderConfigParser(double defaultGraderWeight) {
        this.defaultGraderWeight = defaultGraderWeight;
    }

    List<TaskDefinition> parseTasks(JsonNode root, String path)
            throws GraderConfigurationException {
        requireObject(root, path);
        JsonNode tasks = root.get("tasks");
        if (tasks == null || !tasks.isArray()) {
            throw new GraderConfigurationException("tasks must be an array", path + ".tasks");
        }
        List<TaskDefinition> result = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            result.add(parseTask(tasks.get(i), path + ".tasks[" + i + "]"));
        }
        return result;
    }

    TaskDefinition parseTask(JsonNode node, String path) throws GraderConfigurationException {
        requireObject(node, path);
        String name = optionalText(node, "name", path);
        if (name == null) {
            throw new GraderConfigurationException("Task requires a name", path + ".name");
        }
        JsonNode graders = node.get("graders");
        if (graders == null || !graders.isArray()) {
            throw new GraderConfigurationException("graders must be an array", path + ".graders");
        }
        return new TaskDefinition(
                name,
                optionalText(node, "description", path),
                optionalText(node, "prompt", path),
                parseGraders(graders, path + ".graders"));
    }

    List<GraderConfig> parseGraders(JsonNode array, String path)
            throws GraderConfigurationException {
        List<GraderConfig> graders = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            graders.add(parseGrader(array.get(i), path + "[" + i + "]"));
        }
        return graders;
    }

    GraderConfig parseGrader(JsonNode node, String path) throws GraderConfigurationException {
        requireObject(node, path);

        GraderType type = parseGraderType(node.get("type"), path + ".type");
        String name = optionalText(node, "name", path);
        double weight = parseWeight(node.get("weight"), path + ".weight", defaultGraderWeight);

        JsonNode config = node.get("config");
        String configPath = path + ".config";
        if (isAbsent(config)) {
            config = JsonNodeFactory.instance.objectNode();
        } else if (!config.isObject()) {
            throw new GraderConfigurationException("config must be an object", configPath);
        }

        boolean hasStructure = isPresent(config.get(STRUCTURE));
        boolean hasTestCases = isPresent(config.get(TEST_CASES));
        if (hasStructure && hasTestCases) {
            throw new GraderConfigurationException(
                    "Grader declares both structure and test_cases", configPath);
        }

        GraderConfig.Builder builder =
                GraderConfig.builder()
                        .type(type)
                        .name(name != null ? name : type.getValue())
                        .weight(weight);
        Set<String> consumed;

        if (hasStructure) {
            builder.layout(FieldLayout.STRUCTURE)
                    .fields(parseStructure(config.get(STRUCTURE), configPath + "." + STRUCTURE));
            consumed = Set.of(STRUCTURE);
        } else if (hasTestCases) {
            builder.layout(FieldLayout.TEST_CASES)
                    .fields(parseTestCases(config.get(TEST_CASES), configPath + "." + TEST_CASES));
            consumed = Set.of(TEST_CASES);
        } else if (acceptsWholeResponse(type) && config.has(ComparatorConfig.EXPECTED)) {
            builder.layout(FieldLayout.WHOLE_RESPONSE)
                    .fields(
                            List.of(
                                    wholeResponseField(
                                            type, config.get(ComparatorConfig.EXPECTED))));
            consumed = Set.of(ComparatorConfig.EXPECTED);
        } else if (acceptsWholeResponse(type)) {
            consumed = Set.of();
        } else {
            throw new GraderConfigurationException(
                    "Grader '" + type.getValue() + "' declares neither structure nor test_cases",
                    configPath);
        }

        return builder.settings(remainder(config, consumed)).build();
    }

    private List<GraderField> parseStructure(JsonNode array, String path)
            throws GraderConfigurationException {
        requireArray(array, path);
        List<GraderField> fields = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            fields.add(parseStructureField(array.get(i), path + "[" + i + "]"));
        }
        return fields;
    }

    private GraderField parseStructureField(JsonNode node, String path)
            throws GraderConfigurationException {
        requireObject(node, path);
        String id = optionalText(node, "id", path);
        String name = optionalText(node, "name", path);
        if (id == null && name == null) {
            throw new GraderConfigurationException("Field requires an id or a name", path);
        }
        JsonNode comparator = node.get("comparator");
        if (isAbsent(comparator)) {
            throw new GraderConfigurationException(
                    "Field requires a comparator", path + ".comparator");
        }
        return GraderField.builder()
                .id(id)
                .name(name)
                .type(parseFieldType(node.get("type"), path + ".type"))
                .weight(parseWeight(node.get("weight"), path + ".weight", 1.0))
                .comparator(parseComparator(comparator, path + ".comparator"))
                .attributes(remainder(node, FIELD_KEYS))
                .defaultedKeys(defaultedKeys(node))
                .build();
    }

    private List<GraderField> parseTestCases(JsonNode array, String path)
            throws GraderConfigurationException {
        requireArray(array, path);
        List<GraderField> fields = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            fields.add(parseTestCase(array.get(i), path + "[" + i + "]"));
        }
        return fields;
    }

    private GraderField parseTestCase(JsonNode node, String path)
            throws GraderConfigurationException {
        requireObject(node, path);
        String id = optionalText(node, "id", path);
        if (id == null) {
            throw new GraderConfigurationException("Test case requires an id", path + ".id");
        }
        Object expected = JsonValues.toJava(node.get(EXPECTED_VALUE));

        Map<String, Object> attributes = remainder(node, TEST_CASE_KEYS);

        JsonNode comparatorNode = node.get("comparator");
        ComparatorConfig comparator;
        if (isAbsent(comparatorNode)) {
            comparator = ComparatorConfig.equalTo(expected);
        } else {
            comparator = parseComparator(comparatorNode, path + ".comparator");
            if (!comparator.settings().containsKey(ComparatorConfig.EXPECTED)) {
                comparator = comparator.with(ComparatorConfig.EXPECTED, expected);
            } else if (node.has(EXPECTED_VALUE)) {
                // the comparator's own expected wins for scoring; the declared value is kept
                attributes.put(EXPECTED_VALUE, expected);
            }
        }

        return GraderField.builder()
                .id(id)
                .type(parseFieldType(node.get("type"), path + ".type"))
                .weight(parseWeight(node.get("weight"), path + ".weight", 1.0))
                .comparator(comparator)
                .attributes(attributes)
                .defaultedKeys(defaultedKeys(node))
                .build();
    }

    private static GraderField wholeResponseField(GraderType type, JsonNode expected) {
        return GraderField.builder()
                .id(ResponseComposer.WHOLE_RESPONSE_KEY)
                .type(type == GraderType.NUMBER ? FieldType.FLOAT : FieldType.STRING)
                .comparator(ComparatorConfig.equalTo(JsonValues.toJava(expected)))
                .build();
    }

    private static ComparatorConfig parseComparator(JsonNode node, String path)
            throws GraderConfigurationException {
        requireObject(node, path);
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new GraderConfigurationException("Comparator requires a type", path + ".type");
        }
        ComparatorType type;
        try {
            type = ComparatorType.fromValue(typeNode.textValue());
        } catch (IllegalArgumentException e) {
            throw new GraderConfigurationException(e.getMessage(), path + ".type", e);
        }

        JsonNode config = node.get("config");
        if (isAbsent(config)) {
            return new ComparatorConfig(type, Map.of());
        }
        requireObject(config, path + ".config");
        return new ComparatorConfig(type, remainder(config, Set.of()));
    }

    private static GraderType parseGraderType(JsonNode node, String path)
            throws GraderConfigurationException {
        if (node == null || !node.isTextual()) {
            throw new GraderConfigurationException("Grader requires a type", path);
        }
        try {
            return GraderType.fromValue(node.textValue());
        } catch (IllegalArgumentException e) {
            throw new GraderConfigurationException(e.getMessage(), path, e);
        }
    }

    private static FieldType parseFieldType(JsonNode node, String path)
            throws GraderConfigurationException {
        if (isAbsent(node)) {
            return FieldType.STRING;
        }
        if (!node.isTextual()) {
            throw new GraderConfigurationException("type must be a string", path);
        }
        try {
            return FieldType.fromValue(node.textValue());
        } catch (IllegalArgumentException e) {
            throw new GraderConfigurationException(e.getMessage(), path, e);
        }
    }

    /// Reads a weight. Numeric strings such as `"2"` are accepted.
    private static double parseWeight(JsonNode node, String path, double defaultWeight)
            throws GraderConfigurationException {
        if (isAbsent(node)) {
            return defaultWeight;
        }
        double weight;
        if (node.isNumber()) {
            weight = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                weight = Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new GraderConfigurationException("weight must be a number", path, e);
            }
        } else {
            throw new GraderConfigurationException("weight must be a number", path);
        }
        if (!Double.isFinite(weight) || weight < 0) {
            throw new GraderConfigurationException(
                    "weight must be a non-negative number, got " + node.asText(), path);
        }
        return weight;
    }

    private static String optionalText(JsonNode parent, String key, String path)
            throws GraderConfigurationException {
        JsonNode node = parent.get(key);
        if (isAbsent(node)) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return node.asText();
        }
        throw new GraderConfigurationException(key + " must be a string", path + "." + key);
    }

    private static Map<String, Object> remainder(JsonNode node, Set<String> consumed) {
        Map<String, Object> rest = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!consumed.contains(entry.getKey())) {
                rest.put(entry.getKey(), JsonValues.toJava(entry.getValue()));
            }
        }
        return rest;
    }

    private static Set<String> defaultedKeys(JsonNode node) {
        Set<String> keys = new LinkedHashSet<>();
        for (String key : DEFAULTABLE_KEYS) {
            if (isAbsent(node.get(key))) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static boolean acceptsWholeResponse(GraderType type) {
        return type == GraderType.TEXT || type == GraderType.NUMBER;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static boolean isPresent(JsonNode node) {
        return !isAbsent(node);
    }

    private static void requireObject(JsonNode node, String path)
            throws GraderConfigurationException {
        if (node == null || !node.isObject()) {
            throw new GraderConfigurationException("Expected an object", path);
        }
    }

    private static void requireArray(JsonNode node, String path)
            throws GraderConfigurationException {
        if (!node.isArray()) {
            throw new GraderConfigurationException("Expected an array", path);
        }
    }
}
