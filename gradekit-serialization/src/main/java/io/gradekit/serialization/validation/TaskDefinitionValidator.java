package io.gradekit.serialization.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Lints an uploaded `{"tasks": [...]}` document before import.
///
/// Unlike {@link io.gradekit.serialization.GraderConfigReader}, which stops at the first
/// structural error, the validator walks the whole document and collects every finding with
/// a severity and a path, so an author can fix a bulk upload in one pass.
///
/// ### Checked elements
/// - Tasks: `name`, `prompt` and a non-empty `graders` array
/// - Graders: `type`, `name`, `config` and a non-negative numeric `weight`
/// - `xml`/`json` structure items: `id`, `name`, `type`, `weight`, `comparator`, plus nested
///   `children`
/// - `unit_test` test cases: `id`, `expected_value`, optional `type`, `weight`, `comparator`
/// - `text`/`number` graders: `config.expected` or a field list
/// - Comparator parameters per comparator type, against the field's declared type
///
/// A `null` expectation is reported as `INFO`: that is how exported templates look.
///
/// @implNote Thread-safe. Each call collects issues into its own list.
public final class TaskDefinitionValidator {

    private static final Logger logger =
            Logger.getLogger(TaskDefinitionValidator.class.getName());

    private static final Set<String> GRADER_TYPES =
            Set.of("xml", "json", "text", "number", "unit_test");
    private static final Set<String> FIELD_TYPES =
            Set.of("int", "float", "string", "bool", "boolean");
    private static final Set<String> COMPARATOR_TYPES =
            Set.of("equals", "tolerance", "range", "contains", "regex", "in_list", "length");
    private static final Set<String> TOLERANCE_TYPES = Set.of("absolute", "percentage");
    private static final List<String> LENGTH_KEYS =
            List.of("min_length", "min", "max_length", "max", "exact_length", "exact");

    private final ObjectMapper mapper = new ObjectMapper();
    private final boolean strict;

    public TaskDefinitionValidator() {
        this(false);
    }

    /// @param strict whether warnings make a report invalid
    public TaskDefinitionValidator(boolean strict) {
        this.strict = strict;
    }

    /// Validates a task document given as text.
    ///
    /// @param json document text, not null
    /// @return report, never null; text that is not JSON yields one critical issue
    public ValidationReport validate(String json) {
        Objects.requireNonNull(json, "json must not be null");
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            List<ValidationIssue> issues =
                    List.of(
                            new ValidationIssue(
                                    Severity.CRITICAL,
                                    "root",
                                    "Invalid JSON: " + e.getOriginalMessage()));
            return new ValidationReport(issues, 0, 0, strict);
        }
        return validate(root);
    }

    /// Validates a parsed task document.
    ///
    /// @param root document root, may be null
    /// @return report, never null
    public ValidationReport validate(JsonNode root) {
        Issues issues = new Issues();
        int taskCount = 0;
        int graderCount = 0;

        if (root == null || !root.isObject()) {
            issues.critical("root", "Root must be an object");
        } else if (!root.has("tasks")) {
            issues.critical("root", "Missing required field: tasks");
        } else if (!root.get("tasks").isArray()) {
            issues.critical("root", "Field \"tasks\" must be an array");
        } else {
            JsonNode tasks = root.get("tasks");
            taskCount = tasks.size();
            if (taskCount == 0) {
                issues.warning("root.tasks", "Document contains no tasks");
            }
            for (int i = 0; i < tasks.size(); i++) {
                JsonNode task = tasks.get(i);
                validateTask(issues, task, "tasks[" + i + "]");
                if (task.has("graders") && task.get("graders").isArray()) {
                    graderCount += task.get("graders").size();
                }
            }
        }

        ValidationReport report = new ValidationReport(issues.list, taskCount, graderCount, strict);
        logger.info("Validated task document: " + report);
        return report;
    }

    // ---------------------------------------------------------------- tasks

    private static void validateTask(Issues issues, JsonNode task, String path) {
        if (!task.isObject()) {
            issues.critical(path, "Task must be an object");
            return;
        }
        requireNonEmptyText(issues, task, "name", path);
        requireNonEmptyText(issues, task, "prompt", path);
        if (task.has("description") && !task.get("description").isTextual()) {
            issues.error(path + ".description", "Field \"description\" must be a string");
        }

        if (!task.has("graders")) {
            issues.critical(path, "Missing required field: graders");
            return;
        }
        JsonNode graders = task.get("graders");
        if (!graders.isArray()) {
            issues.critical(path + ".graders", "Field \"graders\" must be an array");
            return;
        }
        if (graders.isEmpty()) {
            issues.error(path + ".graders", "Field \"graders\" must be non-empty array");
            return;
        }
        for (int i = 0; i < graders.size(); i++) {
            validateGrader(issues, graders.get(i), path + ".graders[" + i + "]");
        }
    }

    private static void requireNonEmptyText(
            Issues issues, JsonNode parent, String key, String path) {
        if (!parent.has(key)) {
            issues.critical(path, "Missing required field: " + key);
        } else if (!parent.get(key).isTextual() || parent.get(key).textValue().isBlank()) {
            issues.error(path + "." + key, "Field \"" + key + "\" must be non-empty string");
        }
    }

    // ---------------------------------------------------------------- graders

    private static void validateGrader(Issues issues, JsonNode grader, String path) {
        if (!grader.isObject()) {
            issues.critical(path, "Grader must be an object");
            return;
        }
        if (!grader.has("type")) {
            issues.critical(path, "Missing required field: type");
            return;
        }
        String type = grader.get("type").asText();
        if (!grader.get("type").isTextual() || !GRADER_TYPES.contains(type)) {
            issues.error(
                    path + ".type",
                    "Invalid grader type \""
                            + type
                            + "\". Must be one of: "
                            + sorted(GRADER_TYPES));
            return;
        }

        if (!grader.has("name")) {
            issues.critical(path, "Missing required field: name");
        } else if (!grader.get("name").isTextual()) {
            issues.error(path + ".name", "Field \"name\" must be a string");
        }

        if (!grader.has("config")) {
            issues.critical(path, "Missing required field: config");
            return;
        }
        JsonNode config = grader.get("config");
        if (!config.isObject()) {
            issues.critical(path + ".config", "Field \"config\" must be an object");
            return;
        }

        validateWeight(issues, grader, path, true);

        String configPath = path + ".config";
        if (config.has("structure") && config.has("test_cases")) {
            issues.error(
                    configPath, "Fields \"structure\" and \"test_cases\" are mutually exclusive");
        }
        switch (type) {
            case "xml", "json" -> validateStructureGrader(issues, config, configPath);
            case "unit_test" -> validateUnitTestGrader(issues, config, configPath);
            default -> validateWholeResponseGrader(issues, config, configPath, type);
        }
    }

    private static void validateStructureGrader(Issues issues, JsonNode config, String path) {
        if (!config.has("structure")) {
            issues.critical(path, "Missing required field: structure");
            return;
        }
        if (!validateFieldList(issues, config.get("structure"), path + ".structure")) {
            return;
        }

        if (!config.has("binary_mode")) {
            issues.warning(path, "Missing recommended field: binary_mode (will default to false)");
        } else if (!config.get("binary_mode").isBoolean()) {
            issues.error(path + ".binary_mode", "Field \"binary_mode\" must be a boolean");
        }

        validateStructureItems(issues, config.get("structure"), path + ".structure");
    }

    private static void validateUnitTestGrader(Issues issues, JsonNode config, String path) {
        if (!config.has("test_cases")) {
            issues.critical(path, "Missing required field: test_cases");
            return;
        }
        JsonNode cases = config.get("test_cases");
        if (!validateFieldList(issues, cases, path + ".test_cases")) {
            return;
        }
        for (int i = 0; i < cases.size(); i++) {
            validateTestCase(issues, cases.get(i), path + ".test_cases[" + i + "]");
        }
    }

    private static void validateWholeResponseGrader(
            Issues issues, JsonNode config, String path, String type) {
        if (config.has("structure")) {
            if (validateFieldList(issues, config.get("structure"), path + ".structure")) {
                validateStructureItems(issues, config.get("structure"), path + ".structure");
            }
            return;
        }
        if (config.has("test_cases")) {
            validateUnitTestGrader(issues, config, path);
            return;
        }
        if (!config.has("expected")) {
            issues.error(path, "Missing required field: expected (or structure)");
            return;
        }
        JsonNode expected = config.get("expected");
        if (expected.isNull()) {
            issues.info(path + ".expected", "Expected value is null; grader will not be scored");
        } else if ("number".equals(type) && !isNumeric(expected)) {
            issues.error(
                    path + ".expected",
                    "Field \"expected\" must be a number, got " + describe(expected));
        }
    }

    /// @return true if the list is an array with at least one element
    private static boolean validateFieldList(Issues issues, JsonNode list, String path) {
        String key = path.substring(path.lastIndexOf('.') + 1);
        if (!list.isArray()) {
            issues.critical(path, "Field \"" + key + "\" must be an array");
            return false;
        }
        if (list.isEmpty()) {
            issues.error(path, "Field \"" + key + "\" must be non-empty array");
            return false;
        }
        return true;
    }

    // ---------------------------------------------------------------- fields

    private static void validateStructureItems(Issues issues, JsonNode items, String path) {
        for (int i = 0; i < items.size(); i++) {
            validateStructureItem(issues, items.get(i), path + "[" + i + "]");
        }
    }

    private static void validateStructureItem(Issues issues, JsonNode item, String path) {
        if (!item.isObject()) {
            issues.critical(path, "Structure item must be an object");
            return;
        }

        for (String key : List.of("id", "name")) {
            if (!item.has(key)) {
                issues.critical(path, "Missing required field: " + key);
            } else if (!item.get(key).isTextual()) {
                issues.error(path + "." + key, "Field \"" + key + "\" must be a string");
            }
        }

        String itemType = null;
        if (!item.has("type")) {
            issues.critical(path, "Missing required field: type");
        } else {
            itemType = fieldType(issues, item.get("type"), path + ".type");
        }

        if (!item.has("children")) {
            issues.warning(path, "Missing recommended field: children (will default to [])");
        } else if (!item.get("children").isArray()) {
            issues.error(path + ".children", "Field \"children\" must be an array");
        } else {
            validateStructureItems(issues, item.get("children"), path + ".children");
        }

        if (!item.has("isExpanded")) {
            issues.info(path, "Missing optional field: isExpanded");
        } else if (!item.get("isExpanded").isBoolean()) {
            issues.error(path + ".isExpanded", "Field \"isExpanded\" must be a boolean");
        }

        validateWeight(issues, item, path, true);

        if (!item.has("comparator")) {
            issues.error(path, "Missing required field: comparator");
        } else if (itemType != null) {
            validateComparator(issues, item.get("comparator"), itemType, path + ".comparator");
        }
    }

    private static void validateTestCase(Issues issues, JsonNode testCase, String path) {
        if (!testCase.isObject()) {
            issues.critical(path, "Test case must be an object");
            return;
        }
        if (!testCase.has("id")) {
            issues.critical(path, "Missing required field: id");
        } else if (!testCase.get("id").isTextual() && !testCase.get("id").isNumber()) {
            issues.error(path + ".id", "Field \"id\" must be a string");
        }

        if (!testCase.has("expected_value")) {
            issues.error(path, "Missing required field: expected_value");
        } else if (testCase.get("expected_value").isNull()) {
            issues.info(
                    path + ".expected_value",
                    "Expected value is null; test case will not be scored");
        }

        String itemType = "string";
        if (testCase.has("type")) {
            itemType = fieldType(issues, testCase.get("type"), path + ".type");
        }
        validateWeight(issues, testCase, path, false);

        if (testCase.has("comparator") && itemType != null) {
            validateComparator(
                    issues, withImpliedExpected(testCase), itemType, path + ".comparator");
        }
    }

    /// A test case comparator without `expected` compares against `expected_value`.
    private static JsonNode withImpliedExpected(JsonNode testCase) {
        JsonNode comparator = testCase.get("comparator");
        JsonNode config = comparator.get("config");
        if (config == null
                || !config.isObject()
                || config.has("expected")
                || !testCase.has("expected_value")) {
            return comparator;
        }
        ObjectNode merged = ((ObjectNode) comparator).deepCopy();
        ((ObjectNode) merged.get("config")).set("expected", testCase.get("expected_value"));
        return merged;
    }

    /// @return the normalized field type, or null if it is invalid
    private static String fieldType(Issues issues, JsonNode node, String path) {
        String type = node.asText();
        if (!node.isTextual() || !FIELD_TYPES.contains(type)) {
            issues.error(
                    path,
                    "Invalid type \"" + type + "\". Must be one of: " + sorted(FIELD_TYPES));
            return null;
        }
        return "bool".equals(type) ? "boolean" : type;
    }

    private static void validateWeight(
            Issues issues, JsonNode parent, String path, boolean required) {
        if (!parent.has("weight")) {
            if (required) {
                issues.error(path, "Missing required field: weight");
            }
            return;
        }
        JsonNode weight = parent.get("weight");
        if (weight.isTextual()) {
            issues.error(
                    path + ".weight",
                    "Field \"weight\" is string \"" + weight.textValue() + "\", should be number");
        } else if (!weight.isNumber()) {
            issues.error(
                    path + ".weight", "Field \"weight\" must be a number, got " + describe(weight));
        } else if (weight.doubleValue() < 0) {
            issues.error(path + ".weight", "Field \"weight\" must not be negative");
        }
    }

    // ---------------------------------------------------------------- comparators

    private static void validateComparator(
            Issues issues, JsonNode comparator, String itemType, String path) {
        if (!comparator.isObject()) {
            issues.error(path, "Field \"comparator\" must be an object");
            return;
        }
        if (!comparator.has("type")) {
            issues.error(path, "Missing required field: type");
            return;
        }
        String type = comparator.get("type").asText();
        if (!COMPARATOR_TYPES.contains(type)) {
            issues.error(
                    path + ".type",
                    "Invalid comparator type \""
                            + type
                            + "\". Must be one of: "
                            + sorted(COMPARATOR_TYPES));
            return;
        }
        if (!comparator.has("config")) {
            issues.error(path, "Missing required field: config");
            return;
        }
        JsonNode config = comparator.get("config");
        if (!config.isObject()) {
            issues.error(path + ".config", "Field \"config\" must be an object");
            return;
        }

        String configPath = path + ".config";
        switch (type) {
            case "equals" -> validateEquals(issues, config, itemType, configPath);
            case "tolerance" -> validateTolerance(issues, config, configPath);
            case "range" -> validateRange(issues, config, configPath);
            case "contains" -> validateContains(issues, config, configPath);
            case "regex" -> validateRegex(issues, config, configPath);
            case "in_list" -> validateInList(issues, config, configPath);
            case "length" -> validateLength(issues, config, configPath);
            default -> throw new IllegalStateException("Unhandled comparator type: " + type);
        }
    }

    private static void validateEquals(
            Issues issues, JsonNode config, String itemType, String path) {
        if (!config.has("expected")) {
            issues.error(path, "Missing required field: expected");
            return;
        }
        JsonNode expected = config.get("expected");
        if (expected.isNull()) {
            issues.info(path + ".expected", "Expected value is null; field will not be scored");
            return;
        }
        boolean matches =
                switch (itemType) {
                    case "int" -> isWholeNumber(expected);
                    case "float" -> expected.isNumber();
                    case "boolean" -> expected.isBoolean();
                    default -> expected.isTextual();
                };
        if (!matches) {
            issues.error(
                    path + ".expected",
                    "Item type is \""
                            + itemType
                            + "\" but expected is "
                            + describe(expected)
                            + ". Must be "
                            + expectedKind(itemType)
                            + ".");
        }
    }

    private static void validateTolerance(Issues issues, JsonNode config, String path) {
        if (!config.has("expected")) {
            issues.error(path, "Missing required field: expected");
        } else if (config.get("expected").isNull()) {
            issues.info(path + ".expected", "Expected value is null; field will not be scored");
        } else if (!config.get("expected").isNumber()) {
            issues.error(
                    path + ".expected",
                    "Field \"expected\" must be a number, got " + describe(config.get("expected")));
        }

        requireNumber(issues, config, "tolerance", path);

        if (!config.has("type")) {
            issues.error(path, "Missing required field: type");
        } else if (!TOLERANCE_TYPES.contains(config.get("type").asText())) {
            issues.error(
                    path + ".type",
                    "Field \"type\" must be \"absolute\" or \"percentage\", got \""
                            + config.get("type").asText()
                            + "\"");
        }
    }

    private static void validateRange(Issues issues, JsonNode config, String path) {
        requireNumber(issues, config, "min", path);
        requireNumber(issues, config, "max", path);
    }

    private static void validateContains(Issues issues, JsonNode config, String path) {
        boolean hasSubstring = config.has("substring");
        if (!hasSubstring && !config.has("expected")) {
            issues.error(path, "Missing required field: substring (or expected)");
        }
        if (hasSubstring && !config.get("substring").isTextual()) {
            issues.error(
                    path + ".substring",
                    "Field \"substring\" must be a string, got "
                            + describe(config.get("substring")));
        }
        if (config.has("case_sensitive") && !config.get("case_sensitive").isBoolean()) {
            issues.error(path + ".case_sensitive", "Field \"case_sensitive\" must be a boolean");
        }
    }

    private static void validateRegex(Issues issues, JsonNode config, String path) {
        JsonNode pattern = config.has("pattern") ? config.get("pattern") : config.get("expected");
        if (pattern == null) {
            issues.error(path, "Missing required field: pattern (or expected)");
            return;
        }
        if (!pattern.isTextual()) {
            issues.error(
                    path + ".pattern",
                    "Field \"pattern\" must be a string, got " + describe(pattern));
            return;
        }
        try {
            Pattern.compile(pattern.textValue());
        } catch (PatternSyntaxException e) {
            issues.error(path + ".pattern", "Invalid regex pattern: " + e.getDescription());
        }
    }

    private static void validateInList(Issues issues, JsonNode config, String path) {
        if (!config.has("allowed_values")) {
            issues.error(path, "Missing required field: allowed_values");
        } else if (!config.get("allowed_values").isArray()) {
            issues.error(path + ".allowed_values", "Field \"allowed_values\" must be an array");
        } else if (config.get("allowed_values").isEmpty()) {
            issues.error(
                    path + ".allowed_values", "Field \"allowed_values\" must be non-empty array");
        }
    }

    private static void validateLength(Issues issues, JsonNode config, String path) {
        if (LENGTH_KEYS.stream().noneMatch(config::has)) {
            issues.error(path, "Must have at least one of: min_length, max_length, exact_length");
            return;
        }
        for (String key : LENGTH_KEYS) {
            if (config.has(key) && !isWholeNumber(config.get(key))) {
                issues.error(
                        path + "." + key,
                        "Field \""
                                + key
                                + "\" must be an integer, got "
                                + describe(config.get(key)));
            }
        }
    }

    private static void requireNumber(Issues issues, JsonNode config, String key, String path) {
        if (!config.has(key)) {
            issues.error(path, "Missing required field: " + key);
        } else if (config.get(key).isTextual()) {
            issues.error(
                    path + "." + key,
                    "Field \"" + key + "\" is string \"" + config.get(key).textValue()
                            + "\", should be number");
        } else if (!config.get(key).isNumber()) {
            issues.error(
                    path + "." + key,
                    "Field \"" + key + "\" must be a number, got " + describe(config.get(key)));
        }
    }

    // ---------------------------------------------------------------- helpers

    private static boolean isNumeric(JsonNode node) {
        if (node.isNumber()) {
            return true;
        }
        if (node.isTextual()) {
            try {
                Double.parseDouble(node.textValue().trim());
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    private static boolean isWholeNumber(JsonNode node) {
        return node.isNumber() && node.doubleValue() == Math.rint(node.doubleValue());
    }

    private static String expectedKind(String itemType) {
        return switch (itemType) {
            case "int" -> "integer number";
            case "float" -> "number";
            default -> itemType;
        };
    }

    private static String describe(JsonNode node) {
        return switch (node.getNodeType()) {
            case STRING -> "string";
            case NUMBER -> "number";
            case BOOLEAN -> "boolean";
            case ARRAY -> "array";
            case OBJECT, POJO -> "object";
            case NULL, MISSING -> "null";
            default -> node.getNodeType().name().toLowerCase(Locale.ROOT);
        };
    }

    private static String sorted(Set<String> values) {
        return String.join(", ", values.stream().sorted().toList());
    }

    private static final class Issues {
        private final List<ValidationIssue> list = new ArrayList<>();

        void critical(String path, String message) {
            list.add(new ValidationIssue(Severity.CRITICAL, path, message));
        }

        void error(String path, String message) {
            list.add(new ValidationIssue(Severity.ERROR, path, message));
        }

        void warning(String path, String message) {
            list.add(new ValidationIssue(Severity.WARNING, path, message));
        }

        void info(String path, String message) {
            list.add(new ValidationIssue(Severity.INFO, path, message));
        }
    }
}
