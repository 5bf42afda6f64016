package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gradekit.core.GradingConfig;
import io.gradekit.core.grader.GraderConfigurationException;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.task.TaskDefinition;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Loads grader configuration JSON into the domain model.
///
/// ### Accepted documents for {@link #readGraders}
/// - a grader array: `[{"type": "xml", ...}, ...]`
/// - a single grader object: `{"type": "xml", ...}`
/// - a task document holding exactly one task: `{"tasks": [{"graders": [...]}]}`
///
/// ### Contracts
/// - **Errors**: every structural problem raises {@link GraderConfigurationException} naming
///   the JSON path of the offending element; text that is not JSON is reported at path `$`
/// - **Order**: graders and fields keep their document order
///
/// @implNote Thread-safe. The reader holds no mutable state.
public final class GraderConfigReader {

    private static final Logger logger = Logger.getLogger(GraderConfigReader.class.getName());

    private final ObjectMapper mapper;
    private final GraderConfigParser parser;

    public GraderConfigReader() {
        this(new GradingConfig());
    }

    /// @param config supplies the weight given to graders that declare none, not null
    public GraderConfigReader(GradingConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.mapper = new ObjectMapper();
        this.parser = new GraderConfigParser(config.getDefaultGraderWeight());
    }

    /// Reads the graders of one task.
    ///
    /// @param json grader array, single grader or single-task document, not null
    /// @return graders in document order, never null
    /// @throws GraderConfigurationException if the document is malformed
    public List<GraderConfig> readGraders(String json) throws GraderConfigurationException {
        JsonNode root = parse(json);
        List<GraderConfig> graders;
        if (root.isArray()) {
            graders = parser.parseGraders(root, "graders");
        } else if (root.isObject() && root.has("tasks")) {
            List<TaskDefinition> tasks = parser.parseTasks(root, "$");
            if (tasks.size() != 1) {
                throw new GraderConfigurationException(
                        "Expected exactly one task but found " + tasks.size(), "$.tasks");
            }
            graders = tasks.get(0).graders();
        } else if (root.isObject()) {
            graders = List.of(parser.parseGrader(root, "grader"));
        } else {
            throw new GraderConfigurationException(
                    "Expected a grader array, a grader object or a task document", "$");
        }
        logger.info("Loaded " + graders.size() + " grader(s)");
        return graders;
    }

    /// Reads a bulk task document `{"tasks": [...]}`.
    ///
    /// @param json task document, not null
    /// @return tasks in document order, never null
    /// @throws GraderConfigurationException if the document is malformed
    public List<TaskDefinition> readTasks(String json) throws GraderConfigurationException {
        List<TaskDefinition> tasks = parser.parseTasks(parse(json), "$");
        logger.info("Loaded " + tasks.size() + " task(s)");
        return tasks;
    }

    private JsonNode parse(String json) throws GraderConfigurationException {
        Objects.requireNonNull(json, "json must not be null");
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || root.isMissingNode()) {
                throw new GraderConfigurationException("Document is empty", "$");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new GraderConfigurationException(
                    "Invalid JSON: " + e.getOriginalMessage(), "$", e);
        }
    }
}
