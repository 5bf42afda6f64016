package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.task.TaskDefinition;
import java.util.List;
import java.util.Map;

/// Writes grader configuration back in its authored shape.
///
/// Output re-imports through {@link GraderConfigReader} into an equal model. This is how
/// stripped templates and answer keys produced by
/// {@link io.gradekit.core.grader.GraderExports} leave the system.
///
/// @implNote Thread-safe after construction.
public final class GraderConfigWriter {

    private final ObjectMapper mapper;

    public GraderConfigWriter() {
        this.mapper = GradeKitSerializer.createMapper();
    }

    /// Writes graders as a JSON array.
    ///
    /// @param graders graders to write, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public String writeGraders(List<GraderConfig> graders) {
        return write(graders, "graders");
    }

    /// Writes tasks as a `{"tasks": [...]}` document.
    ///
    /// @param tasks tasks to write, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public String writeTasks(List<TaskDefinition> tasks) {
        return write(Map.of("tasks", tasks), "tasks");
    }

    private String write(Object value, String what) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize " + what + ": " + e.getMessage(), e);
        }
    }
}
