package io.gradekit.core.task;

import io.gradekit.core.grader.model.GraderConfig;
import java.util.List;
import java.util.Objects;

/// A task as exchanged in bulk upload and export documents.
///
/// @param name task title, not null
/// @param description task description, may be null
/// @param prompt prompt shown to labelers, may be null
/// @param graders grader definitions in order, copied, never null
public record TaskDefinition(
        String name, String description, String prompt, List<GraderConfig> graders) {

    public TaskDefinition {
        Objects.requireNonNull(name, "name must not be null");
        graders = graders == null ? List.of() : List.copyOf(graders);
    }

    /// Returns a copy with the graders replaced.
    ///
    /// @param replacement new graders, not null
    /// @return new task definition, never null
    public TaskDefinition withGraders(List<GraderConfig> replacement) {
        return new TaskDefinition(name, description, prompt, replacement);
    }
}
