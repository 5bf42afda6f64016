package io.gradekit.serialization.validation;

import java.util.Objects;

/// One finding in a task definition document.
///
/// @param severity how serious the finding is, not null
/// @param path location such as `tasks[0].graders[1].config.structure[2].weight`, not null
/// @param message human-readable description, not null
public record ValidationIssue(Severity severity, String path, String message) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + path + ": " + message;
    }
}
