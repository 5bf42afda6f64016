package io.gradekit.core.grader;

import java.io.Serial;

/// Thrown when a grader definition cannot be evaluated or loaded.
///
/// This signals an authoring error, never a scoring outcome: a malformed response is
/// always graded, while a malformed grader is rejected.
public class GraderConfigurationException extends Exception {

    @Serial private static final long serialVersionUID = -2817745306630183525L;

    private final String path;

    public GraderConfigurationException(String message) {
        this(message, null, null);
    }

    /// @param message what is wrong, not null
    /// @param path location of the offending element (e.g. `graders[1].config.structure`),
    ///        may be null
    public GraderConfigurationException(String message, String path) {
        this(message, path, null);
    }

    public GraderConfigurationException(String message, String path, Throwable cause) {
        super(path != null ? path + ": " + message : message, cause);
        this.path = path;
    }

    /// Returns the location of the offending element.
    ///
    /// @return path, or null if not known
    public String getPath() {
        return path;
    }
}
