package io.gradekit.serialization.validation;

import java.util.List;
import java.util.stream.Collectors;

/// Outcome of validating a task definition document.
///
/// @implNote Immutable and thread-safe.
public final class ValidationReport {

    private final List<ValidationIssue> issues;
    private final int taskCount;
    private final int graderCount;
    private final boolean strict;

    ValidationReport(List<ValidationIssue> issues, int taskCount, int graderCount, boolean strict) {
        this.issues = List.copyOf(issues);
        this.taskCount = taskCount;
        this.graderCount = graderCount;
        this.strict = strict;
    }

    /// Returns every issue in document order.
    ///
    /// @return unmodifiable list, never null
    public List<ValidationIssue> getIssues() {
        return issues;
    }

    public List<ValidationIssue> getIssues(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).collect(Collectors.toList());
    }

    public long count(Severity severity) {
        return issues.stream().filter(i -> i.severity() == severity).count();
    }

    public int getTaskCount() {
        return taskCount;
    }

    public int getGraderCount() {
        return graderCount;
    }

    public boolean isStrict() {
        return strict;
    }

    /// Checks whether the document can be imported.
    ///
    /// @return true if there are no critical issues or errors, and, in strict mode, no
    ///         warnings either
    public boolean isValid() {
        if (count(Severity.CRITICAL) > 0 || count(Severity.ERROR) > 0) {
            return false;
        }
        return !strict || count(Severity.WARNING) == 0;
    }

    @Override
    public String toString() {
        return "ValidationReport{valid="
                + isValid()
                + ", tasks="
                + taskCount
                + ", graders="
                + graderCount
                + ", critical="
                + count(Severity.CRITICAL)
                + ", errors="
                + count(Severity.ERROR)
                + ", warnings="
                + count(Severity.WARNING)
                + "}";
    }
}
