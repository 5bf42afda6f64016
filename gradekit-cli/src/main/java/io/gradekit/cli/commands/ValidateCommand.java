package io.gradekit.cli.commands;

import io.gradekit.cli.ui.AnsiStyles;
import io.gradekit.serialization.validation.Severity;
import io.gradekit.serialization.validation.TaskDefinitionValidator;
import io.gradekit.serialization.validation.ValidationIssue;
import io.gradekit.serialization.validation.ValidationReport;
import java.io.IOException;
import java.nio.file.Path;
import picocli.CommandLine;

/// Checks a bulk task document before import and lists every issue found.
///
/// Exits with {@link #EXIT_INVALID} when the document has critical issues or errors, or, with
/// `--strict`, warnings.
@CommandLine.Command(name = "validate", description = "Validate a task definition file")
class ValidateCommand extends GradeKitCommand {

    @CommandLine.Parameters(index = "0", description = "Task definition file (JSON)")
    Path tasksFile;

    @CommandLine.Option(names = "--strict", description = "Treat warnings as failures")
    boolean strict;

    @Override
    protected int execute() throws IOException {
        AnsiStyles styles = styles();
        ValidationReport report = new TaskDefinitionValidator(strict).validate(readFile(tasksFile));

        for (ValidationIssue issue : report.getIssues()) {
            System.out.println(
                    " "
                            + styles.severity(issue.severity())
                            + styles.accent(issue.path())
                            + " "
                            + issue.message());
        }
        if (!report.getIssues().isEmpty()) {
            System.out.println();
        }

        System.out.println(
                styles.dim(
                        " Tasks: "
                                + report.getTaskCount()
                                + ", Graders: "
                                + report.getGraderCount()
                                + ", Critical: "
                                + report.count(Severity.CRITICAL)
                                + ", Errors: "
                                + report.count(Severity.ERROR)
                                + ", Warnings: "
                                + report.count(Severity.WARNING)
                                + ", Info: "
                                + report.count(Severity.INFO)));

        if (report.isValid()) {
            System.out.println(styles.success(" [OK] ") + "Task file is valid: " + tasksFile);
            return EXIT_OK;
        }
        System.out.println(styles.error(" [FAIL] ") + "Task file is invalid: " + tasksFile);
        return EXIT_INVALID;
    }
}
