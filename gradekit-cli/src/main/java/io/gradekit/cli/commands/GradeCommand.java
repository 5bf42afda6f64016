package io.gradekit.cli.commands;

import io.gradekit.cli.ui.AnsiStyles;
import io.gradekit.core.GradeKitFactory;
import io.gradekit.core.GradingEngine;
import io.gradekit.core.grader.GraderConfigurationException;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.result.EvaluationResult;
import io.gradekit.core.response.ResponseComposer;
import io.gradekit.core.response.ResponsePayload;
import io.gradekit.core.response.ResponsePayload.FormResponse;
import io.gradekit.core.task.TaskDefinition;
import io.gradekit.serialization.GradeKitSerializer;
import io.gradekit.serialization.GraderConfigReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import picocli.CommandLine;

/// Scores one response against a task's graders and prints the result as JSON.
///
/// The grader file may be a grader array, a single grader object or a task document. A task
/// document with several tasks needs `--task` to pick one.
///
/// ### Output
/// - stdout: the evaluation result JSON
/// - stderr: a one-line score summary and a warning for unanswered form fields
@CommandLine.Command(name = "grade", description = "Score a response against graders")
class GradeCommand extends GradeKitCommand {

    @CommandLine.Parameters(index = "0", description = "Grader or task definition file (JSON)")
    Path gradersFile;

    @CommandLine.ArgGroup(multiplicity = "1")
    ResponseSource source;

    @CommandLine.Option(names = "--task", description = "Task name in a multi-task document")
    String taskName;

    static class ResponseSource {
        @CommandLine.Option(names = "--response", description = "File with the raw response")
        Path responseFile;

        @CommandLine.Option(names = "--text", description = "Raw response given inline")
        String text;

        @CommandLine.Option(names = "--form", description = "JSON object of form answers")
        Path formFile;
    }

    @Override
    protected int execute() throws IOException {
        AnsiStyles styles = styles();
        List<GraderConfig> graders;
        try {
            graders = loadGraders(readFile(gradersFile));
        } catch (GraderConfigurationException e) {
            fail("Invalid grader configuration: " + e.getMessage());
            return EXIT_ERROR;
        }

        ResponsePayload response = readResponse();
        if (response instanceof FormResponse form) {
            List<String> unanswered = ResponseComposer.findUnanswered(form, graders);
            if (!unanswered.isEmpty()) {
                System.err.println(
                        styles.warn(" [WARN] ")
                                + "Unanswered fields: "
                                + String.join(", ", unanswered));
            }
        }

        GradingEngine engine = GradeKitFactory.createEngine(gradingConfig(), codec());
        EvaluationResult result;
        try {
            result = engine.evaluateResponse(response, graders);
        } catch (GraderConfigurationException e) {
            fail("Invalid grader configuration: " + e.getMessage());
            return EXIT_ERROR;
        }

        System.out.println(GradeKitSerializer.toJson(result));
        String summary =
                String.format(
                        Locale.ROOT,
                        "Score: %.2f / %.2f (%.2f%%)",
                        result.getTotalScore(),
                        result.getMaxScore(),
                        result.getPercentageScore());
        System.err.println(
                (result.isPassed() ? styles.success(" [PASS] ") : styles.warn(" [PARTIAL] "))
                        + summary);
        return EXIT_OK;
    }

    private List<GraderConfig> loadGraders(String json) throws GraderConfigurationException {
        GraderConfigReader reader = new GraderConfigReader(gradingConfig());
        if (taskName == null) {
            return reader.readGraders(json);
        }
        for (TaskDefinition task : reader.readTasks(json)) {
            if (task.name().equals(taskName)) {
                return task.graders();
            }
        }
        throw new GraderConfigurationException("No task named '" + taskName + "'", "$.tasks");
    }

    private ResponsePayload readResponse() throws IOException {
        if (source.formFile != null) {
            return readForm(source.formFile);
        }
        if (source.responseFile != null) {
            return ResponsePayload.text(readFile(source.responseFile));
        }
        return ResponsePayload.text(source.text);
    }
}
