package io.gradekit.cli.commands;

import io.gradekit.core.grader.GraderConfigurationException;
import io.gradekit.core.grader.GraderExports;
import io.gradekit.core.response.ResponsePayload.FormResponse;
import io.gradekit.core.task.TaskDefinition;
import io.gradekit.serialization.GraderConfigReader;
import io.gradekit.serialization.GraderConfigWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

/// Re-exports a task document in canonical form.
///
/// Without `--answers` every expectation is stripped, producing a blank template to hand
/// out. With `--answers` the expectations are replaced by the given form answers, producing
/// an answer key.
@CommandLine.Command(name = "export", description = "Export tasks as a template or answer key")
class ExportCommand extends GradeKitCommand {

    @CommandLine.Parameters(index = "0", description = "Task definition file (JSON)")
    Path tasksFile;

    @CommandLine.Option(names = "--answers", description = "JSON object of answers to fill in")
    Path answersFile;

    @CommandLine.Option(
            names = {"-o", "--output"},
            description = "Write to this file instead of stdout")
    Path outputFile;

    @Override
    protected int execute() throws IOException {
        List<TaskDefinition> tasks;
        try {
            tasks = new GraderConfigReader(gradingConfig()).readTasks(readFile(tasksFile));
        } catch (GraderConfigurationException e) {
            fail("Invalid task definition: " + e.getMessage());
            return EXIT_ERROR;
        }

        FormResponse answers = answersFile != null ? readForm(answersFile) : null;
        List<TaskDefinition> exported = new ArrayList<>(tasks.size());
        for (TaskDefinition task : tasks) {
            exported.add(
                    task.withGraders(
                            answers == null
                                    ? GraderExports.strip(task.graders())
                                    : GraderExports.populate(task.graders(), answers)));
        }

        String json = new GraderConfigWriter().writeTasks(exported);
        if (outputFile == null) {
            System.out.println(json);
        } else {
            Files.writeString(outputFile, json, StandardCharsets.UTF_8);
            System.err.println(
                    styles().success(" [OK] ")
                            + "Exported "
                            + exported.size()
                            + " task(s) to "
                            + outputFile);
        }
        return EXIT_OK;
    }
}
