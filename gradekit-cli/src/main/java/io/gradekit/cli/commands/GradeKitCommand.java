package io.gradekit.cli.commands;

import io.gradekit.cli.ui.AnsiStyles;
import io.gradekit.core.GradingConfig;
import io.gradekit.core.extract.JsonCodec;
import io.gradekit.core.extract.JsonCodecException;
import io.gradekit.core.response.ResponsePayload;
import io.gradekit.core.response.ResponsePayload.FormResponse;
import io.gradekit.serialization.JacksonJsonCodec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import picocli.CommandLine;

/// Base class for all gradekit subcommands.
///
/// Provides the shared options, file loading and output styling. Subclasses implement
/// {@link #execute()} and return a process exit code.
///
/// ### Exit Codes
/// - {@link #EXIT_OK} - command succeeded
/// - {@link #EXIT_INVALID} - input was read but did not pass (e.g. validation errors)
/// - {@link #EXIT_ERROR} - input could not be read or the grader configuration is broken
///
/// @implNote Subclasses must be package-private and annotated with `@CommandLine.Command`.
abstract class GradeKitCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_ERROR = 2;

    @CommandLine.Option(
            names = "--max-response-bytes",
            description = "Responses larger than this are scored zero (default: ${DEFAULT-VALUE})")
    long maxResponseBytes = GradingConfig.DEFAULT_MAX_RESPONSE_BYTES;

    @CommandLine.Option(
            names = "--default-grader-weight",
            description = "Weight for graders that declare none (default: ${DEFAULT-VALUE})")
    double defaultGraderWeight = 1.0;

    @CommandLine.Option(names = "--no-color", description = "Disable ANSI colors")
    boolean noColor;

    @CommandLine.Option(
            names = {"-v", "--verbose"},
            description = "Log loading and scoring details to stderr")
    boolean verbose;

    private static final Logger rootLogger = Logger.getLogger("io.gradekit");

    private final JsonCodec codec = new JacksonJsonCodec();

    @Override
    public final Integer call() {
        if (verbose) {
            rootLogger.setLevel(Level.FINE);
        }
        try {
            return execute();
        } catch (IOException e) {
            System.err.println(styles().error(" [FAIL] ") + "Cannot read input: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    /// Runs the command.
    ///
    /// @return process exit code
    /// @throws IOException if an input file cannot be read
    protected abstract int execute() throws IOException;

    protected GradingConfig gradingConfig() {
        return GradingConfig.builder()
                .maxResponseBytes(maxResponseBytes)
                .defaultGraderWeight(defaultGraderWeight)
                .build();
    }

    protected JsonCodec codec() {
        return codec;
    }

    protected AnsiStyles styles() {
        return AnsiStyles.of(!noColor && System.console() != null);
    }

    protected String readFile(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("File not found: " + path);
        }
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /// Reads a form response: a JSON object mapping field keys to answers.
    ///
    /// @param path form file, not null
    /// @return form payload, never null
    /// @throws IOException if the file is missing or is not a JSON object
    protected FormResponse readForm(Path path) throws IOException {
        try {
            return ResponsePayload.form(codec.readObject(readFile(path)));
        } catch (JsonCodecException e) {
            throw new IOException(path + " is not a JSON object: " + e.getMessage(), e);
        }
    }

    protected void fail(String message) {
        System.err.println(styles().error(" [FAIL] ") + message);
    }
}
