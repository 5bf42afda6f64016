package io.gradekit.cli.commands;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import picocli.CommandLine;

/// Entry point for the `gradekit` command line.
///
/// Option defaults are layered. Values given on the command line win, then
/// `~/.gradekit.properties`, then the `gradekit.properties` bundled on the classpath.
@CommandLine.Command(
        name = "gradekit",
        description = "Score task responses against grader definitions",
        mixinStandardHelpOptions = true,
        version = "gradekit 0.1.0",
        subcommands = {GradeCommand.class, ValidateCommand.class, ExportCommand.class})
public class GradeKitCLI {

    private static final Logger logger = Logger.getLogger(GradeKitCLI.class.getName());

    static final String DEFAULTS_RESOURCE = "/gradekit.properties";
    static final String USER_DEFAULTS_FILE = ".gradekit.properties";

    public static void main(String[] args) {
        configureLogging();
        System.exit(commandLine().execute(args));
    }

    /// Builds the command tree with the layered option defaults installed.
    ///
    /// @return configured command line, never null
    public static CommandLine commandLine() {
        return commandLine(Path.of(System.getProperty("user.home"), USER_DEFAULTS_FILE));
    }

    static CommandLine commandLine(Path userDefaults) {
        return new CommandLine(new GradeKitCLI())
                .setDefaultValueProvider(
                        new CommandLine.PropertiesDefaultProvider(loadDefaults(userDefaults)));
    }

    static Properties loadDefaults(Path userDefaults) {
        Properties properties = new Properties();
        try (InputStream in = GradeKitCLI.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            logger.warning("Could not read bundled defaults: " + e.getMessage());
        }
        if (userDefaults != null && Files.isRegularFile(userDefaults)) {
            try (Reader reader = Files.newBufferedReader(userDefaults, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException e) {
                logger.warning("Could not read " + userDefaults + ": " + e.getMessage());
            }
        }
        return properties;
    }

    private static void configureLogging() {
        try (InputStream in = GradeKitCLI.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not configure logging: " + e.getMessage());
        }
    }
}
