package io.gradekit.cli.ui;

import io.gradekit.serialization.validation.Severity;

/// ANSI text styling for CLI output with semantic color methods.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);  // color enabled
/// System.out.println(styles.success("[OK]") + " Task file is valid");
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
///
/// @see #of(boolean) factory method for creating instances
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// Creates an AnsiStyles instance with specified color preference.
    ///
    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String dim(String text) {
        return style(text, DIM);
    }

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Renders a validation severity as a fixed-width, colored tag such as `[ERROR]   `.
    ///
    /// @param severity issue severity, not null
    /// @return styled tag, never null
    public String severity(Severity severity) {
        String tag = String.format("%-10s", "[" + severity + "]");
        return switch (severity) {
            case CRITICAL -> style(tag, BOLD + RED);
            case ERROR -> error(tag);
            case WARNING -> warn(tag);
            case INFO -> dim(tag);
        };
    }
}
