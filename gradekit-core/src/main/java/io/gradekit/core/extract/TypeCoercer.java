package io.gradekit.core.extract;

import io.gradekit.core.extract.ExtractionOutcome.ExtractedValue;
import io.gradekit.core.extract.ExtractionOutcome.ExtractionFailure;
import io.gradekit.core.extract.ExtractionOutcome.FailureKind;
import io.gradekit.core.grader.model.FieldType;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/// Converts extracted text into the declared field type.
///
/// ### Rules
/// - `int` - base-10 integer, optional sign
/// - `float` - decimal or scientific notation; `NaN`, `Infinity`, hex literals and
///   `f`/`d` suffixes are rejected even though `Double.parseDouble` accepts them
/// - `boolean` - `true`/`false`/`1`/`0`/`yes`/`no`, case-insensitive
/// - `string` - always succeeds
///
/// Surrounding whitespace is ignored for every type.
///
/// @implNote Stateless utility class. Safe to call from any thread.
public final class TypeCoercer {

    static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    static final Pattern DECIMAL =
            Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private TypeCoercer() {}

    /// Coerces raw text to the given type.
    ///
    /// @param raw extracted text, not null
    /// @param type declared field type, not null
    /// @return {@link ExtractedValue} on success, {@link ExtractionFailure} with kind
    ///         `COERCION_FAILED` otherwise; never null
    public static ExtractionOutcome coerce(String raw, FieldType type) {
        Objects.requireNonNull(raw, "raw must not be null");
        String text = raw.trim();
        Optional<Object> value = convert(text, type);
        if (value.isPresent()) {
            return new ExtractedValue(raw, new TypedValue(type, value.get(), text));
        }
        return new ExtractionFailure(
                FailureKind.COERCION_FAILED,
                "Cannot read '" + abbreviate(text) + "' as " + type.getValue(),
                raw);
    }

    /// Converts trimmed text to the Java representation of a field type.
    ///
    /// @param text trimmed text, not null
    /// @param type target type, not null
    /// @return converted value, or empty if the text is not valid for the type
    public static Optional<Object> convert(String text, FieldType type) {
        return switch (type) {
            case INT -> parseInteger(text);
            case FLOAT -> parseDecimal(text).map(d -> (Object) d);
            case BOOLEAN -> parseBoolean(text);
            case STRING -> Optional.of(text);
        };
    }

    /// Parses decimal or scientific notation.
    ///
    /// @param text candidate text, not null
    /// @return finite double value, or empty
    public static Optional<Double> parseDecimal(String text) {
        String trimmed = text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        double value = Double.parseDouble(trimmed);
        return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
    }

    private static Optional<Object> parseInteger(String text) {
        if (!INTEGER.matcher(text).matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            // digits only, so this is overflow
            return Optional.empty();
        }
    }

    private static Optional<Object> parseBoolean(String text) {
        switch (text.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes":
                return Optional.of(Boolean.TRUE);
            case "false", "0", "no":
                return Optional.of(Boolean.FALSE);
            default:
                return Optional.empty();
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 37) + "...";
    }
}
