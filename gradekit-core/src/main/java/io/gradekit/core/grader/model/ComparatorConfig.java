package io.gradekit.core.grader.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Comparator type plus its parameters, as authored in `comparator.config`.
///
/// Settings keep their declaration order and may hold `null` values: `"expected": null`
/// is how an exported template marks a field whose answer has been removed.
///
/// ### Common Settings
/// - `expected` - value the field must equal, contain or approximate
/// - `min` / `max` - inclusive numeric bounds for `range`
/// - `pattern` - regular expression for `regex`
/// - `tolerance`, `type` - allowed deviation for `tolerance` (`absolute` or `percentage`)
/// - `allowed_values` - candidates for `in_list`
/// - `min_length` / `max_length` / `exact_length` - bounds for `length`
///
/// @param type comparator kind, not null
/// @param settings ordered parameters, copied into an unmodifiable view, never null
public record ComparatorConfig(ComparatorType type, Map<String, Object> settings) {

    public static final String EXPECTED = "expected";

    public ComparatorConfig {
        Objects.requireNonNull(type, "Comparator type required");
        settings =
                settings == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    /// Creates an `equals` comparator for the given expectation.
    ///
    /// @param expected expected value, may be null (field then not applicable)
    /// @return new comparator config, never null
    public static ComparatorConfig equalTo(Object expected) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put(EXPECTED, expected);
        return new ComparatorConfig(ComparatorType.EQUALS, settings);
    }

    /// Returns a setting value.
    ///
    /// @param key setting name, not null
    /// @return the value, or null if absent or explicitly null
    public Object get(String key) {
        return settings.get(key);
    }

    /// Checks whether a setting is present with a non-null value.
    public boolean has(String key) {
        return settings.get(key) != null;
    }

    public Object getExpected() {
        return settings.get(EXPECTED);
    }

    /// Returns a setting as a number. Numeric strings are accepted.
    ///
    /// @param key setting name, not null
    /// @return the numeric value, or empty if absent, null or not numeric
    public Optional<Double> getNumber(String key) {
        Object value = settings.get(key);
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /// Returns a setting as a string, if it is one.
    public Optional<String> getString(String key) {
        return settings.get(key) instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /// Returns a copy with one setting replaced.
    ///
    /// An existing key keeps its position; a new key is appended.
    ///
    /// @param key setting name, not null
    /// @param value new value, may be null
    /// @return new comparator config, never null
    public ComparatorConfig with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(settings);
        copy.put(key, value);
        return new ComparatorConfig(type, copy);
    }
}
