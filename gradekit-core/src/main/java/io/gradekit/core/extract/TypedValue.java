package io.gradekit.core.extract;

import io.gradekit.core.grader.model.FieldType;
import java.util.Objects;

/// A field value after successful coercion.
///
/// @param type declared field type, not null
/// @param value coerced value: `Long` for int, `Double` for float, `Boolean` for boolean,
///              `String` for string; never null
/// @param text the extracted text with surrounding whitespace removed, never null
public record TypedValue(FieldType type, Object value, String text) {

    public TypedValue {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public boolean isNumeric() {
        return value instanceof Number;
    }
}
