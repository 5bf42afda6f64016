package io.gradekit.core.compare;

import io.gradekit.core.extract.TypeCoercer;
import io.gradekit.core.extract.TypedValue;
import io.gradekit.core.grader.model.FieldType;
import java.util.Optional;

/// Numeric view of a coerced value for the numeric comparators.
final class Numbers {

    private Numbers() {}

    /// Numbers are used as they are; a `string` field is parsed as a decimal. Booleans never
    /// count as numbers.
    static Optional<Double> of(TypedValue actual) {
        if (actual.value() instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (actual.type() == FieldType.STRING) {
            return TypeCoercer.parseDecimal(actual.text());
        }
        return Optional.empty();
    }
}
