package io.gradekit.core.compare;

import io.gradekit.core.extract.TypedValue;
import io.gradekit.core.extract.TypedValues;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import java.util.Optional;

/// Strict equality after coercing `expected` into the field's declared type.
///
/// Numeric equality is exact. `"5"` equals `5` on an `int` field, `"5.10"` equals `5.1` on a
/// `float` field, and `"Yes"` equals `true` on a `boolean` field.
public final class EqualsComparator implements FieldComparator {

    @Override
    public ComparatorType type() {
        return ComparatorType.EQUALS;
    }

    @Override
    public boolean isApplicable(ComparatorConfig config) {
        return config.has(ComparatorConfig.EXPECTED);
    }

    @Override
    public boolean matches(ComparatorConfig config, TypedValue actual) {
        return equalsExpected(config.getExpected(), actual);
    }

    static boolean equalsExpected(Object expected, TypedValue actual) {
        Optional<Object> coerced = TypedValues.coerceExpected(expected, actual.type());
        return coerced.isPresent() && TypedValues.valuesEqual(coerced.get(), actual.value());
    }
}
