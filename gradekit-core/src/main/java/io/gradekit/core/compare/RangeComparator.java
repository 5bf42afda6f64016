package io.gradekit.core.compare;

import io.gradekit.core.extract.TypedValue;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import java.util.Optional;

/// Inclusive numeric bounds: `min <= actual <= max`.
///
/// A missing bound is unbounded, so a comparator with only `min` acts as a lower limit.
/// Non-numeric values never match.
public final class RangeComparator implements FieldComparator {

    static final String MIN = "min";
    static final String MAX = "max";

    @Override
    public ComparatorType type() {
        return ComparatorType.RANGE;
    }

    @Override
    public boolean isApplicable(ComparatorConfig config) {
        return config.getNumber(MIN).isPresent() || config.getNumber(MAX).isPresent();
    }

    @Override
    public boolean matches(ComparatorConfig config, TypedValue actual) {
        Optional<Double> value = Numbers.of(actual);
        if (value.isEmpty()) {
            return false;
        }
        double v = value.get();
        Optional<Double> min = config.getNumber(MIN);
        Optional<Double> max = config.getNumber(MAX);
        return (min.isEmpty() || v >= min.get()) && (max.isEmpty() || v <= max.get());
    }
}
