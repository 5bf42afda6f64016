package io.gradekit.core.compare;

import io.gradekit.core.extract.TypedValue;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import java.util.Optional;

/// Approximate numeric equality.
///
/// With `type` `absolute` (the default) the value matches when
/// `|actual - expected| <= tolerance`. With `percentage`, `tolerance` is a percent of
/// `|expected|`. A missing tolerance means exact equality.
public final class ToleranceComparator implements FieldComparator {

    static final String TOLERANCE = "tolerance";
    static final String MODE = "type";
    static final String PERCENTAGE = "percentage";

    @Override
    public ComparatorType type() {
        return ComparatorType.TOLERANCE;
    }

    @Override
    public boolean isApplicable(ComparatorConfig config) {
        return config.has(ComparatorConfig.EXPECTED);
    }

    @Override
    public boolean matches(ComparatorConfig config, TypedValue actual) {
        Optional<Double> expected = config.getNumber(ComparatorConfig.EXPECTED);
        Optional<Double> value = Numbers.of(actual);
        if (expected.isEmpty() || value.isEmpty()) {
            return false;
        }
        double tolerance = Math.abs(config.getNumber(TOLERANCE).orElse(0.0));
        if (config.getString(MODE).filter(PERCENTAGE::equalsIgnoreCase).isPresent()) {
            tolerance = Math.abs(expected.get()) * tolerance / 100.0;
        }
        return Math.abs(value.get() - expected.get()) <= tolerance;
    }
}
