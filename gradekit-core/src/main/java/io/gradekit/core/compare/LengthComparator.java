package io.gradekit.core.compare;

import io.gradekit.core.extract.TypedValue;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import java.util.Optional;

/// Length bounds on the text form of the value, counted in code points.
///
/// `exact_length` takes precedence over `min_length`/`max_length`. The short keys `exact`,
/// `min` and `max` are accepted as aliases.
public final class LengthComparator implements FieldComparator {

    @Override
    public ComparatorType type() {
        return ComparatorType.LENGTH;
    }

    @Override
    public boolean isApplicable(ComparatorConfig config) {
        return bound(config, "exact_length", "exact").isPresent()
                || bound(config, "min_length", "min").isPresent()
                || bound(config, "max_length", "max").isPresent();
    }

    @Override
    public boolean matches(ComparatorConfig config, TypedValue actual) {
        String text = actual.text();
        int length = text.codePointCount(0, text.length());

        Optional<Double> exact = bound(config, "exact_length", "exact");
        if (exact.isPresent()) {
            return length == exact.get();
        }
        Optional<Double> min = bound(config, "min_length", "min");
        Optional<Double> max = bound(config, "max_length", "max");
        return (min.isEmpty() || length >= min.get()) && (max.isEmpty() || length <= max.get());
    }

    private static Optional<Double> bound(ComparatorConfig config, String key, String alias) {
        Optional<Double> value = config.getNumber(key);
        return value.isPresent() ? value : config.getNumber(alias);
    }
}
