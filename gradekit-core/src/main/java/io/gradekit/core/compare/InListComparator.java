package io.gradekit.core.compare;

import io.gradekit.core.extract.TypedValue;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import java.util.Collection;

/// Membership in `allowed_values`, each candidate compared with `equals` semantics.
public final class InListComparator implements FieldComparator {

    static final String ALLOWED_VALUES = "allowed_values";

    @Override
    public ComparatorType type() {
        return ComparatorType.IN_LIST;
    }

    @Override
    public boolean isApplicable(ComparatorConfig config) {
        return config.get(ALLOWED_VALUES) instanceof Collection<?> values && !values.isEmpty();
    }

    @Override
    public boolean matches(ComparatorConfig config, TypedValue actual) {
        if (!(config.get(ALLOWED_VALUES) instanceof Collection<?> values)) {
            return false;
        }
        for (Object candidate : values) {
            if (EqualsComparator.equalsExpected(candidate, actual)) {
                return true;
            }
        }
        return false;
    }
}
