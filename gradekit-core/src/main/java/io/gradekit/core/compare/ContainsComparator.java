package io.gradekit.core.compare;

import io.gradekit.core.extract.TypedValue;
import io.gradekit.core.extract.TypedValues;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import java.util.Locale;

/// Substring search in the text form of the value.
///
/// The needle is `expected`, or `substring` when `expected` is absent. Matching is
/// case-sensitive unless `case_sensitive` is `false`.
public final class ContainsComparator implements FieldComparator {

    static final String SUBSTRING = "substring";
    static final String CASE_SENSITIVE = "case_sensitive";

    @Override
    public ComparatorType type() {
        return ComparatorType.CONTAINS;
    }

    @Override
    public boolean isApplicable(ComparatorConfig config) {
        return config.has(ComparatorConfig.EXPECTED) || config.has(SUBSTRING);
    }

    @Override
    public boolean matches(ComparatorConfig config, TypedValue actual) {
        Object needle =
                config.has(ComparatorConfig.EXPECTED)
                        ? config.getExpected()
                        : config.get(SUBSTRING);
        String expected = TypedValues.textOf(needle);
        String text = actual.text();
        if (!caseSensitive(config)) {
            expected = expected.toLowerCase(Locale.ROOT);
            text = text.toLowerCase(Locale.ROOT);
        }
        return text.contains(expected);
    }

    private static boolean caseSensitive(ComparatorConfig config) {
        Object flag = config.get(CASE_SENSITIVE);
        if (flag instanceof Boolean b) {
            return b;
        }
        return !(flag instanceof String s && s.trim().equalsIgnoreCase("false"));
    }
}
