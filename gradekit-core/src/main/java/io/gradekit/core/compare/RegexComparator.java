package io.gradekit.core.compare;

import io.gradekit.core.extract.TypedValue;
import io.gradekit.core.extract.TypedValues;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/// Regular expression search anywhere in the text form of the value.
///
/// The pattern is `pattern`, or `expected` when `pattern` is absent. Anchor with `^` and
/// `$` to require a full match. An invalid pattern never matches.
public final class RegexComparator implements FieldComparator {

    private static final Logger logger = Logger.getLogger(RegexComparator.class.getName());

    static final String PATTERN = "pattern";

    @Override
    public ComparatorType type() {
        return ComparatorType.REGEX;
    }

    @Override
    public boolean isApplicable(ComparatorConfig config) {
        return config.has(PATTERN) || config.has(ComparatorConfig.EXPECTED);
    }

    @Override
    public boolean matches(ComparatorConfig config, TypedValue actual) {
        String regex =
                TypedValues.textOf(
                        config.has(PATTERN) ? config.get(PATTERN) : config.getExpected());
        try {
            return Pattern.compile(regex).matcher(actual.text()).find();
        } catch (PatternSyntaxException e) {
            logger.warning("Invalid regex pattern '" + regex + "': " + e.getDescription());
            return false;
        }
    }
}
