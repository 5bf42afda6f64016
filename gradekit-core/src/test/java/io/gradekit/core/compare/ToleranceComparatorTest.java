package io.gradekit.core.compare;

import static io.gradekit.core.compare.ComparatorFixtures.config;
import static io.gradekit.core.compare.ComparatorFixtures.value;
import static org.assertj.core.api.Assertions.assertThat;

import io.gradekit.core.grader.model.ComparatorType;
import io.gradekit.core.grader.model.FieldType;
import org.junit.jupiter.api.Test;

class ToleranceComparatorTest {

    private final ToleranceComparator comparator = new ToleranceComparator();

    @Test
    void shouldAcceptValuesWithinAbsoluteTolerance() {
        var config = config(ComparatorType.TOLERANCE, "expected", 10, "tolerance", 0.5);

        assertThat(comparator.matches(config, value("10.5", FieldType.FLOAT))).isTrue();
        assertThat(comparator.matches(config, value("9.5", FieldType.FLOAT))).isTrue();
        assertThat(comparator.matches(config, value("10.6", FieldType.FLOAT))).isFalse();
    }

    @Test
    void shouldScalePercentageToleranceByExpectation() {
        var config =
                config(
                        ComparatorType.TOLERANCE,
                        "expected",
                        200,
                        "tolerance",
                        5,
                        "type",
                        "percentage");

        assertThat(comparator.matches(config, value("210", FieldType.FLOAT))).isTrue();
        assertThat(comparator.matches(config, value("211", FieldType.FLOAT))).isFalse();
    }

    @Test
    void shouldRequireExactValueWithoutTolerance() {
        var config = config(ComparatorType.TOLERANCE, "expected", "3.5");

        assertThat(comparator.matches(config, value("3.5", FieldType.FLOAT))).isTrue();
        assertThat(comparator.matches(config, value("3.6", FieldType.FLOAT))).isFalse();
    }

    @Test
    void shouldNotMatchNonNumericValues() {
        var config = config(ComparatorType.TOLERANCE, "expected", 1, "tolerance", 1);

        assertThat(comparator.matches(config, value("one", FieldType.STRING))).isFalse();
    }
}
