package io.gradekit.core.compare;

import static io.gradekit.core.compare.ComparatorFixtures.config;
import static io.gradekit.core.compare.ComparatorFixtures.value;
import static org.assertj.core.api.Assertions.assertThat;

import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.ComparatorType;
import io.gradekit.core.grader.model.FieldType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RangeComparatorTest {

    private final RangeComparator comparator = new RangeComparator();
    private final ComparatorConfig oneToTen = config(ComparatorType.RANGE, "min", 1, "max", 10);

    @ParameterizedTest
    @CsvSource({"1, true", "7, true", "10, true", "0, false", "11, false", "10.5, false"})
    void shouldIncludeBothBounds(String raw, boolean expected) {
        assertThat(comparator.matches(oneToTen, value(raw, FieldType.FLOAT))).isEqualTo(expected);
    }

    @Test
    void shouldRejectNonNumericText() {
        assertThat(comparator.matches(oneToTen, value("abc", FieldType.STRING))).isFalse();
        assertThat(comparator.matches(oneToTen, value("7", FieldType.STRING))).isTrue();
    }

    @Test
    void shouldRejectBooleans() {
        assertThat(comparator.matches(oneToTen, value("1", FieldType.BOOLEAN))).isFalse();
    }

    @Test
    void shouldTreatMissingBoundAsUnbounded() {
        ComparatorConfig atLeastFive = config(ComparatorType.RANGE, "min", 5);

        assertThat(comparator.isApplicable(atLeastFive)).isTrue();
        assertThat(comparator.matches(atLeastFive, value("1000000", FieldType.INT))).isTrue();
        assertThat(comparator.matches(atLeastFive, value("4", FieldType.INT))).isFalse();
    }

    @Test
    void shouldBeInapplicableWithoutBounds() {
        assertThat(comparator.isApplicable(config(ComparatorType.RANGE))).isFalse();
        assertThat(comparator.isApplicable(config(ComparatorType.RANGE, "min", null, "max", null)))
                .isFalse();
    }
}
