package io.gradekit.core.grader.result;

import io.gradekit.core.extract.ExtractionOutcome.ExtractionFailure;
import io.gradekit.core.grader.model.ComparatorType;
import io.gradekit.core.grader.model.FieldType;
import java.util.Objects;

/// Immutable outcome of grading one field.
///
/// Non-applicable fields are reported with `applicable = false` and `passed = false`; they
/// are excluded from both achieved and possible score.
public final class FieldResult {

    private final String fieldId;
    private final String key;
    private final FieldType type;
    private final double weight;
    private final boolean applicable;
    private final ComparatorType comparatorType;
    private final Object expected;
    private final String rawValue;
    private final Object actual;
    private final ExtractionFailure failure;
    private final boolean passed;

    private FieldResult(Builder builder) {
        this.fieldId = builder.fieldId;
        this.key = Objects.requireNonNull(builder.key, "Key required");
        this.type = Objects.requireNonNull(builder.type, "Field type required");
        this.weight = builder.weight;
        this.applicable = builder.applicable;
        this.comparatorType =
                Objects.requireNonNull(builder.comparatorType, "Comparator type required");
        this.expected = builder.expected;
        this.rawValue = builder.rawValue;
        this.actual = builder.actual;
        this.failure = builder.failure;
        this.passed = builder.passed;

        if (passed && (!applicable || failure != null)) {
            throw new IllegalArgumentException(
                    "Field '" + key + "' cannot pass without an applicable, extracted value");
        }
    }

    public String getFieldId() {
        return fieldId;
    }

    public String getKey() {
        return key;
    }

    public FieldType getType() {
        return type;
    }

    public double getWeight() {
        return weight;
    }

    public boolean isApplicable() {
        return applicable;
    }

    public ComparatorType getComparatorType() {
        return comparatorType;
    }

    /// Returns the expectation as configured, for audit display.
    ///
    /// @return expected value, may be null
    public Object getExpected() {
        return expected;
    }

    /// Returns the text found in the response before coercion.
    ///
    /// @return raw text, null if nothing was found
    public String getRawValue() {
        return rawValue;
    }

    /// Returns the coerced value.
    ///
    /// @return `Long`, `Double`, `Boolean` or `String`; null if extraction failed
    public Object getActual() {
        return actual;
    }

    /// Returns why the value could not be read.
    ///
    /// @return failure, null if the value was extracted
    public ExtractionFailure getFailure() {
        return failure;
    }

    public boolean isPassed() {
        return passed;
    }

    /// Returns the weight this field adds to the achieved score.
    public double getScore() {
        return passed ? weight : 0.0;
    }

    /// Returns the weight this field adds to the possible score.
    public double getMaxScore() {
        return applicable ? weight : 0.0;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "FieldResult{key="
                + key
                + ", applicable="
                + applicable
                + ", passed="
                + passed
                + (failure != null ? ", failure=" + failure.kind() : "")
                + "}";
    }

    public static final class Builder {
        private String fieldId;
        private String key;
        private FieldType type;
        private double weight = 1.0;
        private boolean applicable;
        private ComparatorType comparatorType;
        private Object expected;
        private String rawValue;
        private Object actual;
        private ExtractionFailure failure;
        private boolean passed;

        private Builder() {}

        public Builder fieldId(String fieldId) {
            this.fieldId = fieldId;
            return this;
        }

        public Builder key(String key) {
            this.key = key;
            return this;
        }

        public Builder type(FieldType type) {
            this.type = type;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder applicable(boolean applicable) {
            this.applicable = applicable;
            return this;
        }

        public Builder comparatorType(ComparatorType comparatorType) {
            this.comparatorType = comparatorType;
            return this;
        }

        public Builder expected(Object expected) {
            this.expected = expected;
            return this;
        }

        public Builder rawValue(String rawValue) {
            this.rawValue = rawValue;
            return this;
        }

        public Builder actual(Object actual) {
            this.actual = actual;
            return this;
        }

        public Builder failure(ExtractionFailure failure) {
            this.failure = failure;
            return this;
        }

        public Builder passed(boolean passed) {
            this.passed = passed;
            return this;
        }

        public FieldResult build() {
            return new FieldResult(this);
        }
    }
}
