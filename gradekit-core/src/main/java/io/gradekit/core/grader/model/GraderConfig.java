package io.gradekit.core.grader.model;

import io.gradekit.core.extract.ContainerFormat;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable grader definition attached to a task.
///
/// A grader names a container format, a weight and an ordered list of fields. The weight is
/// the grader's share of the task's total possible score, independent of how many fields it
/// declares.
///
/// ### Validation Rules
/// - Weight must be non-negative
/// - Fields may be empty here; the grading engine reports an empty grader as a
///   configuration error at evaluation time
///
/// @implNote Immutable and thread-safe after construction. Fields and settings are wrapped
/// in unmodifiable views.
///
/// @see GraderField for individual fields
/// @see io.gradekit.core.GradingEngine for evaluation
public final class GraderConfig {

    private final GraderType type;
    private final String name;
    private final double weight;
    private final FieldLayout layout;
    private final List<GraderField> fields;
    private final Map<String, Object> settings;

    private GraderConfig(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "Grader type required");
        this.name = Objects.requireNonNull(builder.name, "Name required");
        this.weight = builder.weight;
        this.layout = Objects.requireNonNull(builder.layout, "Field layout required");
        this.fields = List.copyOf(builder.fields);
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.settings));

        if (weight < 0) {
            throw new IllegalArgumentException("Weight cannot be negative");
        }
    }

    public GraderType getType() {
        return type;
    }

    /// Returns the display name. Not used in scoring.
    ///
    /// @return grader name, never null
    public String getName() {
        return name;
    }

    /// Returns the grader's contribution to the task's total possible score.
    ///
    /// @return non-negative weight (default 1.0)
    public double getWeight() {
        return weight;
    }

    public FieldLayout getLayout() {
        return layout;
    }

    /// Returns the fields in declaration order.
    ///
    /// @return unmodifiable list, never null, may be empty
    public List<GraderField> getFields() {
        return fields;
    }

    /// Returns `config` keys other than the field lists (e.g. `binary_mode`).
    ///
    /// @return unmodifiable ordered map, never null
    public Map<String, Object> getSettings() {
        return settings;
    }

    public ContainerFormat getContainerFormat() {
        return type.getContainerFormat();
    }

    /// Returns a copy of this grader with its fields replaced.
    ///
    /// @param replacement new field list, not null
    /// @return new grader, never null
    public GraderConfig withFields(List<GraderField> replacement) {
        return toBuilder().fields(replacement).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .type(type)
                .name(name)
                .weight(weight)
                .layout(layout)
                .fields(fields)
                .settings(settings);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GraderConfig{name=" + name + ", type=" + type + ", fields=" + fields.size() + "}";
    }

    /// Builder for constructing immutable GraderConfig instances.
    ///
    /// Required fields: `type`, `name`
    public static final class Builder {
        private GraderType type;
        private String name;
        private double weight = 1.0;
        private FieldLayout layout = FieldLayout.STRUCTURE;
        private List<GraderField> fields = List.of();
        private Map<String, Object> settings = Map.of();

        private Builder() {}

        public Builder type(GraderType type) {
            this.type = type;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        /// Sets the configuration shape the fields are written back in.
        ///
        /// @param layout field layout (default STRUCTURE), not null
        /// @return this builder for chaining
        public Builder layout(FieldLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder fields(List<GraderField> fields) {
            this.fields = List.copyOf(fields);
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.settings = settings;
            return this;
        }

        /// Builds the immutable grader.
        ///
        /// @return new GraderConfig instance, never null
        /// @throws NullPointerException if type, name or layout is null
        /// @throws IllegalArgumentException if weight is negative
        public GraderConfig build() {
            return new GraderConfig(this);
        }
    }
}
