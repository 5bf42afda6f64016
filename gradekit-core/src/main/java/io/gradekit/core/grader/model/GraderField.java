package io.gradekit.core.grader.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable field definition inside a grader.
///
/// Both configuration shapes collapse into this one type. Structure fields are keyed by
/// `name`; test cases have no name and are keyed by `id`. Everything downstream of
/// configuration loading only uses {@link #getKey()}.
///
/// ### Validation Rules
/// - `id` or `name` must be present
/// - Weight must be non-negative
///
/// @implNote Immutable and thread-safe after construction. Attributes are wrapped in an
/// unmodifiable, order-preserving view.
///
/// @see GraderConfig for the owning grader
/// @see ComparatorConfig for the expectation attached to the field
public final class GraderField {

    /// Attribute holding a test case's declared `expected_value` when its comparator carries
    /// a different `expected` of its own.
    public static final String EXPECTED_VALUE = "expected_value";

    private final String id;
    private final String name;
    private final FieldType type;
    private final double weight;
    private final ComparatorConfig comparator;
    private final Map<String, Object> attributes;
    private final Set<String> defaultedKeys;

    private GraderField(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.type = Objects.requireNonNull(builder.type, "Field type required");
        this.weight = builder.weight;
        this.comparator = Objects.requireNonNull(builder.comparator, "Comparator required");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.defaultedKeys = Set.copyOf(builder.defaultedKeys);

        validate();
    }

    private void validate() {
        if (id == null && name == null) {
            throw new IllegalArgumentException("Field requires an id or a name");
        }
        if (weight < 0) {
            throw new IllegalArgumentException("Weight cannot be negative");
        }
    }

    /// Returns the stable identifier used by form consumers.
    ///
    /// @return field ID, may be null for structure fields declared without one
    public String getId() {
        return id;
    }

    /// Returns the tag or property name declared for structure fields.
    ///
    /// @return field name, null for test cases
    public String getName() {
        return name;
    }

    /// Returns the key the extractor looks up: the name when present, otherwise the id.
    ///
    /// @return extraction key, never null
    public String getKey() {
        return name != null ? name : id;
    }

    public FieldType getType() {
        return type;
    }

    /// Returns this field's share of its grader's score.
    ///
    /// @return non-negative weight (default 1.0)
    public double getWeight() {
        return weight;
    }

    public ComparatorConfig getComparator() {
        return comparator;
    }

    /// Returns properties carried through export unchanged (e.g. `children`, `isExpanded`,
    /// or a test case's own {@link #EXPECTED_VALUE}).
    ///
    /// @return unmodifiable ordered map, never null
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /// Returns the properties the definition left out and the loader filled in (`type`,
    /// `weight`). Writers omit them again while they still hold the default.
    ///
    /// @return unmodifiable set, never null
    public Set<String> getDefaultedKeys() {
        return defaultedKeys;
    }

    /// Returns a copy of this field with a different comparator.
    ///
    /// @param comparator replacement comparator, not null
    /// @return new field, never null
    public GraderField withComparator(ComparatorConfig comparator) {
        return toBuilder().comparator(comparator).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .type(type)
                .weight(weight)
                .comparator(comparator)
                .attributes(attributes)
                .defaultedKeys(defaultedKeys);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "GraderField{key=" + getKey() + ", type=" + type + ", weight=" + weight + "}";
    }

    /// Builder for constructing immutable GraderField instances.
    ///
    /// Required fields: `id` or `name`, `type`, `comparator`
    public static final class Builder {
        private String id;
        private String name;
        private FieldType type = FieldType.STRING;
        private double weight = 1.0;
        private ComparatorConfig comparator;
        private Map<String, Object> attributes = Map.of();
        private Set<String> defaultedKeys = Set.of();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
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

        public Builder comparator(ComparatorConfig comparator) {
            this.comparator = comparator;
            return this;
        }

        /// Sets uninterpreted properties to carry through export.
        ///
        /// @param attributes ordered properties, not null
        /// @return this builder for chaining
        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes;
            return this;
        }

        public Builder defaultedKeys(Set<String> defaultedKeys) {
            this.defaultedKeys = defaultedKeys;
            return this;
        }

        /// Builds the immutable field.
        ///
        /// @return new GraderField instance, never null
        /// @throws NullPointerException if type or comparator is null
        /// @throws IllegalArgumentException if both id and name are null or weight is negative
        public GraderField build() {
            return new GraderField(this);
        }
    }
}
