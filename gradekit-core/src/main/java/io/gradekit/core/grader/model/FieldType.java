package io.gradekit.core.grader.model;

/// Primitive type an extracted field value is coerced to.
public enum FieldType {
    INT("int"),
    FLOAT("float"),
    STRING("string"),
    BOOLEAN("boolean", "bool");

    private final String value;
    private final String alias;

    FieldType(String value) {
        this(value, null);
    }

    FieldType(String value, String alias) {
        this.value = value;
        this.alias = alias;
    }

    public String getValue() {
        return value;
    }

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    /// Resolves a configuration identifier. Accepts `bool` as an alias of `boolean`.
    ///
    /// @param value identifier, case-insensitive
    /// @return matching type, never null
    /// @throws IllegalArgumentException if the identifier is unknown or null
    public static FieldType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim();
            for (FieldType type : values()) {
                if (type.value.equalsIgnoreCase(normalized)
                        || (type.alias != null && type.alias.equalsIgnoreCase(normalized))) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + value);
    }
}
