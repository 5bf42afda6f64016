package io.gradekit.core.grader.model;

public enum ComparatorType {
    EQUALS("equals"),
    CONTAINS("contains"),
    RANGE("range"),
    REGEX("regex"),
    TOLERANCE("tolerance"),
    IN_LIST("in_list"),
    LENGTH("length");

    private final String value;

    ComparatorType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /// Resolves a configuration identifier.
    ///
    /// @param value identifier such as `equals` or `in_list`, case-insensitive
    /// @return matching type, never null
    /// @throws IllegalArgumentException if the identifier is unknown or null
    public static ComparatorType fromValue(String value) {
        if (value != null) {
            for (ComparatorType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown comparator type: " + value);
    }
}
