package io.gradekit.core.grader.model;

import io.gradekit.core.extract.ContainerFormat;

/// Grader kinds and the container format each one reads.
///
/// `unit_test` graders share the XML tag layout: fill-in-the-blank forms for test cases are
/// rendered as one `<id>value</id>` line per case.
public enum GraderType {
    XML("xml", ContainerFormat.XML_TAGS),
    JSON("json", ContainerFormat.JSON),
    TEXT("text", ContainerFormat.WHOLE_TEXT),
    NUMBER("number", ContainerFormat.WHOLE_TEXT),
    UNIT_TEST("unit_test", ContainerFormat.XML_TAGS);

    private final String value;
    private final ContainerFormat containerFormat;

    GraderType(String value, ContainerFormat containerFormat) {
        this.value = value;
        this.containerFormat = containerFormat;
    }

    /// Returns the identifier used in grader configuration JSON.
    ///
    /// @return lowercase type identifier, never null
    public String getValue() {
        return value;
    }

    public ContainerFormat getContainerFormat() {
        return containerFormat;
    }

    /// Resolves a configuration identifier.
    ///
    /// @param value identifier such as `xml` or `unit_test`, case-insensitive
    /// @return matching type, never null
    /// @throws IllegalArgumentException if the identifier is unknown or null
    public static GraderType fromValue(String value) {
        if (value != null) {
            for (GraderType type : values()) {
                if (type.value.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown grader type: " + value);
    }
}
