package io.gradekit.core.extract;

/// Layout a grader expects the response text to follow.
public enum ContainerFormat {
    XML_TAGS, // <key>value</key> pairs anywhere in the text
    JSON, // one JSON object, parsed once per grader
    WHOLE_TEXT // the trimmed response itself is the value
}
