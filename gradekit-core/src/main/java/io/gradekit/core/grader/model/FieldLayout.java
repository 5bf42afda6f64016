package io.gradekit.core.grader.model;

/// Configuration shape a grader's fields were declared in.
///
/// Scoring never looks at the layout; it only decides how fields are written back out.
public enum FieldLayout {
    STRUCTURE, // config.structure[], keyed by name
    TEST_CASES, // config.test_cases[], keyed by id
    WHOLE_RESPONSE // config.expected on text/number graders, one implicit field
}
