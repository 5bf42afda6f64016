package io.gradekit.serialization.validation;

/// Severity of a task definition issue, most severe first.
///
/// `CRITICAL` and `ERROR` always make a report invalid. `WARNING` does so only in strict
/// mode. `INFO` never does.
public enum Severity {
    CRITICAL, // document cannot be imported at all
    ERROR, // element would be rejected or mis-scored
    WARNING, // recommended field missing; a default applies
    INFO // worth knowing, e.g. a template with expectations removed
}
