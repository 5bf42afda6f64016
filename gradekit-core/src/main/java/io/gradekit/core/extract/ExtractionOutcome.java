package io.gradekit.core.extract;

import java.util.Objects;

/// Result of reading one field out of a response.
///
/// ### Permitted Subtypes
/// - {@link ExtractedValue} - the field was found and coerced to its declared type
/// - {@link ExtractionFailure} - the field is missing, unreadable or failed coercion
///
/// A failure is an ordinary per-field outcome. It is recorded on the field result and never
/// interrupts evaluation of sibling fields or other graders.
///
/// @implNote Thread-safe. All permitted subtypes are immutable records.
public sealed interface ExtractionOutcome
        permits ExtractionOutcome.ExtractedValue, ExtractionOutcome.ExtractionFailure {

    /// Raw text as found in the response, before coercion.
    ///
    /// @return raw text, or null when nothing was found
    String raw();

    /// A successfully extracted and coerced value.
    ///
    /// @param raw text as found in the response, not null
    /// @param value coerced value, not null
    record ExtractedValue(String raw, TypedValue value) implements ExtractionOutcome {

        public ExtractedValue {
            Objects.requireNonNull(raw, "raw must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// A field that could not be read.
    ///
    /// @param kind failure category, not null
    /// @param message human-readable reason shown to reviewers, not null
    /// @param raw text found before coercion failed; null if nothing was found
    record ExtractionFailure(FailureKind kind, String message, String raw)
            implements ExtractionOutcome {

        public ExtractionFailure {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    enum FailureKind {
        MISSING_FIELD, // tag, key or form entry not present
        INVALID_CONTAINER, // response is not the declared container (e.g. invalid JSON)
        COERCION_FAILED, // text found but not valid for the declared type
        RESPONSE_TOO_LARGE // response exceeds the configured size limit
    }
}
