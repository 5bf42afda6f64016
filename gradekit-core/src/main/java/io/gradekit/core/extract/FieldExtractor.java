package io.gradekit.core.extract;

import io.gradekit.core.extract.ExtractionOutcome.ExtractionFailure;
import io.gradekit.core.extract.ExtractionOutcome.FailureKind;
import io.gradekit.core.grader.model.FieldType;
import io.gradekit.core.response.ResponsePayload;
import java.util.Objects;
import java.util.Optional;

/// Reads one typed field value out of an opened response.
///
/// ### Contracts
/// - **Total**: never throws for any response content; every problem becomes an
///   {@link ExtractionFailure}
/// - **Document failures first**: if the document could not be opened, its failure is
///   returned for every key
/// - **Missing before coercion**: an absent key is `MISSING_FIELD`, never `COERCION_FAILED`
///
/// @implNote Stateless utility class. Safe to call from any thread.
///
/// @see ResponseDocuments for opening a payload
/// @see TypeCoercer for the coercion rules
public final class FieldExtractor {

    private FieldExtractor() {}

    /// Extracts and coerces one field.
    ///
    /// @param document opened response, not null
    /// @param key field key, not null
    /// @param type declared field type, not null
    /// @return extracted value or failure, never null
    public static ExtractionOutcome extract(ResponseDocument document, String key, FieldType type) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(type, "type must not be null");

        Optional<ExtractionFailure> failure = document.failure();
        if (failure.isPresent()) {
            return failure.get();
        }

        String raw = document.read(key);
        if (raw == null) {
            return new ExtractionFailure(
                    FailureKind.MISSING_FIELD, "Field '" + key + "' not found in response", null);
        }
        return TypeCoercer.coerce(raw, type);
    }

    /// Convenience overload that opens the payload for a single lookup.
    ///
    /// @param payload submission, not null
    /// @param key field key, not null
    /// @param type declared field type, not null
    /// @param format container format, not null
    /// @param codec JSON codec, may be null for non-JSON formats
    /// @param maxBytes largest accepted payload in UTF-8 bytes
    /// @return extracted value or failure, never null
    public static ExtractionOutcome extract(
            ResponsePayload payload,
            String key,
            FieldType type,
            ContainerFormat format,
            JsonCodec codec,
            long maxBytes) {
        return extract(ResponseDocuments.open(payload, format, codec, maxBytes), key, type);
    }
}
