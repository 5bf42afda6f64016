package io.gradekit.core.extract;

import io.gradekit.core.extract.ExtractionOutcome.ExtractionFailure;
import java.util.Optional;

/// A response opened once per grader, ready for field lookups.
///
/// Opening a document does all container-level work (size check, JSON parsing). A
/// document-level failure applies to every field of the grader alike.
///
/// @see ResponseDocuments#open for construction
public interface ResponseDocument {

    /// Returns the raw text stored under a key.
    ///
    /// @param key field key, not null
    /// @return raw text, or null if the key is absent
    String read(String key);

    /// Returns the failure that prevents any field from being read.
    ///
    /// @return failure, or empty when the document opened cleanly
    default Optional<ExtractionFailure> failure() {
        return Optional.empty();
    }
}
