package io.gradekit.core.extract;

import io.gradekit.core.extract.ExtractionOutcome.ExtractionFailure;
import java.util.Objects;
import java.util.Optional;

/// A response that could not be opened. Every lookup fails with the same reason.
final class UnreadableDocument implements ResponseDocument {

    private final ExtractionFailure failure;

    UnreadableDocument(ExtractionFailure failure) {
        this.failure = Objects.requireNonNull(failure, "failure must not be null");
    }

    @Override
    public String read(String key) {
        return null;
    }

    @Override
    public Optional<ExtractionFailure> failure() {
        return Optional.of(failure);
    }
}
