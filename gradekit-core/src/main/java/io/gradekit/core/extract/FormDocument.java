package io.gradekit.core.extract;

import java.util.Map;
import java.util.Objects;

/// Reads fields directly from a submitted form, keyed by field key.
///
/// Blank entries count as unanswered.
final class FormDocument implements ResponseDocument {

    private final Map<String, Object> values;
    private final JsonCodec codec;

    FormDocument(Map<String, Object> values, JsonCodec codec) {
        this.values = Objects.requireNonNull(values, "values must not be null");
        this.codec = codec;
    }

    @Override
    public String read(String key) {
        String raw = ResponseDocuments.rawText(values.get(key), codec);
        return raw == null || raw.isBlank() ? null : raw;
    }
}
