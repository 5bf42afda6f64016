package io.gradekit.core.extract;

import java.util.Map;
import java.util.Objects;

/// Reads fields as top-level members of a parsed JSON object.
///
/// A missing member and an explicit `null` both read as absent. Non-string members are
/// rendered back to text so coercion treats every container the same way.
final class JsonObjectDocument implements ResponseDocument {

    private final Map<String, Object> members;
    private final JsonCodec codec;

    JsonObjectDocument(Map<String, Object> members, JsonCodec codec) {
        this.members = Objects.requireNonNull(members, "members must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public String read(String key) {
        return ResponseDocuments.rawText(members.get(key), codec);
    }
}
