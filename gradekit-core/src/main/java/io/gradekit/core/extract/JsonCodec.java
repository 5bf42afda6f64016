package io.gradekit.core.extract;

import java.util.Map;

/// JSON reading and writing used by the extractor and the response composer.
///
/// Core carries no JSON library. An implementation is supplied by the serialization module
/// and discovered through {@link java.util.ServiceLoader}, or passed explicitly to
/// {@link io.gradekit.core.GradeKitFactory}.
///
/// ### Contracts
/// - **Reading**: numbers keep their parsed Java type (`Integer`, `Long`, `BigInteger`,
///   `Double` or `BigDecimal`); nested objects become ordered maps, arrays become lists
/// - **Writing**: output is pretty-printed and preserves map order
///
/// @implNote Implementations must be thread-safe.
public interface JsonCodec {

    /// Parses a JSON document whose root must be an object.
    ///
    /// @param json document text, not null
    /// @return ordered map of the root object's members, never null
    /// @throws JsonCodecException if the text is not JSON or the root is not an object
    Map<String, Object> readObject(String json) throws JsonCodecException;

    /// Writes a value as pretty-printed JSON.
    ///
    /// @param value map, list, string, number, boolean or null
    /// @return JSON text, never null
    String write(Object value);
}
