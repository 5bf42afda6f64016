package io.gradekit.core.extract;

import io.gradekit.core.extract.ExtractionOutcome.ExtractionFailure;
import io.gradekit.core.extract.ExtractionOutcome.FailureKind;
import io.gradekit.core.response.ResponsePayload;
import io.gradekit.core.response.ResponsePayload.FormResponse;
import io.gradekit.core.response.ResponsePayload.TextResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Opens a response payload as a {@link ResponseDocument} for one container format.
///
/// ### Contracts
/// - **Size**: a payload larger than `maxBytes` (UTF-8) opens as an unreadable document
///   with kind `RESPONSE_TOO_LARGE`
/// - **JSON**: text that does not parse, or whose root is not an object, opens as an
///   unreadable document with kind `INVALID_CONTAINER`
/// - **Forms**: a {@link FormResponse} is always read by key, whatever the grader's container
///
/// @implNote Stateless utility class. Safe to call from any thread.
public final class ResponseDocuments {

    private static final Logger logger = Logger.getLogger(ResponseDocuments.class.getName());

    private ResponseDocuments() {}

    /// Opens a payload for field lookups.
    ///
    /// @param payload submission, not null
    /// @param format grader's container format, not null
    /// @param codec JSON codec, may be null if no grader declares JSON
    /// @param maxBytes largest accepted payload in UTF-8 bytes
    /// @return opened document, never null
    public static ResponseDocument open(
            ResponsePayload payload, ContainerFormat format, JsonCodec codec, long maxBytes) {
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(format, "format must not be null");

        long size = sizeOf(payload);
        if (size > maxBytes) {
            logger.warning("Response of " + size + " bytes exceeds limit of " + maxBytes);
            return new UnreadableDocument(
                    new ExtractionFailure(
                            FailureKind.RESPONSE_TOO_LARGE,
                            "Response exceeds " + maxBytes + " bytes",
                            null));
        }

        if (payload instanceof FormResponse form) {
            return new FormDocument(form.values(), codec);
        }

        String text = ((TextResponse) payload).text();
        switch (format) {
            case XML_TAGS:
                return new XmlTagDocument(text);
            case WHOLE_TEXT:
                return new WholeTextDocument(text);
            case JSON:
                return openJson(text, codec);
            default:
                throw new IllegalStateException("Unhandled container format: " + format);
        }
    }

    private static ResponseDocument openJson(String text, JsonCodec codec) {
        if (codec == null) {
            return new UnreadableDocument(
                    new ExtractionFailure(
                            FailureKind.INVALID_CONTAINER, "No JSON codec available", null));
        }
        try {
            return new JsonObjectDocument(codec.readObject(text), codec);
        } catch (JsonCodecException e) {
            logger.warning("Response is not a JSON object: " + e.getMessage());
            return new UnreadableDocument(
                    new ExtractionFailure(
                            FailureKind.INVALID_CONTAINER,
                            "Response is not a valid JSON object: " + e.getMessage(),
                            null));
        }
    }

    private static long sizeOf(ResponsePayload payload) {
        if (payload instanceof TextResponse text) {
            return text.text().getBytes(StandardCharsets.UTF_8).length;
        }
        long total = 0;
        for (Object value : ((FormResponse) payload).values().values()) {
            if (value != null) {
                total += value.toString().getBytes(StandardCharsets.UTF_8).length;
            }
        }
        return total;
    }

    /// Renders a decoded JSON or form value as the text a tag would have contained.
    ///
    /// Floating-point numbers are written without exponent or trailing zeros, so `5.0`
    /// reads as `5` and still coerces to `int`.
    ///
    /// @param value decoded value, may be null
    /// @param codec codec for nested objects and arrays, may be null
    /// @return raw text, or null if the value is null
    static String rawText(Object value, JsonCodec codec) {
        if ((value instanceof Map || value instanceof List) && codec != null) {
            return codec.write(value);
        }
        return TypedValues.textOf(value);
    }
}
