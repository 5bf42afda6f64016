package io.gradekit.core.response;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A labeler's submission as handed to the grading engine.
///
/// ### Permitted Subtypes
/// - {@link TextResponse} - free text, searched for tags or parsed as JSON per grader
/// - {@link FormResponse} - fill-in-the-blank answers, read directly by field key
///
/// @implNote Thread-safe. All permitted subtypes are immutable records.
public sealed interface ResponsePayload
        permits ResponsePayload.TextResponse, ResponsePayload.FormResponse {

    static TextResponse text(String text) {
        return new TextResponse(text);
    }

    static FormResponse form(Map<String, ?> values) {
        return new FormResponse(new LinkedHashMap<String, Object>(values));
    }

    /// Free-text submission.
    ///
    /// @param text submitted text, not null
    record TextResponse(String text) implements ResponsePayload {

        public TextResponse {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// Form submission keyed by field key (tag name, JSON member or test case id).
    ///
    /// Values are strings, numbers, booleans or null. Null values are kept so an
    /// unanswered entry is distinguishable from an unknown one.
    ///
    /// @param values ordered answers, copied into an unmodifiable view, never null
    record FormResponse(Map<String, Object> values) implements ResponsePayload {

        public FormResponse {
            values =
                    values == null
                            ? Map.of()
                            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        /// Returns a single answer.
        ///
        /// @param key field key, not null
        /// @return the answer, or null if absent or unanswered
        public Object get(String key) {
            return values.get(key);
        }
    }
}
