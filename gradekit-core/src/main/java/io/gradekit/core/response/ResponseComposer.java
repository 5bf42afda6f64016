package io.gradekit.core.response;

import io.gradekit.core.extract.JsonCodec;
import io.gradekit.core.extract.TypedValues;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.model.GraderField;
import io.gradekit.core.grader.model.GraderType;
import io.gradekit.core.response.ResponsePayload.FormResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Renders form answers as the text a labeler would have typed.
///
/// The rendered text is stored alongside the form as the submission's generated response,
/// so reviewers see the same shape the graders read.
///
/// ### Formats
/// - `xml`, `unit_test` - one `<key>value</key>` line per answer
/// - `json` - a pretty-printed JSON object
/// - `text`, `number` - the answer stored under `response`, or an empty string
///
/// @implNote Immutable and thread-safe if the codec is.
public final class ResponseComposer {

    /// Key under which whole-response graders expect their single answer.
    public static final String WHOLE_RESPONSE_KEY = "response";

    private final JsonCodec codec;

    /// @param codec JSON codec, required only for `json` graders
    public ResponseComposer(JsonCodec codec) {
        this.codec = codec;
    }

    /// Renders the form for a grader type.
    ///
    /// @param form answers, not null
    /// @param type type of the task's structured grader, not null
    /// @return rendered text, never null
    /// @throws IllegalStateException if a JSON rendering is needed and no codec is set
    public String compose(FormResponse form, GraderType type) {
        Objects.requireNonNull(form, "form must not be null");
        Objects.requireNonNull(type, "type must not be null");

        switch (type) {
            case XML:
            case UNIT_TEST:
                List<String> lines = new ArrayList<>(form.values().size());
                for (Map.Entry<String, Object> entry : form.values().entrySet()) {
                    String value = entry.getValue() == null ? "" : TypedValues.textOf(entry.getValue());
                    lines.add("<" + entry.getKey() + ">" + value + "</" + entry.getKey() + ">");
                }
                return String.join("\n", lines);
            case JSON:
                if (codec == null) {
                    throw new IllegalStateException("No JSON codec available");
                }
                return codec.write(form.values());
            default:
                Object whole = form.get(WHOLE_RESPONSE_KEY);
                return whole == null ? "" : TypedValues.textOf(whole);
        }
    }

    /// Lists fields a form leaves unanswered.
    ///
    /// An answer is missing when absent, null or blank.
    ///
    /// @param form answers, not null
    /// @param graders task graders, not null
    /// @return keys of unanswered fields in grader order, never null
    public static List<String> findUnanswered(FormResponse form, List<GraderConfig> graders) {
        List<String> missing = new ArrayList<>();
        for (GraderConfig grader : graders) {
            for (GraderField field : grader.getFields()) {
                Object value = form.get(field.getKey());
                boolean blank = value == null || value.toString().isBlank();
                if (blank && !missing.contains(field.getKey())) {
                    missing.add(field.getKey());
                }
            }
        }
        return missing;
    }
}
