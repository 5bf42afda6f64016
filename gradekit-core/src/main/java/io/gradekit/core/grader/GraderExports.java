package io.gradekit.core.grader;

import io.gradekit.core.extract.TypeCoercer;
import io.gradekit.core.extract.TypedValues;
import io.gradekit.core.grader.model.ComparatorConfig;
import io.gradekit.core.grader.model.FieldLayout;
import io.gradekit.core.grader.model.FieldType;
import io.gradekit.core.grader.model.GraderConfig;
import io.gradekit.core.grader.model.GraderField;
import io.gradekit.core.response.ResponsePayload.FormResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Transforms grader lists for export.
///
/// Both operations return new graders and leave their input untouched. Field order, ids,
/// names, types, weights, comparator types and all other comparator settings are kept, so
/// the output re-imports as a valid definition.
///
/// - {@link #strip} removes every expectation, producing a reusable template
/// - {@link #populate} fills expectations from a reviewer's form, producing an answer key
///
/// @implNote Stateless utility class. Safe to call from any thread.
public final class GraderExports {

    private static final Logger logger = Logger.getLogger(GraderExports.class.getName());

    private GraderExports() {}

    /// Sets every field's `expected` to null, along with any test case `expected_value` kept
    /// beside its comparator.
    ///
    /// @param graders graders to sanitize, not null
    /// @return sanitized copies in the same order, never null
    public static List<GraderConfig> strip(List<GraderConfig> graders) {
        Objects.requireNonNull(graders, "graders must not be null");
        List<GraderConfig> stripped = new ArrayList<>(graders.size());
        for (GraderConfig grader : graders) {
            List<GraderField> fields = new ArrayList<>(grader.getFields().size());
            for (GraderField field : grader.getFields()) {
                fields.add(withExpected(field, null));
            }
            stripped.add(grader.withFields(fields));
        }
        return stripped;
    }

    /// Sets every field's `expected` from a filled-in form.
    ///
    /// ### Lookup
    /// Structure fields are looked up by id, then name, then the lower-case forms of both.
    /// Test cases are looked up by id, then its lower-case form. Empty or absent answers
    /// leave `expected` null.
    ///
    /// ### Conversion
    /// - Structure fields follow their declared type. An unparseable number leaves null;
    ///   a boolean is true only for `true`
    /// - Test cases become a number when the answer is numeric, a boolean for `true` or
    ///   `false`, and a string otherwise
    ///
    /// @param graders graders to fill, not null
    /// @param form reviewer's answers, not null
    /// @return filled copies in the same order, never null
    public static List<GraderConfig> populate(List<GraderConfig> graders, FormResponse form) {
        Objects.requireNonNull(graders, "graders must not be null");
        Objects.requireNonNull(form, "form must not be null");

        List<GraderConfig> populated = new ArrayList<>(graders.size());
        for (GraderConfig grader : graders) {
            boolean testCases = grader.getLayout() == FieldLayout.TEST_CASES;
            List<GraderField> fields = new ArrayList<>(grader.getFields().size());
            for (GraderField field : grader.getFields()) {
                Object answer = lookup(form, testCases ? List.of(field.getKey()) : keysOf(field));
                Object expected = null;
                if (answer != null) {
                    expected =
                            testCases
                                    ? inferTestCaseValue(answer)
                                    : convert(answer, field.getType());
                }
                logger.fine("Populated " + field.getKey() + " with " + expected);
                fields.add(withExpected(field, expected));
            }
            populated.add(grader.withFields(fields));
        }
        return populated;
    }

    private static GraderField withExpected(GraderField field, Object expected) {
        ComparatorConfig comparator =
                field.getComparator().with(ComparatorConfig.EXPECTED, expected);
        GraderField.Builder builder = field.toBuilder().comparator(comparator);
        if (field.getAttributes().containsKey(GraderField.EXPECTED_VALUE)) {
            Map<String, Object> attributes = new LinkedHashMap<>(field.getAttributes());
            attributes.put(GraderField.EXPECTED_VALUE, expected);
            builder.attributes(attributes);
        }
        return builder.build();
    }

    private static List<String> keysOf(GraderField field) {
        List<String> keys = new ArrayList<>(2);
        if (field.getId() != null) {
            keys.add(field.getId());
        }
        if (field.getName() != null) {
            keys.add(field.getName());
        }
        return keys;
    }

    private static Object lookup(FormResponse form, List<String> keys) {
        List<String> candidates = new ArrayList<>(keys);
        for (String key : keys) {
            candidates.add(key.toLowerCase(Locale.ROOT));
        }
        for (String candidate : candidates) {
            Object value = form.get(candidate);
            if (value != null) {
                return "".equals(value) ? null : value;
            }
        }
        return null;
    }

    static Object convert(Object answer, FieldType type) {
        String text = TypedValues.textOf(answer).trim();
        switch (type) {
            case INT:
                if (answer instanceof Number number) {
                    return number;
                }
                return leadingInteger(text).orElse(null);
            case FLOAT:
                if (answer instanceof Number number) {
                    return number;
                }
                return TypeCoercer.parseDecimal(text).orElse(null);
            case BOOLEAN:
                if (answer instanceof Boolean) {
                    return answer;
                }
                return "true".equalsIgnoreCase(text);
            case STRING:
            default:
                return TypedValues.textOf(answer);
        }
    }

    static Object inferTestCaseValue(Object answer) {
        if (answer instanceof Number || answer instanceof Boolean) {
            return answer;
        }
        String text = answer.toString();
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return text;
        }
        Optional<Object> integer = TypeCoercer.convert(trimmed, FieldType.INT);
        if (integer.isPresent()) {
            return integer.get();
        }
        Optional<Double> decimal = TypeCoercer.parseDecimal(trimmed);
        if (decimal.isPresent()) {
            return decimal.get();
        }
        if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(trimmed);
        }
        return text;
    }

    private static Optional<Object> leadingInteger(String text) {
        int end = 0;
        if (end < text.length() && (text.charAt(end) == '-' || text.charAt(end) == '+')) {
            end++;
        }
        int digitsStart = end;
        while (end < text.length() && Character.isDigit(text.charAt(end))) {
            end++;
        }
        if (end == digitsStart) {
            return Optional.empty();
        }
        return TypeCoercer.convert(text.substring(0, end), FieldType.INT);
    }
}
