package io.gradekit.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Converts between Jackson trees and the plain values stored in grader settings.
///
/// Settings hold `null`, `Boolean`, `Long`, `Double`, `String`, `List` and ordered `Map`
/// values only. Writing is the inverse, except that a whole `Double` such as `5.0` is written
/// as `5`, which keeps re-exported configuration identical to what authors typically write.
///
/// @implNote Package-private stateless helper.
final class JsonValues {

    private JsonValues() {}

    static Object toJava(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                list.add(toJava(item));
            }
            return list;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            map.put(entry.getKey(), toJava(entry.getValue()));
        }
        return map;
    }

    static void write(JsonGenerator gen, Object value) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte) {
            gen.writeNumber(((Number) value).longValue());
        } else if (value instanceof BigInteger big) {
            gen.writeNumber(big);
        } else if (value instanceof BigDecimal decimal) {
            gen.writeNumber(decimal);
        } else if (value instanceof Number number) {
            writeDouble(gen, number.doubleValue());
        } else if (value instanceof Map<?, ?> map) {
            gen.writeStartObject();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                gen.writeFieldName(String.valueOf(entry.getKey()));
                write(gen, entry.getValue());
            }
            gen.writeEndObject();
        } else if (value instanceof Iterable<?> items) {
            gen.writeStartArray();
            for (Object item : items) {
                write(gen, item);
            }
            gen.writeEndArray();
        } else {
            gen.writeString(value.toString());
        }
    }

    static void writeField(JsonGenerator gen, String name, Object value) throws IOException {
        gen.writeFieldName(name);
        write(gen, value);
    }

    static void writeDouble(JsonGenerator gen, double d) throws IOException {
        if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p53) {
            gen.writeNumber((long) d);
        } else {
            gen.writeNumber(d);
        }
    }
}
