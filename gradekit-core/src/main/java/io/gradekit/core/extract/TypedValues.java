package io.gradekit.core.extract;

import io.gradekit.core.grader.model.FieldType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/// Helpers for comparing configured expectations with coerced field values.
///
/// @implNote Stateless utility class. Safe to call from any thread.
public final class TypedValues {

    /// Largest decimal exponent rendered without scientific notation. Covers every finite double.
    static final int MAX_PLAIN_EXPONENT = 400;

    private TypedValues() {}

    /// Coerces a configured expectation into a field's declared type.
    ///
    /// JSON numbers are taken as they are; everything else goes through the same text
    /// coercion as extracted values. A fractional number never coerces to `int`.
    ///
    /// @param expected configured value, may be null
    /// @param type declared field type, not null
    /// @return coerced value, or empty if null or not representable in the type
    public static Optional<Object> coerceExpected(Object expected, FieldType type) {
        Objects.requireNonNull(type, "type must not be null");
        if (expected == null) {
            return Optional.empty();
        }
        if (expected instanceof Number number && type.isNumeric()) {
            double d = number.doubleValue();
            if (!Double.isFinite(d)) {
                return Optional.empty();
            }
            if (type == FieldType.FLOAT) {
                return Optional.of(d);
            }
            if (isIntegral(number)) {
                return Optional.of(number.longValue());
            }
            return Optional.empty();
        }
        if (expected instanceof Boolean && type == FieldType.BOOLEAN) {
            return Optional.of(expected);
        }
        return TypeCoercer.convert(textOf(expected).trim(), type);
    }

    /// Compares two coerced values.
    ///
    /// Two `Long`s compare exactly; any other pair of numbers compares as doubles, with no
    /// tolerance. Non-numbers use {@link Object#equals}.
    ///
    /// @param left first value, may be null
    /// @param right second value, may be null
    /// @return true if the values are equal
    public static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Long l && right instanceof Long r) {
            return l.longValue() == r.longValue();
        }
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        return Objects.equals(left, right);
    }

    /// Renders a scalar as text. Floating-point numbers lose trailing zeros.
    ///
    /// Decimals whose exponent lies beyond {@link #MAX_PLAIN_EXPONENT} keep scientific
    /// notation (`1E+999999999`), so the text stays proportional to the input.
    ///
    /// @param value scalar value, may be null
    /// @return text form, or null if the value is null
    public static String textOf(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return plain(decimal);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? plain(new BigDecimal(Double.toString(d))) : value.toString();
        }
        return value.toString();
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Long
                || number instanceof Integer
                || number instanceof Short
                || number instanceof Byte) {
            return true;
        }
        if (number instanceof BigInteger big) {
            return big.bitLength() < 64;
        }
        double d = number.doubleValue();
        return d == Math.rint(d) && Math.abs(d) < 0x1p63;
    }

    private static String plain(BigDecimal decimal) {
        if (decimal.signum() == 0) {
            return "0";
        }
        BigDecimal stripped = decimal.stripTrailingZeros();
        long exponent = (long) stripped.precision() - stripped.scale() - 1;
        if (Math.abs(exponent) > MAX_PLAIN_EXPONENT) {
            return stripped.toString();
        }
        return stripped.toPlainString();
    }
}
