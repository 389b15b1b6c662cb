package dynjson;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import org.jspecify.annotations.Nullable;

/**
 * Per-kind conversion tables behind {@link JsonValue#tryConvert(Class)}.
 *
 * @since 0.1.0
 */
final class Conversions {

    // 2^63 as a double, the first value past Long.MAX_VALUE
    private static final double LONG_LIMIT = 9.223372036854775808E18;

    // containers convert to their pretty-printed text at this indent
    private static final int TEXT_INDENT = 2;

    private Conversions() {
        throw new UnsupportedOperationException();
    }

    static Conversion<?> ofNull(JsonNull source, Class<?> target) {
        var self = self(source, target);
        if (self != null) return self;
        return bad("Cannot convert empty value to " + boxed(target).getSimpleName(), source, target);
    }

    static Conversion<?> ofBoolean(JsonBoolean source, Class<?> target) {
        var self = self(source, target);
        if (self != null) return self;
        var raw = boxed(target);
        if (raw == Boolean.class) return Conversion.success(source.value());
        if (raw == String.class) return Conversion.success(source.value() ? "true" : "false");
        if (isNumber(raw)) return ofLong(source, source.value() ? 1L : 0L, target);
        return unsupported(source, target);
    }

    static Conversion<?> ofLong(JsonValue source, long v, Class<?> target) {
        var self = self(source, target);
        if (self != null) return self;
        var raw = boxed(target);
        if (raw == Long.class || raw == Number.class) return Conversion.success(v);
        if (raw == Integer.class) {
            return fits(v, Integer.MIN_VALUE, Integer.MAX_VALUE)
                    ? Conversion.success((int) v)
                    : outOfRange(v, source, target);
        }
        if (raw == Short.class) {
            return fits(v, Short.MIN_VALUE, Short.MAX_VALUE) ? Conversion.success((short) v) : outOfRange(v, source, target);
        }
        if (raw == Byte.class) {
            return fits(v, Byte.MIN_VALUE, Byte.MAX_VALUE) ? Conversion.success((byte) v) : outOfRange(v, source, target);
        }
        if (raw == Double.class) return Conversion.success((double) v);
        if (raw == Float.class) return Conversion.success((float) v);
        if (raw == BigInteger.class) return Conversion.success(BigInteger.valueOf(v));
        if (raw == BigDecimal.class) return Conversion.success(BigDecimal.valueOf(v));
        if (raw == Boolean.class) return Conversion.success(v != 0);
        if (raw == String.class) return Conversion.success(Long.toString(v));
        if (raw == Character.class) {
            return fits(v, Character.MIN_VALUE, Character.MAX_VALUE)
                    ? Conversion.success((char) v)
                    : outOfRange(v, source, target);
        }
        // integers are read as epoch milliseconds
        if (raw == Instant.class) return Conversion.success(Instant.ofEpochMilli(v));
        if (raw == LocalDateTime.class) {
            return Conversion.success(LocalDateTime.ofInstant(Instant.ofEpochMilli(v), ZoneOffset.UTC));
        }
        if (raw == LocalDate.class) {
            return Conversion.success(LocalDate.ofInstant(Instant.ofEpochMilli(v), ZoneOffset.UTC));
        }
        return unsupported(source, target);
    }

    static Conversion<?> ofDouble(JsonDecimal source, Class<?> target) {
        var self = self(source, target);
        if (self != null) return self;
        var raw = boxed(target);
        double d = source.value();
        if (raw == Double.class || raw == Number.class) return Conversion.success(d);
        if (raw == Float.class) {
            if (Double.isFinite(d) && Math.abs(d) > Float.MAX_VALUE) return outOfRange(d, source, target);
            return Conversion.success((float) d);
        }
        if (raw == Long.class || raw == Integer.class || raw == Short.class || raw == Byte.class) {
            if (!Double.isFinite(d) || d < -LONG_LIMIT || d >= LONG_LIMIT) return outOfRange(d, source, target);
            return ofLong(source, (long) d, target);
        }
        if (raw == BigInteger.class || raw == BigDecimal.class) {
            if (!Double.isFinite(d)) return outOfRange(d, source, target);
            var bd = BigDecimal.valueOf(d);
            return Conversion.success(raw == BigDecimal.class ? bd : bd.toBigInteger());
        }
        if (raw == Boolean.class) return Conversion.success(d != 0);
        if (raw == String.class) return Conversion.success(Double.toString(d));
        return unsupported(source, target);
    }

    static Conversion<?> ofString(JsonString source, Class<?> target) {
        var self = self(source, target);
        if (self != null) return self;
        var raw = boxed(target);
        String s = source.value();
        if (raw == String.class) return Conversion.success(s);
        if (raw == Boolean.class) {
            return Conversion.success(!(s.isEmpty() || s.equals("0") || s.equalsIgnoreCase("false")));
        }
        if (raw == Character.class) return Conversion.success(s.isEmpty() ? '\0' : s.charAt(0));
        if (isNumber(raw)) return parseNumber(source, target);
        try {
            if (raw == Instant.class) return Conversion.success(Instant.parse(s));
            if (raw == LocalDateTime.class) return Conversion.success(LocalDateTime.parse(s));
            if (raw == LocalDate.class) return Conversion.success(LocalDate.parse(s));
        } catch (DateTimeParseException e) {
            return Conversion.failure(new JsonException.BadConversionException(
                    "Cannot parse " + raw.getSimpleName() + " from string: '" + s + "'", source.type(), target, e));
        }
        return unsupported(source, target);
    }

    static Conversion<?> ofContainer(JsonValue source, int size, Class<?> target) {
        var self = self(source, target);
        if (self != null) return self;
        var raw = boxed(target);
        if (raw == Boolean.class) return Conversion.success(size > 0);
        if (raw == String.class) return ofContainerText(source, target);
        if (raw == Instant.class || raw == LocalDateTime.class || raw == LocalDate.class) {
            return Conversion.failure(new JsonException.NotImplementedConversionException(source.type(), target));
        }
        return unsupported(source, target);
    }

    private static Conversion<?> ofContainerText(JsonValue source, Class<?> target) {
        var sb = new StringBuilder();
        try {
            Stringifier.stringify(source, sb, TEXT_INDENT, TEXT_INDENT);
        } catch (JsonException.WriteException e) {
            return Conversion.failure(new JsonException.BadConversionException(
                    "Cannot write " + source.type() + " as text: " + e.getMessage(), source.type(), target, e));
        }
        return Conversion.success(sb.toString());
    }

    private static Conversion<?> parseNumber(JsonString source, Class<?> target) {
        var raw = boxed(target);
        String s = source.value().trim();
        BigDecimal bd;
        try {
            bd = new BigDecimal(s);
        } catch (NumberFormatException e) {
            return Conversion.failure(new JsonException.BadConversionException(
                    "Cannot parse number from string: '" + source.value() + "' for type " + raw.getSimpleName(),
                    source.type(),
                    target,
                    e));
        }
        if (raw == BigDecimal.class || raw == Number.class) return Conversion.success(bd);
        if (raw == Double.class) return Conversion.success(bd.doubleValue());
        if (raw == Float.class) return Conversion.success(bd.floatValue());
        try {
            if (raw == BigInteger.class) return Conversion.success(bd.toBigIntegerExact());
            return ofLong(source, bd.longValueExact(), target);
        } catch (ArithmeticException e) {
            return Conversion.failure(new JsonException.BadConversionException(
                    "Value '" + source.value() + "' is not representable as " + raw.getSimpleName(),
                    source.type(),
                    target,
                    e));
        }
    }

    /**
     * Target is the value's own class or one of its supertypes: no conversion needed.
     */
    private static @Nullable Conversion<?> self(JsonValue source, Class<?> target) {
        return target.isInstance(source) ? Conversion.success(source) : null;
    }

    static Class<?> boxed(Class<?> c) {
        if (!c.isPrimitive()) return c;
        if (c == int.class) return Integer.class;
        if (c == long.class) return Long.class;
        if (c == double.class) return Double.class;
        if (c == boolean.class) return Boolean.class;
        if (c == float.class) return Float.class;
        if (c == short.class) return Short.class;
        if (c == byte.class) return Byte.class;
        if (c == char.class) return Character.class;
        return Void.class;
    }

    private static boolean isNumber(Class<?> raw) {
        return raw == Long.class
                || raw == Integer.class
                || raw == Short.class
                || raw == Byte.class
                || raw == Double.class
                || raw == Float.class
                || raw == BigInteger.class
                || raw == BigDecimal.class
                || raw == Number.class;
    }

    private static boolean fits(long v, long min, long max) {
        return v >= min && v <= max;
    }

    private static Conversion<?> outOfRange(Object v, JsonValue source, Class<?> target) {
        return bad("Value " + v + " out of range for " + boxed(target).getSimpleName(), source, target);
    }

    private static Conversion<?> unsupported(JsonValue source, Class<?> target) {
        return bad("Cannot convert " + source.type() + " to " + boxed(target).getSimpleName(), source, target);
    }

    private static Conversion<?> bad(String message, JsonValue source, Class<?> target) {
        return Conversion.failure(new JsonException.BadConversionException(message, source.type(), target));
    }
}
