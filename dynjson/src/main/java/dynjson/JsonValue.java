package dynjson;

import java.beans.Introspector;
import java.lang.reflect.Array;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import lombok.SneakyThrows;
import org.jspecify.annotations.Nullable;

/**
 * A single JSON value: exactly one of null, boolean, integer, decimal, string, array or object.
 *
 * <p> Scalars are immutable records. {@link JsonArray} and {@link JsonObject} are mutable containers held by
 * reference, so storing one container in two places shares it.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * JsonValue v = JsonValue.of(42);
 * v.type();                   // -> INTEGER
 * v.convert(String.class);    // -> "42"
 * v.convert(JsonObject.class) // -> throws BadConversionException
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed interface JsonValue
        permits JsonArray, JsonBoolean, JsonDecimal, JsonInteger, JsonNull, JsonObject, JsonString {

    /**
     * Returns the kind of the held payload.
     */
    JsonType type();

    /**
     * Attempts to convert this value to {@code target}.
     *
     * <p> Primitive class tokens are treated as their wrapper types. Asking for {@link JsonValue} or the value's own
     * class returns the value itself.
     *
     * @param target target type, not {@code null}
     * @param <T>    result type
     * @return the converted value or the failure, never {@code null}
     */
    <T> Conversion<T> tryConvert(Class<T> target);

    /**
     * Converts this value to {@code target}.
     *
     * @throws JsonException.BadConversionException          if this kind cannot produce {@code target}
     * @throws JsonException.NotImplementedConversionException if the conversion is not supported yet
     * @see #tryConvert(Class)
     */
    default <T> T convert(Class<T> target) {
        return tryConvert(target).orElseThrow();
    }

    /**
     * Whether this is the empty value.
     */
    default boolean isNull() {
        return type() == JsonType.NULL;
    }

    default boolean isBoolean() {
        return type() == JsonType.BOOLEAN;
    }

    default boolean isInteger() {
        return type() == JsonType.INTEGER;
    }

    default boolean isSigned() {
        return isNumeric();
    }

    default boolean isNumeric() {
        return type() == JsonType.INTEGER || type() == JsonType.DECIMAL;
    }

    default boolean isString() {
        return type() == JsonType.STRING;
    }

    default boolean isArray() {
        return type() == JsonType.ARRAY;
    }

    default boolean isObject() {
        return type() == JsonType.OBJECT;
    }

    /**
     * Builds the JSON value for a plain Java object.
     *
     * <p> Maps, records and beans become objects that keep their member order; arrays, iterables become arrays.
     *
     * @param o any object, may be {@code null}
     * @return non-null JSON value
     */
    @SneakyThrows
    static JsonValue of(@Nullable Object o) {
        if (o == null) return JsonNull.INSTANCE;
        if (o instanceof JsonValue jsonValue) return jsonValue;
        if (o instanceof Boolean b) return JsonBoolean.of(b);
        if (o instanceof Long
                || o instanceof Integer
                || o instanceof Short
                || o instanceof Byte
                || o instanceof AtomicInteger
                || o instanceof AtomicLong) {
            return new JsonInteger(((Number) o).longValue());
        }
        if (o instanceof BigInteger bi) {
            return bi.bitLength() < Long.SIZE ? new JsonInteger(bi.longValue()) : new JsonDecimal(bi.doubleValue());
        }
        if (o instanceof Number n) return new JsonDecimal(n.doubleValue());
        if (o instanceof CharSequence s) return new JsonString(s.toString());
        if (o instanceof Character c) return new JsonString(String.valueOf(c));
        if (o instanceof Enum<?> e) return new JsonString(e.name());
        if (o instanceof Optional<?> optional) return of(optional.orElse(null));
        if (o.getClass().isArray()) {
            var array = new JsonArray();
            int len = Array.getLength(o);
            for (int i = 0; i < len; i++) array.add(of(Array.get(o, i)));
            return array;
        }
        if (o instanceof Iterable<?> iterable) {
            var array = new JsonArray();
            for (var e : iterable) array.add(of(e));
            return array;
        }
        if (o instanceof Map<?, ?> map) {
            var object = new JsonObject(true);
            for (var en : map.entrySet()) object.set(String.valueOf(en.getKey()), of(en.getValue()));
            return object;
        }
        if (o instanceof Record) {
            var object = new JsonObject(true);
            for (var c : o.getClass().getRecordComponents()) {
                var accessor = c.getAccessor();
                accessor.setAccessible(true);
                object.set(c.getName(), of(accessor.invoke(o)));
            }
            return object;
        }
        var object = new JsonObject(true);
        var beanInfo = Introspector.getBeanInfo(o.getClass());
        for (var property : beanInfo.getPropertyDescriptors()) {
            if (Objects.equals(property.getName(), "class")) continue;
            var readMethod = property.getReadMethod();
            if (readMethod == null) continue;
            object.set(property.getName(), of(readMethod.invoke(o)));
        }
        return object;
    }
}
