package dynjson;

/**
 * Integral number. Narrower targets ({@code int}, {@code short}, {@code byte}, {@code char}) are range-checked on
 * conversion.
 *
 * @since 0.1.0
 */
public record JsonInteger(long value) implements JsonValue {

    @Override
    public JsonType type() {
        return JsonType.INTEGER;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Conversion<T> tryConvert(Class<T> target) {
        return (Conversion<T>) Conversions.ofLong(this, value, target);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
