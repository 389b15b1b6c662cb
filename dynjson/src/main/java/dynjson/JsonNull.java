package dynjson;

/**
 * The empty value.
 *
 * @since 0.1.0
 */
public record JsonNull() implements JsonValue {

    public static final JsonNull INSTANCE = new JsonNull();

    @Override
    public JsonType type() {
        return JsonType.NULL;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Conversion<T> tryConvert(Class<T> target) {
        return (Conversion<T>) Conversions.ofNull(this, target);
    }

    @Override
    public String toString() {
        return "null";
    }
}
