package dynjson;

/**
 *
 *
 * @since 0.1.0
 */
public record JsonBoolean(boolean value) implements JsonValue {

    public static final JsonBoolean TRUE = new JsonBoolean(true);
    public static final JsonBoolean FALSE = new JsonBoolean(false);

    public static JsonBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public JsonType type() {
        return JsonType.BOOLEAN;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Conversion<T> tryConvert(Class<T> target) {
        return (Conversion<T>) Conversions.ofBoolean(this, target);
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }
}
