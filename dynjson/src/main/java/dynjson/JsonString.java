package dynjson;

import java.util.Objects;

/**
 *
 *
 * @since 0.1.0
 */
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public JsonType type() {
        return JsonType.STRING;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Conversion<T> tryConvert(Class<T> target) {
        return (Conversion<T>) Conversions.ofString(this, target);
    }

    @Override
    public String toString() {
        return Stringifier.condense(this);
    }
}
