package dynjson;

public record JsonDecimal(double value) implements JsonValue {

    @Override
    public JsonType type() {
        return JsonType.DECIMAL;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Conversion<T> tryConvert(Class<T> target) {
        return (Conversion<T>) Conversions.ofDouble(this, target);
    }

    @Override
    public String toString() {
        return Double.toString(value);
    }
}
