package dynjson;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A JSON array: an index-addressed list of {@link JsonValue}s.
 *
 * <p> Reads outside {@code [0, size)} yield {@link JsonNull} rather than failing. Serialization follows the same
 * compact/pretty conventions as {@link JsonObject}.
 *
 * <p> Not thread-safe.
 *
 * @since 0.1.0
 */
public final class JsonArray implements JsonValue, Iterable<JsonValue> {

    private final List<JsonValue> values;

    public JsonArray() {
        this.values = new ArrayList<>();
    }

    /**
     * Creates a shallow copy of {@code copy}, sharing nested containers.
     */
    public JsonArray(JsonArray copy) {
        this.values = new ArrayList<>(copy.values);
    }

    /**
     * Creates an array of {@link JsonValue#of(Object)} of each element.
     */
    public static JsonArray of(@Nullable Object... elements) {
        var array = new JsonArray();
        if (elements != null) for (var e : elements) array.add(JsonValue.of(e));
        return array;
    }

    /**
     * Returns the value at {@code index}, or {@link JsonNull} when the index is out of range.
     */
    public JsonValue get(int index) {
        return index >= 0 && index < values.size() ? values.get(index) : JsonNull.INSTANCE;
    }

    public @Nullable JsonArray getArray(int index) {
        return get(index) instanceof JsonArray array ? array : null;
    }

    public @Nullable JsonObject getObject(int index) {
        return get(index) instanceof JsonObject object ? object : null;
    }

    /**
     * Returns the value at {@code index} converted to {@code type}.
     *
     * @throws JsonException.ConversionException if the value cannot be converted
     */
    public <T> T getValue(int index, Class<T> type) {
        return get(index).convert(type);
    }

    /**
     * Returns the value at {@code index} converted to {@code type}, or {@code defaultValue} when the index is out of
     * range, holds the empty value, or cannot be converted.
     */
    public <T> @Nullable T optValue(int index, Class<T> type, @Nullable T defaultValue) {
        var value = get(index);
        if (value.isNull()) return defaultValue;
        return value.tryConvert(type).orElse(defaultValue);
    }

    @SuppressWarnings("unchecked")
    public <T> T optValue(int index, T defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue");
        return optValue(index, (Class<T>) defaultValue.getClass(), defaultValue);
    }

    public boolean isArray(int index) {
        return get(index).type() == JsonType.ARRAY;
    }

    public boolean isObject(int index) {
        return get(index).type() == JsonType.OBJECT;
    }

    public boolean isNull(int index) {
        return get(index).isNull();
    }

    public int size() {
        return values.size();
    }

    /**
     * Appends {@code value}. A {@code null} value is stored as {@link JsonNull}.
     *
     * @return this array
     */
    public JsonArray add(@Nullable JsonValue value) {
        values.add(value != null ? value : JsonNull.INSTANCE);
        return this;
    }

    public JsonArray add(@Nullable Object value) {
        return add(JsonValue.of(value));
    }

    /**
     * Replaces the value at {@code index}, padding with {@link JsonNull} when {@code index} is past the end.
     *
     * @return this array
     * @throws IndexOutOfBoundsException if {@code index} is negative
     */
    public JsonArray set(int index, @Nullable JsonValue value) {
        if (index < 0) throw new IndexOutOfBoundsException("Negative index: " + index);
        while (values.size() <= index) values.add(JsonNull.INSTANCE);
        values.set(index, value != null ? value : JsonNull.INSTANCE);
        return this;
    }

    public JsonArray set(int index, @Nullable Object value) {
        return set(index, JsonValue.of(value));
    }

    /**
     * Removes the value at {@code index}; does nothing when the index is out of range.
     */
    public void remove(int index) {
        if (index >= 0 && index < values.size()) values.remove(index);
    }

    public void clear() {
        values.clear();
    }

    /**
     * Returns a read-only view of the elements.
     */
    public List<JsonValue> values() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public Iterator<JsonValue> iterator() {
        return values().iterator();
    }

    public JsonArray copy() {
        return new JsonArray(this);
    }

    /**
     * Copies this array and, recursively, every nested array and object.
     */
    public JsonArray deepCopy() {
        var copy = new JsonArray();
        for (var v : values) copy.values.add(JsonObject.deepCopyOf(v));
        return copy;
    }

    public String stringify() {
        return stringify(0);
    }

    public String stringify(int indent) {
        var sb = new StringBuilder();
        stringify(sb, indent, -1);
        return sb.toString();
    }

    public void stringify(Appendable out, int indent) {
        stringify(out, indent, -1);
    }

    /**
     * Writes this array as JSON, with the same indentation rules as {@link JsonObject#stringify(Appendable, int, int)}.
     */
    public void stringify(Appendable out, int indent, int step) {
        if (step < 0) step = indent;
        try {
            out.append('[');
            if (indent > 0) out.append('\n');
            var it = values.iterator();
            while (it.hasNext()) {
                Stringifier.writeIndent(out, indent);
                Stringifier.stringify(it.next(), out, indent + step, step);
                if (it.hasNext()) out.append(',');
                if (step > 0) out.append('\n');
            }
            if (indent >= step) indent -= step;
            Stringifier.writeIndent(out, indent);
            out.append(']');
        } catch (IOException e) {
            throw new JsonException.WriteException("Failed to write JSON array", e);
        }
    }

    @Override
    public JsonType type() {
        return JsonType.ARRAY;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Conversion<T> tryConvert(Class<T> target) {
        return (Conversion<T>) Conversions.ofContainer(this, values.size(), target);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonArray other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return stringify();
    }
}
