package dynjson;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A JSON object: unique string keys mapped to {@link JsonValue}s.
 *
 * <p> Iteration, {@link #getNames()} and serialization follow one of two orders fixed at construction: ascending
 * key order (the default), or the order in which keys were first {@link #set set}. Overwriting a key keeps its
 * position; removing a key removes it from the order as well.
 *
 * <p> Nested arrays and objects are held by reference. {@link #copy()} shares them, {@link #deepCopy()} does not.
 *
 * <p> Not thread-safe.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * var o = new JsonObject(true).set("b", 1).set("a", "x");
 * o.getNames();                      // -> [b, a]
 * o.getValue("b", Integer.class);    // -> 1
 * o.optValue("a", 7);                // -> 7
 * o.stringify();                     // -> {"b":1,"a":"x"}
 * }</pre>
 *
 * @since 0.1.0
 */
public final class JsonObject implements JsonValue, Iterable<Map.Entry<String, JsonValue>> {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonObject.class);

    private final Map<String, JsonValue> values;
    private final boolean preserveInsertionOrder;

    /**
     * Creates an empty object ordered by key.
     */
    public JsonObject() {
        this(false);
    }

    /**
     * Creates an empty object.
     *
     * @param preserveInsertionOrder {@code true} to keep keys in insertion order, {@code false} to sort them
     */
    public JsonObject(boolean preserveInsertionOrder) {
        this.preserveInsertionOrder = preserveInsertionOrder;
        this.values = preserveInsertionOrder ? new LinkedHashMap<>() : new TreeMap<>();
    }

    /**
     * Creates a shallow copy of {@code copy}: same ordering mode, same entries, nested containers shared.
     */
    public JsonObject(JsonObject copy) {
        this(copy.preserveInsertionOrder);
        values.putAll(copy.values);
    }

    public boolean isPreserveInsertionOrder() {
        return preserveInsertionOrder;
    }

    /**
     * Returns the value at {@code key}, or {@link JsonNull} when there is none.
     */
    public JsonValue get(String key) {
        var value = values.get(key);
        return value != null ? value : JsonNull.INSTANCE;
    }

    /**
     * Returns the array at {@code key}, or {@code null} when the key is absent or holds another kind.
     */
    public @Nullable JsonArray getArray(String key) {
        return values.get(key) instanceof JsonArray array ? array : null;
    }

    /**
     * Returns the object at {@code key}, or {@code null} when the key is absent or holds another kind.
     */
    public @Nullable JsonObject getObject(String key) {
        return values.get(key) instanceof JsonObject object ? object : null;
    }

    /**
     * Returns the value at {@code key} converted to {@code type}.
     *
     * <p> An absent key reads as the empty value, which fails every conversion except to {@link JsonValue}.
     *
     * @throws JsonException.ConversionException if the value cannot be converted
     */
    public <T> T getValue(String key, Class<T> type) {
        return get(key).convert(type);
    }

    /**
     * Returns the value at {@code key} converted to {@code type}, or {@code defaultValue} when the key is absent,
     * holds the empty value, or cannot be converted. Never throws a conversion failure.
     */
    public <T> @Nullable T optValue(String key, Class<T> type, @Nullable T defaultValue) {
        var value = values.get(key);
        if (value == null || value.isNull()) return defaultValue;
        var conversion = value.tryConvert(type);
        if (!conversion.isSuccess()) {
            LOGGER.debug("Using default for '{}': {}", key, conversion.failure().getMessage());
            return defaultValue;
        }
        return conversion.get();
    }

    /**
     * Same as {@link #optValue(String, Class, Object)}, with the target type taken from {@code defaultValue}.
     */
    @SuppressWarnings("unchecked")
    public <T> T optValue(String key, T defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue");
        return optValue(key, (Class<T>) defaultValue.getClass(), defaultValue);
    }

    /**
     * Returns all keys in this object's order.
     */
    public List<String> getNames() {
        return new ArrayList<>(values.keySet());
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public boolean isArray(String key) {
        var value = values.get(key);
        return value != null && value.type() == JsonType.ARRAY;
    }

    public boolean isObject(String key) {
        var value = values.get(key);
        return value != null && value.type() == JsonType.OBJECT;
    }

    /**
     * Whether {@code key} is absent or holds the empty value.
     */
    public boolean isNull(String key) {
        var value = values.get(key);
        return value == null || value.isNull();
    }

    public int size() {
        return values.size();
    }

    /**
     * Inserts or overwrites the value at {@code key}. A {@code null} value is stored as {@link JsonNull}.
     *
     * @return this object
     */
    public JsonObject set(String key, @Nullable JsonValue value) {
        Objects.requireNonNull(key, "key");
        values.put(key, value != null ? value : JsonNull.INSTANCE);
        return this;
    }

    /**
     * Inserts or overwrites the value at {@code key} with {@link JsonValue#of(Object)} of {@code value}.
     *
     * @return this object
     */
    public JsonObject set(String key, @Nullable Object value) {
        return set(key, JsonValue.of(value));
    }

    public void remove(String key) {
        values.remove(key);
    }

    public void clear() {
        values.clear();
    }

    /**
     * Returns a read-only view of the entries, in this object's order.
     */
    public Map<String, JsonValue> entries() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public Iterator<Map.Entry<String, JsonValue>> iterator() {
        return entries().entrySet().iterator();
    }

    /**
     * Shallow copy.
     */
    public JsonObject copy() {
        return new JsonObject(this);
    }

    /**
     * Copies this object and, recursively, every nested array and object.
     */
    public JsonObject deepCopy() {
        var copy = new JsonObject(preserveInsertionOrder);
        for (var en : values.entrySet()) copy.values.put(en.getKey(), deepCopyOf(en.getValue()));
        return copy;
    }

    static JsonValue deepCopyOf(JsonValue value) {
        if (value instanceof JsonObject o) return o.deepCopy();
        if (value instanceof JsonArray a) return a.deepCopy();
        return value;
    }

    /**
     * Returns the compact JSON text.
     */
    public String stringify() {
        return stringify(0);
    }

    /**
     * Returns the JSON text with {@code indent} spaces per level, or the compact text when {@code indent} is 0.
     */
    public String stringify(int indent) {
        var sb = new StringBuilder();
        stringify(sb, indent, -1);
        return sb.toString();
    }

    public void stringify(Appendable out, int indent) {
        stringify(out, indent, -1);
    }

    /**
     * Writes this object as JSON.
     *
     * @param out    output sink
     * @param indent indentation of the members, 0 for a single line
     * @param step   indentation added per nesting level, negative for {@code indent}
     * @throws JsonException.WriteException if a nested value cannot be written; {@code out} is then incomplete
     */
    public void stringify(Appendable out, int indent, int step) {
        if (step < 0) step = indent;
        try {
            out.append('{');
            if (indent > 0) out.append('\n');
            var it = values.entrySet().iterator();
            while (it.hasNext()) {
                var en = it.next();
                Stringifier.writeIndent(out, indent);
                Stringifier.writeString(out, en.getKey());
                out.append(indent > 0 ? " : " : ":");
                Stringifier.stringify(en.getValue(), out, indent + step, step);
                if (it.hasNext()) out.append(',');
                if (step > 0) out.append('\n');
            }
            if (indent >= step) indent -= step;
            Stringifier.writeIndent(out, indent);
            out.append('}');
        } catch (IOException e) {
            throw new JsonException.WriteException("Failed to write JSON object", e);
        }
    }

    @Override
    public JsonType type() {
        return JsonType.OBJECT;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Conversion<T> tryConvert(Class<T> target) {
        return (Conversion<T>) Conversions.ofContainer(this, values.size(), target);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonObject other && values.equals(other.values);
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
